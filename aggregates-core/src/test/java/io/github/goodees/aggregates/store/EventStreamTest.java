package io.github.goodees.aggregates.store;

/*-
 * #%L
 * aggregates-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventStreamTest {
    private final AtomicInteger reads = new AtomicInteger();

    private EventStream.PageReader reader(int streamLength) {
        return (from, max) -> {
            reads.incrementAndGet();
            List<RecordedEvent> page = new ArrayList<>();
            for (long v = from; v < Math.min(streamLength, from + max); v++) {
                page.add(event(v));
            }
            return page;
        };
    }

    private static RecordedEvent event(long version) {
        return RecordedEvent.builder()
                .eventId(UUID.randomUUID())
                .streamId("stream")
                .streamVersion(version)
                .eventNumber(version + 1)
                .eventType("Test")
                .data(version)
                .createdAt(Instant.now())
                .build();
    }

    private static List<Long> versions(Iterable<RecordedEvent> events) {
        List<Long> result = new ArrayList<>();
        for (RecordedEvent event : events) {
            result.add(event.getStreamVersion());
        }
        return result;
    }

    @Test
    public void nothing_is_read_until_iteration() {
        EventStream stream = new EventStream("stream", 0, 2, reader(5));
        Iterator<RecordedEvent> iterator = stream.iterator();
        assertEquals(0, reads.get());
        assertTrue(iterator.hasNext());
        assertEquals(1, reads.get());
    }

    @Test
    public void stream_is_read_in_pages() {
        EventStream stream = new EventStream("stream", 0, 2, reader(5));
        assertThat(versions(stream), contains(0L, 1L, 2L, 3L, 4L));
        // pages of 2, 2 and 1, the short page ends the stream
        assertEquals(3, reads.get());
    }

    @Test
    public void stream_starts_at_given_version() {
        EventStream stream = new EventStream("stream", 3, 10, reader(5));
        assertThat(versions(stream), contains(3L, 4L));
    }

    @Test
    public void stream_is_restartable() throws EventStoreException {
        EventStream stream = new EventStream("stream", 1, 2, reader(4));
        assertThat(versions(stream), contains(1L, 2L, 3L));
        assertThat(versions(stream.toList()), contains(1L, 2L, 3L));
    }

    @Test
    public void reduce_folds_in_order() throws EventStoreException {
        EventStream stream = new EventStream("stream", 0, 3, reader(4));
        String folded = stream.reduce("", (acc, event) -> acc + event.getStreamVersion());
        assertEquals("0123", folded);
    }

    @Test
    public void read_failure_is_rethrown_as_checked_exception() {
        EventStoreException failure = EventStoreException.storeFailed("stream", new IllegalStateException("gone"));
        EventStream stream = new EventStream("stream", 0, 2, (from, max) -> {
            if (from > 0) {
                throw failure;
            }
            return reader(5).read(from, max);
        });
        List<RecordedEvent> seen = new ArrayList<>();
        try {
            stream.foreach(seen::add);
            fail("Read failure should be propagated");
        } catch (EventStoreException e) {
            assertSame(failure, e);
        }
        assertEquals(2, seen.size());
    }

    @Test
    public void empty_stream_has_no_elements() {
        EventStream stream = new EventStream("stream", 0, 2, reader(0));
        assertFalse(stream.iterator().hasNext());
    }

    @Test(expected = IllegalArgumentException.class)
    public void batch_size_must_be_positive() {
        new EventStream("stream", 0, 0, reader(1));
    }
}
