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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Events of single stream in version order, read lazily in pages. Every call to {@link #iterator()} starts again at
 * the start version, so the stream can be consumed any number of times. A page is read only when the previous one
 * was consumed, therefore the stream ends at the stream length observed when reading its last page.
 */
public final class EventStream implements Iterable<RecordedEvent> {

    /**
     * Source of pages of recorded events.
     */
    @FunctionalInterface
    public interface PageReader {
        /**
         * Read events starting at given version.
         * @param fromVersion first stream version to return
         * @param maxCount maximum number of events to return
         * @return events in version order, fewer than maxCount at the end of the stream
         * @throws EventStoreException when reading fails
         */
        List<RecordedEvent> read(long fromVersion, int maxCount) throws EventStoreException;
    }

    private final String streamId;
    private final long startVersion;
    private final int batchSize;
    private final PageReader reader;

    public EventStream(String streamId, long startVersion, int batchSize, PageReader reader) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        if (startVersion < 0) {
            throw new IllegalArgumentException("Start version must not be negative: " + startVersion);
        }
        this.streamId = streamId;
        this.startVersion = startVersion;
        this.batchSize = batchSize;
        this.reader = reader;
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * Iterate over events. Read failures surface as {@link IllegalStateException} with the
     * {@link EventStoreException} as its cause; use {@link #foreach(Consumer)} or {@link #reduce(Object, BiFunction)}
     * to receive the checked exception instead.
     */
    @Override
    public Iterator<RecordedEvent> iterator() {
        return new PagingIterator();
    }

    public void foreach(Consumer<? super RecordedEvent> consumer) throws EventStoreException {
        try {
            for (RecordedEvent event : this) {
                consumer.accept(event);
            }
        } catch (ReadFailed e) {
            throw e.failure;
        }
    }

    public <R> R reduce(R identity, BiFunction<R, ? super RecordedEvent, R> accumulator) throws EventStoreException {
        R result = identity;
        try {
            for (RecordedEvent event : this) {
                result = accumulator.apply(result, event);
            }
        } catch (ReadFailed e) {
            throw e.failure;
        }
        return result;
    }

    public List<RecordedEvent> toList() throws EventStoreException {
        List<RecordedEvent> result = new ArrayList<>();
        foreach(result::add);
        return result;
    }

    private static class ReadFailed extends IllegalStateException {
        private final EventStoreException failure;

        ReadFailed(EventStoreException cause) {
            super(cause.getMessage(), cause);
            this.failure = cause;
        }
    }

    private class PagingIterator implements Iterator<RecordedEvent> {
        private List<RecordedEvent> page = Collections.emptyList();
        private int index;
        private long nextVersion = startVersion;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (index < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            fetch();
            return index < page.size();
        }

        private void fetch() {
            try {
                page = reader.read(nextVersion, batchSize);
            } catch (EventStoreException e) {
                throw new ReadFailed(e);
            }
            index = 0;
            nextVersion += page.size();
            if (page.size() < batchSize) {
                exhausted = true;
            }
        }

        @Override
        public RecordedEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.get(index++);
        }
    }
}
