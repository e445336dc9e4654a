package io.github.goodees.aggregates.subscription;

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

import io.github.goodees.aggregates.store.EventData;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.ExpectedVersion;
import io.github.goodees.aggregates.store.RecordedEvent;
import io.github.goodees.aggregates.store.StartFrom;
import io.github.goodees.aggregates.store.Subscriber;
import io.github.goodees.aggregates.store.Subscription;
import io.github.goodees.aggregates.store.inmemory.InMemoryEventStore;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SubscriptionManagerTest {
    private static final ExecutorService executor = Executors.newCachedThreadPool();

    @Rule
    public TestName testName = new TestName();

    private InMemoryEventStore store;

    @Before
    public void setUp() {
        store = new InMemoryEventStore(null, executor);
    }

    @AfterClass
    public static void shutdown() {
        executor.shutdownNow();
    }

    private String name() {
        return testName.getMethodName();
    }

    static class CollectingSubscriber implements Subscriber {
        final List<List<RecordedEvent>> batches = new CopyOnWriteArrayList<>();
        final List<RecordedEvent> events = new CopyOnWriteArrayList<>();
        final AtomicInteger subscribedCalls = new AtomicInteger();
        volatile boolean subscribedBeforeEvents = true;
        volatile int failAfter = Integer.MAX_VALUE;

        @Override
        public void onSubscribed(Subscription subscription) {
            if (!events.isEmpty()) {
                subscribedBeforeEvents = false;
            }
            subscribedCalls.incrementAndGet();
        }

        @Override
        public void onEvents(List<RecordedEvent> batch) throws Exception {
            if (subscribedCalls.get() == 0) {
                subscribedBeforeEvents = false;
            }
            if (batches.size() >= failAfter) {
                throw new Exception("Subscriber refuses " + batch);
            }
            batches.add(batch);
            events.addAll(batch);
        }

        void awaitEvents(int count) {
            await(() -> events.size() >= count, "Expected " + count + " events, got " + events.size());
            assertEquals(count, events.size());
        }

        List<Object> payloads() {
            List<Object> result = new ArrayList<>();
            for (RecordedEvent event : events) {
                result.add(event.getData());
            }
            return result;
        }
    }

    static void await(BooleanSupplier condition, String message) {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail(message);
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted");
            }
        }
    }

    /**
     * Give in-flight deliveries a chance to arrive, when asserting that nothing more arrives.
     */
    static void settle() throws InterruptedException {
        Thread.sleep(100);
    }

    private void append(String stream, String... payloads) throws EventStoreException {
        List<EventData> events = new ArrayList<>();
        for (String payload : payloads) {
            events.add(new EventData("Test", payload));
        }
        store.appendToStream(stream, ExpectedVersion.ANY_VERSION, events);
    }

    @Test
    public void transient_subscription_receives_only_later_appends() throws Exception {
        String stream = name();
        append(stream, "before");
        CollectingSubscriber subscriber = new CollectingSubscriber();
        Subscription subscription = store.subscribe(stream, subscriber);
        assertFalse(subscription.isDurable());
        assertNull(subscription.getName());
        assertEquals(Subscription.Status.SUBSCRIBED, subscription.getStatus());

        append(stream, "a", "b");
        append("other", "ignored");
        append(stream, "c");

        subscriber.awaitEvents(3);
        assertThat(subscriber.payloads(), contains("a", "b", "c"));
        assertEquals(2, subscriber.batches.size());
        assertTrue(subscriber.subscribedBeforeEvents);
        settle();
        assertEquals(3, subscriber.events.size());
    }

    @Test
    public void transient_subscription_to_all_receives_every_stream() throws Exception {
        CollectingSubscriber subscriber = new CollectingSubscriber();
        Subscription subscription = store.subscribe(EventStore.ALL_STREAMS, subscriber);
        append("one", "a");
        append("two", "b");
        append("one", "c");
        subscriber.awaitEvents(3);
        assertThat(subscriber.payloads(), contains("a", "b", "c"));

        store.unsubscribe(subscription);
        assertFalse(subscription.isActive());
        append("one", "d");
        settle();
        assertEquals(3, subscriber.events.size());
    }

    @Test
    public void durable_subscription_receives_history_and_concurrent_appends_exactly_once() throws Exception {
        String stream = name();
        for (int i = 0; i < 50; i++) {
            append(stream, "e" + i);
        }
        CollectingSubscriber subscriber = new CollectingSubscriber();
        Future<?> writer = executor.submit(() -> {
            for (int i = 50; i < 100; i++) {
                append(stream, "e" + i);
            }
            return null;
        });
        Subscription subscription = store.subscribeTo(stream, "projection", subscriber, StartFrom.ORIGIN);
        writer.get(5, TimeUnit.SECONDS);

        subscriber.awaitEvents(100);
        for (int i = 0; i < 100; i++) {
            assertEquals(i, subscriber.events.get(i).getStreamVersion());
            assertEquals("e" + i, subscriber.events.get(i).getData());
        }
        assertTrue(subscriber.subscribedBeforeEvents);
        assertTrue(subscription.isDurable());
        await(() -> subscription.getStatus() == Subscription.Status.SUBSCRIBED, "Subscription should catch up");

        append(stream, "live");
        subscriber.awaitEvents(101);
        settle();
        assertEquals(101, subscriber.events.size());
    }

    @Test
    public void durable_subscription_to_all_is_ordered_by_event_number() throws Exception {
        append("one", "a", "b");
        append("two", "c");
        CollectingSubscriber subscriber = new CollectingSubscriber();
        store.subscribeTo(EventStore.ALL_STREAMS, "everything", subscriber, StartFrom.ORIGIN);
        append("two", "d");
        append("one", "e");
        subscriber.awaitEvents(5);
        long previous = 0;
        for (RecordedEvent event : subscriber.events) {
            assertEquals(previous + 1, event.getEventNumber());
            previous = event.getEventNumber();
        }
        assertThat(subscriber.payloads(), contains("a", "b", "c", "d", "e"));
    }

    @Test
    public void appends_are_delivered_as_whole_batches() throws Exception {
        String stream = name();
        append(stream, "a", "b", "c");
        CollectingSubscriber subscriber = new CollectingSubscriber();
        Subscription subscription = store.subscribeTo(stream, "batches", subscriber, StartFrom.ORIGIN);
        await(() -> subscription.getStatus() == Subscription.Status.SUBSCRIBED, "Subscription should catch up");
        append(stream, "d", "e");
        subscriber.awaitEvents(5);
        assertEquals(2, subscriber.batches.size());
        assertEquals(3, subscriber.batches.get(0).size());
        assertEquals(2, subscriber.batches.get(1).size());
    }

    @Test
    public void subscription_from_current_skips_history() throws Exception {
        String stream = name();
        append(stream, "old");
        CollectingSubscriber subscriber = new CollectingSubscriber();
        Subscription subscription = store.subscribeTo(stream, "current", subscriber, StartFrom.CURRENT);
        await(() -> subscription.getStatus() == Subscription.Status.SUBSCRIBED, "Subscription should catch up");
        append(stream, "new");
        subscriber.awaitEvents(1);
        assertThat(subscriber.payloads(), contains("new"));
        assertEquals(1, subscription.getLastAcknowledged());
    }

    @Test
    public void subscription_after_position_skips_earlier_events() throws Exception {
        String stream = name();
        append(stream, "a");
        append(stream, "b");
        append(stream, "c");
        CollectingSubscriber subscriber = new CollectingSubscriber();
        store.subscribeTo(stream, "after", subscriber, StartFrom.after(2));
        subscriber.awaitEvents(1);
        assertThat(subscriber.payloads(), contains("c"));
    }

    @Test
    public void resubscription_resumes_after_last_acknowledged_event() throws Exception {
        String stream = name();
        append(stream, "a");
        append(stream, "b");
        append(stream, "c");
        CollectingSubscriber first = new CollectingSubscriber();
        Subscription subscription = store.subscribeTo(stream, "resume", first, StartFrom.ORIGIN);
        first.awaitEvents(3);
        store.ackEvent(subscription, first.events.get(1));
        assertEquals(2, subscription.getLastAcknowledged());
        store.unsubscribe(subscription);
        assertEquals(1, store.subscriptionCount());

        append(stream, "d");
        CollectingSubscriber second = new CollectingSubscriber();
        // start position is ignored for existing subscription
        store.subscribeTo(stream, "resume", second, StartFrom.CURRENT);
        second.awaitEvents(2);
        assertThat(second.payloads(), contains("c", "d"));
    }

    @Test
    public void acknowledging_older_event_is_ignored() throws Exception {
        String stream = name();
        append(stream, "a");
        append(stream, "b");
        CollectingSubscriber subscriber = new CollectingSubscriber();
        Subscription subscription = store.subscribeTo(stream, "acks", subscriber, StartFrom.ORIGIN);
        subscriber.awaitEvents(2);
        store.ackEvent(subscription, subscriber.events.get(1));
        store.ackEvent(subscription, subscriber.events.get(0));
        assertEquals(2, subscription.getLastAcknowledged());
    }

    @Test
    public void acknowledging_on_transient_subscription_is_ignored() throws Exception {
        String stream = name();
        CollectingSubscriber subscriber = new CollectingSubscriber();
        Subscription subscription = store.subscribe(stream, subscriber);
        append(stream, "a");
        subscriber.awaitEvents(1);
        store.ackEvent(subscription, subscriber.events.get(0));
        assertEquals(0, subscription.getLastAcknowledged());
    }

    @Test
    public void second_subscriber_of_same_name_is_rejected() throws Exception {
        String stream = name();
        Subscription first = store.subscribeTo(stream, "single", new CollectingSubscriber(), StartFrom.ORIGIN);
        try {
            store.subscribeTo(stream, "single", new CollectingSubscriber(), StartFrom.ORIGIN);
            fail("Second subscriber should be rejected");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.SUBSCRIPTION_ALREADY_EXISTS, e.getFault());
        }
        // same name on another stream is another subscription
        store.subscribeTo(stream + "-other", "single", new CollectingSubscriber(), StartFrom.ORIGIN);

        store.unsubscribe(first);
        Subscription again = store.subscribeTo(stream, "single", new CollectingSubscriber(), StartFrom.ORIGIN);
        assertTrue(again.isActive());
    }

    @Test
    public void deleted_subscription_stops_delivery() throws Exception {
        String stream = name();
        CollectingSubscriber subscriber = new CollectingSubscriber();
        Subscription subscription = store.subscribeTo(stream, "deleted", subscriber, StartFrom.ORIGIN);
        store.deleteSubscription(stream, "deleted");
        assertFalse(subscription.isActive());
        assertEquals(0, store.subscriptionCount());
        append(stream, "a");
        settle();
        assertTrue(subscriber.events.isEmpty());

        try {
            store.deleteSubscription(stream, "deleted");
            fail("Subscription should not exist anymore");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.SUBSCRIPTION_NOT_FOUND, e.getFault());
        }
    }

    @Test
    public void failing_subscriber_is_detached_and_record_kept() throws Exception {
        String stream = name();
        CollectingSubscriber failing = new CollectingSubscriber();
        failing.failAfter = 1;
        Subscription subscription = store.subscribeTo(stream, "fragile", failing, StartFrom.ORIGIN);
        append(stream, "a");
        failing.awaitEvents(1);
        store.ackEvent(subscription, failing.events.get(0));
        append(stream, "b");
        await(() -> !subscription.isActive(), "Failing subscriber should be detached");
        append(stream, "c");
        settle();
        assertEquals(1, failing.events.size());
        assertEquals(1, store.subscriptionCount());

        CollectingSubscriber healthy = new CollectingSubscriber();
        store.subscribeTo(stream, "fragile", healthy, StartFrom.ORIGIN);
        healthy.awaitEvents(2);
        assertThat(healthy.payloads(), contains("b", "c"));
    }

    @Test
    public void foreign_subscription_handle_is_rejected() {
        Subscription foreign = new Subscription() {
            @Override
            public String getName() {
                return "foreign";
            }

            @Override
            public String getStreamId() {
                return "stream";
            }

            @Override
            public boolean isDurable() {
                return true;
            }

            @Override
            public Status getStatus() {
                return Status.SUBSCRIBED;
            }

            @Override
            public long getLastAcknowledged() {
                return 0;
            }

            @Override
            public boolean isActive() {
                return true;
            }
        };
        try {
            store.unsubscribe(foreign);
            fail("Foreign handle should be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    private static RecordedEvent recorded(String stream, long version, long eventNumber) {
        return RecordedEvent.builder()
                .eventId(UUID.randomUUID())
                .streamId(stream)
                .streamVersion(version)
                .eventNumber(eventNumber)
                .eventType("Test")
                .data("#" + eventNumber)
                .createdAt(Instant.now())
                .build();
    }

    static class EmptyHistory implements EventHistory {
        @Override
        public List<List<RecordedEvent>> readBatches(String streamId, long afterPosition, int maxEvents) {
            return Collections.emptyList();
        }

        @Override
        public long currentPosition(String streamId) {
            return 0;
        }
    }

    @Test
    public void out_of_order_publications_are_released_in_event_number_order() {
        SubscriptionManager manager = new SubscriptionManager("reorder", new EmptyHistory(), executor, 0);
        CollectingSubscriber subscriber = new CollectingSubscriber();
        manager.subscribe(EventStore.ALL_STREAMS, subscriber);

        List<RecordedEvent> third = Collections.singletonList(recorded("b", 0, 4));
        List<RecordedEvent> second = Collections.singletonList(recorded("a", 2, 3));
        List<RecordedEvent> first = new ArrayList<>();
        first.add(recorded("a", 0, 1));
        first.add(recorded("a", 1, 2));

        manager.publish(third);
        manager.publish(second);
        assertEquals("Nothing can be released before first append", 0, manager.lastPublished());
        manager.publish(first);
        assertEquals(4, manager.lastPublished());

        subscriber.awaitEvents(4);
        assertThat(subscriber.payloads(), contains("#1", "#2", "#3", "#4"));
        assertEquals(3, subscriber.batches.size());
        assertSame(first, subscriber.batches.get(0));

        // duplicate publication is ignored
        manager.publish(second);
        assertEquals(4, manager.lastPublished());
    }

    /**
     * History of appends written by some other writer of the same storage.
     */
    static class ForeignHistory implements EventHistory {
        final List<List<RecordedEvent>> batches = new CopyOnWriteArrayList<>();

        @Override
        public List<List<RecordedEvent>> readBatches(String streamId, long afterPosition, int maxEvents) {
            List<List<RecordedEvent>> result = new ArrayList<>();
            for (List<RecordedEvent> batch : batches) {
                if (batch.get(0).getEventNumber() > afterPosition && result.size() < maxEvents) {
                    result.add(batch);
                }
            }
            return result;
        }

        @Override
        public long currentPosition(String streamId) {
            return batches.isEmpty() ? 0 : batches.get(batches.size() - 1).get(0).getEventNumber();
        }
    }

    @Test
    public void appends_of_other_writers_are_released_from_history() {
        ForeignHistory history = new ForeignHistory();
        SubscriptionManager manager = new SubscriptionManager("foreign", history, executor, 0);
        CollectingSubscriber subscriber = new CollectingSubscriber();
        manager.subscribe(EventStore.ALL_STREAMS, subscriber);

        List<RecordedEvent> foreign = Collections.singletonList(recorded("other", 0, 1));
        List<RecordedEvent> own = Collections.singletonList(recorded("mine", 0, 2));
        history.batches.add(foreign);
        history.batches.add(own);
        manager.publish(own);

        assertEquals(2, manager.lastPublished());
        subscriber.awaitEvents(2);
        assertThat(subscriber.payloads(), contains("#1", "#2"));
        assertEquals(2, subscriber.batches.size());
    }

    @Test
    public void refresh_releases_appends_committed_elsewhere() throws Exception {
        ForeignHistory history = new ForeignHistory();
        SubscriptionManager manager = new SubscriptionManager("refresh", history, executor, 0);
        CollectingSubscriber subscriber = new CollectingSubscriber();
        manager.subscribe(EventStore.ALL_STREAMS, subscriber);

        history.batches.add(Collections.singletonList(recorded("other", 0, 1)));
        history.batches.add(Collections.singletonList(recorded("other", 1, 2)));
        manager.refresh();
        subscriber.awaitEvents(2);

        // a late publication of the same append changes nothing
        manager.publish(history.batches.get(1));
        settle();
        assertEquals(2, subscriber.events.size());
    }

    @Test
    public void drained_subscription_mailboxes_are_released() {
        SubscriptionManager manager = new SubscriptionManager("mailboxes", new EmptyHistory(), executor, 0);
        for (int i = 0; i < 2000; i++) {
            Subscription subscription = manager.subscribe("stream-" + (i % 10), new CollectingSubscriber());
            manager.unsubscribe(subscription);
        }
        manager.subscribe(EventStore.ALL_STREAMS, new CollectingSubscriber());
        manager.reset(0);
        await(() -> manager.busyMailboxCount() == 0,
            "Mailboxes should be released, " + manager.busyMailboxCount() + " remain");
        assertEquals(0, manager.subscriptionCount());
    }

    @Test
    public void position_depends_on_subscribed_stream() {
        RecordedEvent event = recorded("a", 4, 17);
        assertEquals(17, SubscriptionManager.position(EventStore.ALL_STREAMS, event));
        assertEquals(5, SubscriptionManager.position("a", event));
    }
}
