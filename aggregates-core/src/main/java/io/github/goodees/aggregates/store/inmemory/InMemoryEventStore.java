package io.github.goodees.aggregates.store.inmemory;

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
import io.github.goodees.aggregates.store.EventStream;
import io.github.goodees.aggregates.store.ExpectedVersion;
import io.github.goodees.aggregates.store.RecordedEvent;
import io.github.goodees.aggregates.store.Serialization;
import io.github.goodees.aggregates.store.SnapshotData;
import io.github.goodees.aggregates.store.StartFrom;
import io.github.goodees.aggregates.store.Subscriber;
import io.github.goodees.aggregates.store.Subscription;
import io.github.goodees.aggregates.subscription.EventHistory;
import io.github.goodees.aggregates.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event store keeping everything in memory.
 *
 * <p>Appends to one stream are serialized by a lock of that stream. Numbering of events, making them visible and
 * handing them over to subscriptions happen in a short section guarded by single sequence lock, so event numbers
 * follow the order of appends. Streams are copy-on-write lists, readers see either the state before or after an
 * append.</p>
 *
 * <p>When constructed with {@link Serialization}, payloads of events and snapshots are kept serialized and
 * deserialized on every read, which verifies that payloads survive the trip to a real storage.</p>
 */
public class InMemoryEventStore implements EventStore, EventHistory {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Serialization serialization;
    private final SubscriptionManager subscriptions;
    final ReentrantLock sequenceLock = new ReentrantLock();
    private final ConcurrentMap<String, Lock> streamLocks = new ConcurrentHashMap<>();
    private volatile State state = new State();

    public InMemoryEventStore() {
        this(null);
    }

    public InMemoryEventStore(Serialization serialization) {
        this(serialization, SubscriptionManager.sharedDeliveryExecutor());
    }

    /**
     * @param serialization payload serialization, or null to keep payloads as they are
     * @param deliveryExecutor executor running subscription notifications
     */
    public InMemoryEventStore(Serialization serialization, ExecutorService deliveryExecutor) {
        this.serialization = serialization;
        this.subscriptions = new SubscriptionManager("in-memory", this, deliveryExecutor, 0);
    }

    private static final class StreamLog {
        private volatile List<RecordedEvent> events = Collections.emptyList();
        private volatile List<List<RecordedEvent>> batches = Collections.emptyList();

        // under stream and sequence lock
        void append(List<RecordedEvent> batch) {
            events = concat(events, batch);
            batches = concat(batches, Collections.singletonList(batch));
        }
    }

    private static final class State {
        private final ConcurrentMap<String, StreamLog> streams = new ConcurrentHashMap<>();
        private final ConcurrentMap<String, SnapshotData> snapshots = new ConcurrentHashMap<>();
        private volatile List<List<RecordedEvent>> batches = Collections.emptyList();
        private volatile long lastEventNumber;
    }

    private static <T> List<T> concat(List<T> head, List<T> tail) {
        List<T> result = new ArrayList<>(head.size() + tail.size());
        result.addAll(head);
        result.addAll(tail);
        return Collections.unmodifiableList(result);
    }

    @Override
    public void appendToStream(String streamId, ExpectedVersion expectedVersion, List<EventData> events)
            throws EventStoreException {
        checkStreamId(streamId);
        Objects.requireNonNull(expectedVersion, "expectedVersion");
        Objects.requireNonNull(events, "events");
        if (ALL_STREAMS.equals(streamId)) {
            throw EventStoreException.reservedStream(streamId);
        }
        List<Object> payloads = new ArrayList<>(events.size());
        for (EventData event : events) {
            payloads.add(encode(streamId, event.getData()));
        }

        Lock streamLock = streamLocks.computeIfAbsent(streamId, id -> new ReentrantLock());
        streamLock.lock();
        try {
            State current = state;
            StreamLog log = current.streams.get(streamId);
            long version = log == null ? 0 : log.events.size();
            if (!expectedVersion.matches(version)) {
                throw EventStoreException.wrongExpectedVersion(streamId, expectedVersion, version);
            }
            if (events.isEmpty()) {
                return;
            }
            sequenceLock.lock();
            try {
                if (current != state) {
                    // store was reset since the version check, the append goes to the new state
                    current = state;
                    log = current.streams.get(streamId);
                    version = log == null ? 0 : log.events.size();
                    if (!expectedVersion.matches(version)) {
                        throw EventStoreException.wrongExpectedVersion(streamId, expectedVersion, version);
                    }
                }
                Instant now = Instant.now();
                long eventNumber = current.lastEventNumber;
                List<RecordedEvent> stored = new ArrayList<>(events.size());
                List<RecordedEvent> published = new ArrayList<>(events.size());
                for (int i = 0; i < events.size(); i++) {
                    RecordedEvent event = RecordedEvent.builder()
                            .from(events.get(i))
                            .eventId(UUID.randomUUID())
                            .streamId(streamId)
                            .streamVersion(version + i)
                            .eventNumber(++eventNumber)
                            .createdAt(now)
                            .build();
                    published.add(event);
                    stored.add(serialization == null ? event : event.withData(payloads.get(i)));
                }
                List<RecordedEvent> batch = Collections.unmodifiableList(stored);
                current.streams.computeIfAbsent(streamId, id -> new StreamLog()).append(batch);
                current.batches = concat(current.batches, Collections.singletonList(batch));
                current.lastEventNumber = eventNumber;
                subscriptions.publish(Collections.unmodifiableList(published));
            } finally {
                sequenceLock.unlock();
            }
            logger.trace("Appended {} events to {} at version {}", events.size(), streamId, version);
        } finally {
            streamLock.unlock();
        }
    }

    @Override
    public EventStream streamForward(String streamId, long startVersion, int batchSize) throws EventStoreException {
        checkStreamId(streamId);
        StreamLog log = state.streams.get(streamId);
        if (log == null || log.events.isEmpty()) {
            throw EventStoreException.streamNotFound(streamId);
        }
        return new EventStream(streamId, startVersion, batchSize, (from, max) -> {
            List<RecordedEvent> events = log.events;
            if (from >= events.size()) {
                return Collections.emptyList();
            }
            int end = (int) Math.min(events.size(), from + max);
            return decode(events.subList((int) from, end));
        });
    }

    @Override
    public Subscription subscribe(String streamId, Subscriber subscriber) {
        return subscriptions.subscribe(streamId, subscriber);
    }

    @Override
    public Subscription subscribeTo(String streamId, String name, Subscriber subscriber, StartFrom startFrom)
            throws EventStoreException {
        return subscriptions.subscribeTo(streamId, name, subscriber, startFrom);
    }

    @Override
    public void ackEvent(Subscription subscription, RecordedEvent event) {
        subscriptions.ackEvent(subscription, event);
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        subscriptions.unsubscribe(subscription);
    }

    @Override
    public void deleteSubscription(String streamId, String name) throws EventStoreException {
        subscriptions.deleteSubscription(streamId, name);
    }

    @Override
    public SnapshotData readSnapshot(String sourceId) throws EventStoreException {
        SnapshotData snapshot = state.snapshots.get(sourceId);
        if (snapshot == null) {
            throw EventStoreException.snapshotNotFound(sourceId);
        }
        if (serialization == null) {
            return snapshot;
        }
        try {
            return snapshot.withData(serialization.deserialize((String) snapshot.getData(), snapshot.getSourceType()));
        } catch (IllegalArgumentException e) {
            throw EventStoreException.storeFailed(sourceId, e);
        }
    }

    @Override
    public void recordSnapshot(SnapshotData snapshot) throws EventStoreException {
        Objects.requireNonNull(snapshot, "snapshot");
        state.snapshots.put(snapshot.getSourceId(),
            serialization == null ? snapshot : snapshot.withData(encode(snapshot.getSourceId(), snapshot.getData())));
    }

    @Override
    public void deleteSnapshot(String sourceId) {
        state.snapshots.remove(sourceId);
    }

    @Override
    public List<List<RecordedEvent>> readBatches(String streamId, long afterPosition, int maxEvents)
            throws EventStoreException {
        List<List<RecordedEvent>> batches;
        if (ALL_STREAMS.equals(streamId)) {
            batches = state.batches;
        } else {
            StreamLog log = state.streams.get(streamId);
            batches = log == null ? Collections.<List<RecordedEvent>>emptyList() : log.batches;
        }
        int low = 0;
        int high = batches.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            List<RecordedEvent> batch = batches.get(mid);
            if (SubscriptionManager.position(streamId, batch.get(batch.size() - 1)) <= afterPosition) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        List<List<RecordedEvent>> result = new ArrayList<>();
        int count = 0;
        for (int i = low; i < batches.size() && count < maxEvents; i++) {
            List<RecordedEvent> batch = batches.get(i);
            if (SubscriptionManager.position(streamId, batch.get(0)) <= afterPosition) {
                List<RecordedEvent> tail = new ArrayList<>();
                for (RecordedEvent event : batch) {
                    if (SubscriptionManager.position(streamId, event) > afterPosition) {
                        tail.add(event);
                    }
                }
                batch = tail;
            }
            result.add(decode(batch));
            count += batch.size();
        }
        return result;
    }

    @Override
    public long currentPosition(String streamId) {
        if (ALL_STREAMS.equals(streamId)) {
            return state.lastEventNumber;
        } else {
            return streamVersion(streamId);
        }
    }

    /**
     * Forget everything. Subscriptions, including durable ones, are dropped as well. The store is then
     * indistinguishable from a new instance.
     */
    public void reset() {
        sequenceLock.lock();
        try {
            state = new State();
            subscriptions.reset(0);
        } finally {
            sequenceLock.unlock();
        }
        logger.debug("Event store reset");
    }

    /**
     * @param streamId the stream
     * @return number of events in stream, 0 for unknown stream
     */
    public long streamVersion(String streamId) {
        StreamLog log = state.streams.get(streamId);
        return log == null ? 0 : log.events.size();
    }

    public long lastEventNumber() {
        return state.lastEventNumber;
    }

    public Set<String> streamIds() {
        return Collections.unmodifiableSet(new TreeSet<>(state.streams.keySet()));
    }

    public int subscriptionCount() {
        return subscriptions.subscriptionCount();
    }

    public int snapshotCount() {
        return state.snapshots.size();
    }

    private Object encode(String streamId, Object payload) throws EventStoreException {
        if (serialization == null) {
            return payload;
        }
        try {
            return serialization.serialize(payload);
        } catch (IllegalArgumentException e) {
            throw EventStoreException.unsupported(streamId, payload, e);
        }
    }

    private List<RecordedEvent> decode(List<RecordedEvent> events) throws EventStoreException {
        if (serialization == null) {
            return new ArrayList<>(events);
        }
        List<RecordedEvent> result = new ArrayList<>(events.size());
        for (RecordedEvent event : events) {
            try {
                result.add(event.withData(serialization.deserialize((String) event.getData(), event.getEventType())));
            } catch (IllegalArgumentException e) {
                throw EventStoreException.storeFailed(event.getStreamId(), e);
            }
        }
        return result;
    }

    private static void checkStreamId(String streamId) {
        if (streamId == null || streamId.isEmpty()) {
            throw new IllegalArgumentException("Stream id must not be empty");
        }
    }
}
