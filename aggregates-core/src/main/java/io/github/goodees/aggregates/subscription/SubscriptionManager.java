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

import io.github.goodees.aggregates.dispatch.Dispatcher;
import io.github.goodees.aggregates.dispatch.SimpleDispatcherConfiguration;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.RecordedEvent;
import io.github.goodees.aggregates.store.StartFrom;
import io.github.goodees.aggregates.store.Subscriber;
import io.github.goodees.aggregates.store.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Subscriptions of one event store.
 *
 * <p>The store hands every committed append to {@link #publish(List)}. Appends may be published out of order, the
 * manager releases them to subscribers strictly in event number order. Every subscription is served by its own
 * mailbox of a {@link Dispatcher}, so its notifications never overlap and keep their order.</p>
 *
 * <p>A durable subscription first catches up by reading whole appends from {@link EventHistory}. The last history
 * read and the switch to live delivery happen under the subscription lock, and live appends are released under the
 * same lock, therefore each append is delivered either from history or live. Live appends already covered by
 * history are skipped by position.</p>
 */
public class SubscriptionManager {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionManager.class);

    private final EventHistory history;
    private final Dispatcher deliveries;
    private final int catchUpBatchSize;
    private final AtomicLong transientSequence = new AtomicLong();

    private final Object publishLock = new Object();
    private final NavigableMap<Long, List<RecordedEvent>> outOfOrder = new TreeMap<>();
    private long lastPublished;

    private final ConcurrentMap<RecordKey, SubscriptionRecord> records = new ConcurrentHashMap<>();
    private final Set<ManagedSubscription> attached = ConcurrentHashMap.newKeySet();

    public SubscriptionManager(String name, EventHistory history, ExecutorService executor, long lastEventNumber,
            int catchUpBatchSize) {
        this.history = Objects.requireNonNull(history, "history");
        this.deliveries = new Dispatcher(new SimpleDispatcherConfiguration(name, executor));
        this.lastPublished = lastEventNumber;
        this.catchUpBatchSize = catchUpBatchSize;
    }

    public SubscriptionManager(String name, EventHistory history, ExecutorService executor, long lastEventNumber) {
        this(name, history, executor, lastEventNumber, EventStore.DEFAULT_BATCH_SIZE);
    }

    static boolean isAll(String streamId) {
        return EventStore.ALL_STREAMS.equals(streamId);
    }

    /**
     * Position of an event within a subscription to given stream.
     * @param streamId stream id or all streams
     * @param event the event
     * @return event number for all streams, {@code streamVersion + 1} otherwise
     */
    public static long position(String streamId, RecordedEvent event) {
        return isAll(streamId) ? event.getEventNumber() : event.getStreamVersion() + 1;
    }

    public Subscription subscribe(String streamId, Subscriber subscriber) {
        checkStreamId(streamId);
        Objects.requireNonNull(subscriber, "subscriber");
        String mailbox = "transient-" + transientSequence.incrementAndGet() + "@" + streamId;
        ManagedSubscription subscription = new ManagedSubscription(streamId, null, mailbox, subscriber, null,
                Subscription.Status.SUBSCRIBED, -1);
        attached.add(subscription);
        deliveries.execute(mailbox, () -> {
            notifySubscribed(subscription);
            return null;
        });
        logger.debug("Transient subscription to {} attached", streamId);
        return subscription;
    }

    public Subscription subscribeTo(String streamId, String name, Subscriber subscriber, StartFrom startFrom)
            throws EventStoreException {
        checkStreamId(streamId);
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(subscriber, "subscriber");
        Objects.requireNonNull(startFrom, "startFrom");
        RecordKey key = new RecordKey(streamId, name);
        SubscriptionRecord record = records.get(key);
        if (record == null) {
            long start = startFrom.isCurrent() ? history.currentPosition(streamId) : startFrom.getPosition();
            SubscriptionRecord created = new SubscriptionRecord(streamId, name, start);
            record = records.putIfAbsent(key, created);
            if (record == null) {
                record = created;
                logger.info("Created subscription {} to {} starting after position {}", name, streamId, start);
            }
        }
        ManagedSubscription subscription = new ManagedSubscription(streamId, name, name + "@" + streamId,
                subscriber, record, Subscription.Status.CATCHING_UP, record.getLastAcknowledged());
        if (!record.attach(subscription)) {
            throw EventStoreException.subscriptionAlreadyExists(streamId, name);
        }
        attached.add(subscription);
        deliveries.execute(subscription.mailboxKey(), () -> {
            if (notifySubscribed(subscription)) {
                catchUp(subscription);
            }
            return null;
        });
        return subscription;
    }

    public void ackEvent(Subscription subscription, RecordedEvent event) {
        ManagedSubscription managed = checkManaged(subscription);
        if (managed.record() == null) {
            return;
        }
        if (!managed.matches(Collections.singletonList(event))) {
            throw new IllegalArgumentException("Event " + event + " does not belong to " + subscription);
        }
        if (managed.record().acknowledge(position(managed.getStreamId(), event))) {
            logger.trace("{} acknowledged {}", subscription, event);
        }
    }

    public void unsubscribe(Subscription subscription) {
        ManagedSubscription managed = checkManaged(subscription);
        detach(managed);
        logger.debug("Unsubscribed {}", managed);
    }

    public void deleteSubscription(String streamId, String name) throws EventStoreException {
        SubscriptionRecord record = records.remove(new RecordKey(streamId, name));
        if (record == null) {
            throw EventStoreException.subscriptionNotFound(streamId, name);
        }
        ManagedSubscription current = record.attached();
        if (current != null) {
            detach(current);
        }
        logger.info("Deleted subscription {} to {}", name, streamId);
    }

    /**
     * Hand over committed append. Must be called once per successful append, after the append is visible to
     * {@link EventHistory}. When earlier events are missing, they are read from history, so appends made by other
     * writers of the same storage are delivered as well.
     * @param batch events of single append, in order
     */
    public void publish(List<RecordedEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        synchronized (publishLock) {
            long first = batch.get(0).getEventNumber();
            if (first <= lastPublished) {
                logger.debug("Append starting at {} was already released from history", first);
                return;
            }
            outOfOrder.put(first, batch);
            releaseBuffered();
            if (!outOfOrder.isEmpty()) {
                try {
                    releaseFromHistory();
                } catch (EventStoreException e) {
                    logger.warn("Reading events after {} failed, {} appends wait for the gap to be filled",
                        lastPublished, outOfOrder.size(), e);
                }
            }
        }
    }

    /**
     * Release every append visible in {@link EventHistory} that was not published yet, e.g. appends of other
     * writers, or appends whose transaction is committed by the caller.
     * @throws EventStoreException when history cannot be read
     */
    public void refresh() throws EventStoreException {
        synchronized (publishLock) {
            releaseFromHistory();
        }
    }

    // under publishLock
    private void releaseFromHistory() throws EventStoreException {
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            for (List<RecordedEvent> batch : history.readBatches(EventStore.ALL_STREAMS, lastPublished,
                catchUpBatchSize)) {
                if (batch.get(batch.size() - 1).getEventNumber() <= lastPublished) {
                    continue;
                }
                if (batch.get(0).getEventNumber() != lastPublished + 1) {
                    // earlier append is not visible yet, its own publication releases it
                    break;
                }
                release(batch);
                progressed = true;
            }
            outOfOrder.headMap(lastPublished, true).clear();
            releaseBuffered();
        }
    }

    // under publishLock
    private void releaseBuffered() {
        Map.Entry<Long, List<RecordedEvent>> next = outOfOrder.firstEntry();
        while (next != null && next.getKey() == lastPublished + 1) {
            outOfOrder.pollFirstEntry();
            release(next.getValue());
            next = outOfOrder.firstEntry();
        }
    }

    private void release(List<RecordedEvent> batch) {
        lastPublished = batch.get(batch.size() - 1).getEventNumber();
        for (ManagedSubscription subscription : attached) {
            offer(subscription, batch);
        }
    }

    /**
     * Drop all subscriptions, including durable ones, and restart numbering.
     * @param lastEventNumber event number of last event in the store
     */
    public void reset(long lastEventNumber) {
        synchronized (publishLock) {
            for (ManagedSubscription subscription : new ArrayList<>(attached)) {
                detach(subscription);
            }
            records.clear();
            outOfOrder.clear();
            lastPublished = lastEventNumber;
        }
    }

    public long lastPublished() {
        synchronized (publishLock) {
            return lastPublished;
        }
    }

    public int subscriptionCount() {
        return records.size();
    }

    /**
     * @return number of subscriptions with notifications queued or running
     */
    public int busyMailboxCount() {
        return deliveries.mailboxCount();
    }

    /**
     * Executor for stores that are not given one. Threads are daemons shared by all such stores, idle ones
     * terminate after a minute.
     * @return the shared executor
     */
    public static ExecutorService sharedDeliveryExecutor() {
        return SharedExecutor.INSTANCE;
    }

    private static final class SharedExecutor {
        private static final AtomicLong threadCount = new AtomicLong();
        static final ExecutorService INSTANCE = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "event-store-delivery-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private void offer(ManagedSubscription subscription, List<RecordedEvent> batch) {
        if (!subscription.matches(batch)) {
            return;
        }
        synchronized (subscription.lock) {
            if (subscription.isActive() && subscription.getStatus() == Subscription.Status.SUBSCRIBED) {
                deliveries.execute(subscription.mailboxKey(), () -> {
                    deliver(subscription, batch);
                    return null;
                });
            }
        }
    }

    private void catchUp(ManagedSubscription subscription) {
        try {
            while (subscription.isActive()) {
                List<List<RecordedEvent>> batches;
                synchronized (subscription.lock) {
                    batches = history.readBatches(subscription.getStreamId(), subscription.cursor(),
                        catchUpBatchSize);
                    if (batches.isEmpty()) {
                        subscription.markSubscribed();
                        logger.info("{} caught up at position {}", subscription, subscription.cursor());
                        return;
                    }
                }
                for (List<RecordedEvent> batch : batches) {
                    if (!deliver(subscription, batch)) {
                        return;
                    }
                }
            }
        } catch (EventStoreException e) {
            logger.error("Catching up {} failed, detaching subscriber", subscription, e);
            detach(subscription);
        }
    }

    private boolean notifySubscribed(ManagedSubscription subscription) {
        try {
            subscription.subscriber().onSubscribed(subscription);
            return true;
        } catch (RuntimeException e) {
            logger.error("Subscriber of {} failed on subscription, detaching it", subscription, e);
            detach(subscription);
            return false;
        }
    }

    private boolean deliver(ManagedSubscription subscription, List<RecordedEvent> batch) {
        if (!subscription.isActive()) {
            return false;
        }
        long position = position(subscription.getStreamId(), batch.get(batch.size() - 1));
        if (position <= subscription.cursor()) {
            return true;
        }
        try {
            subscription.subscriber().onEvents(batch);
            subscription.advanceTo(position);
            return true;
        } catch (Exception e) {
            logger.error("Subscriber of {} failed processing events up to position {}, detaching it", subscription,
                position, e);
            detach(subscription);
            return false;
        }
    }

    private void detach(ManagedSubscription subscription) {
        synchronized (subscription.lock) {
            subscription.deactivate();
        }
        attached.remove(subscription);
        if (subscription.record() != null) {
            subscription.record().detach(subscription);
        }
    }

    private static ManagedSubscription checkManaged(Subscription subscription) {
        if (!(subscription instanceof ManagedSubscription)) {
            throw new IllegalArgumentException("Foreign subscription " + subscription);
        }
        return (ManagedSubscription) subscription;
    }

    private static void checkStreamId(String streamId) {
        if (streamId == null || streamId.isEmpty()) {
            throw new IllegalArgumentException("Stream id must not be empty");
        }
    }

    private static final class RecordKey {
        private final String streamId;
        private final String name;

        RecordKey(String streamId, String name) {
            this.streamId = streamId;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof RecordKey)) {
                return false;
            }
            RecordKey other = (RecordKey) o;
            return streamId.equals(other.streamId) && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(streamId, name);
        }
    }
}
