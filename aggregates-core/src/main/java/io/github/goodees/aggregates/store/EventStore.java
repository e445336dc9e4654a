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

import java.util.List;

/**
 * Append-only event storage with ordered replay, subscriptions and snapshots.
 *
 * <p>Streams are identified by non-empty strings. Stream versions are 0-based and contiguous, event numbers are
 * 1-based and strictly increasing across all streams in order of successful appends. An append is atomic: all of
 * its events are recorded with contiguous versions and event numbers, or none is.</p>
 *
 * <p>Subscribers are notified with one batch per append, ordered by event number for {@link #ALL_STREAMS}, and by
 * stream version for single stream subscriptions.</p>
 */
public interface EventStore {
    /**
     * Stream id reserved for subscriptions to every stream. Cannot be appended to.
     */
    String ALL_STREAMS = "$all";

    int DEFAULT_BATCH_SIZE = 1000;

    /**
     * Append events to a stream.
     * @param streamId target stream
     * @param expectedVersion optimistic concurrency guard
     * @param events events to append, in order. An empty list only checks the expected version.
     * @throws EventStoreException with {@link EventStoreException.Fault#WRONG_EXPECTED_VERSION} when the guard doesn't
     *     match the stream, nothing is appended in such case
     */
    void appendToStream(String streamId, ExpectedVersion expectedVersion, List<EventData> events)
            throws EventStoreException;

    /**
     * Read stream from given version.
     * @param streamId stream to read
     * @param startVersion first version to read
     * @param batchSize number of events fetched at once
     * @return lazy, restartable sequence of events
     * @throws EventStoreException with {@link EventStoreException.Fault#STREAM_NOT_FOUND} if the stream has no events
     */
    EventStream streamForward(String streamId, long startVersion, int batchSize) throws EventStoreException;

    default EventStream streamForward(String streamId) throws EventStoreException {
        return streamForward(streamId, 0, DEFAULT_BATCH_SIZE);
    }

    /**
     * Subscribe to events appended after this call. No history is delivered and no acknowledgement is needed.
     * @param streamId stream or {@link #ALL_STREAMS}
     * @param subscriber receiver
     * @return subscription handle
     */
    Subscription subscribe(String streamId, Subscriber subscriber);

    /**
     * Attach to a named durable subscription. A new subscription starts at {@code startFrom}, an existing one
     * resumes after its last acknowledged event. History is delivered before live events, each event exactly once.
     * @param streamId stream or {@link #ALL_STREAMS}
     * @param name subscription name, unique per stream
     * @param subscriber receiver
     * @param startFrom start position of a new subscription
     * @return subscription handle
     * @throws EventStoreException with {@link EventStoreException.Fault#SUBSCRIPTION_ALREADY_EXISTS} if a subscriber
     *     is attached already
     */
    Subscription subscribeTo(String streamId, String name, Subscriber subscriber, StartFrom startFrom)
            throws EventStoreException;

    /**
     * Record that the subscriber processed all events up to given one. Acknowledging older events has no effect.
     */
    void ackEvent(Subscription subscription, RecordedEvent event);

    /**
     * Detach subscriber. Durable subscription keeps its acknowledged position.
     */
    void unsubscribe(Subscription subscription);

    /**
     * Remove durable subscription, detaching its subscriber if any.
     * @throws EventStoreException with {@link EventStoreException.Fault#SUBSCRIPTION_NOT_FOUND} if there's no such
     *     subscription
     */
    void deleteSubscription(String streamId, String name) throws EventStoreException;

    /**
     * @throws EventStoreException with {@link EventStoreException.Fault#SNAPSHOT_NOT_FOUND} if there is no snapshot
     */
    SnapshotData readSnapshot(String sourceId) throws EventStoreException;

    /**
     * Store snapshot, replacing previous snapshot of the same source.
     */
    void recordSnapshot(SnapshotData snapshot) throws EventStoreException;

    void deleteSnapshot(String sourceId) throws EventStoreException;
}
