package io.github.goodees.aggregates.core;

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
import io.github.goodees.aggregates.store.SnapshotData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory incarnation of single aggregate. Not thread safe, the runtime calls it from the aggregate's mailbox
 * only.
 *
 * <p>The process starts {@link Status#UNINITIALIZED}, and becomes {@link Status#READY} after replaying its stream.
 * Every command is checked against the store by appending with the current version as expected version. A conflict
 * means somebody else appended in between, the process then reloads the whole stream and runs the command again.</p>
 * @param <S> type of aggregate state
 */
final class AggregateProcess<S> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateProcess.class);

    enum Status {
        UNINITIALIZED, READY
    }

    private final String aggregateId;
    private final AggregateRuntime<S> runtime;
    private Status status = Status.UNINITIALIZED;
    private AggregateState<S> state;
    private int eventsSinceSnapshot;

    AggregateProcess(String aggregateId, AggregateRuntime<S> runtime) {
        this.aggregateId = aggregateId;
        this.runtime = runtime;
    }

    Status getStatus() {
        return status;
    }

    AggregateState<S> state() throws EventStoreException {
        ensureReady();
        return state;
    }

    void ensureReady() throws EventStoreException {
        if (status == Status.UNINITIALIZED) {
            load();
        }
    }

    <C> ExecutionResult<S> execute(C command, CommandHandler<S, ? super C> handler, ExecutionContext context)
            throws Exception {
        ensureReady();
        int attempts = Math.max(1, runtime.commandAttempts());
        for (int attempt = 1; ; attempt++) {
            List<?> produced = handler.handle(state.getValue(), command);
            List<Object> events = produced == null ? Collections.emptyList() : new ArrayList<>(produced);
            if (events.isEmpty()) {
                return new ExecutionResult<>(aggregateId, state.getVersion(), events, state.getValue());
            }
            state = state.withPendingEvents(toEventData(events, context));
            try {
                runtime.getEventStore().appendToStream(aggregateId, ExpectedVersion.exactly(state.getVersion()),
                    state.getPendingEvents());
            } catch (EventStoreException e) {
                state = state.withoutPendingEvents();
                if (e.getFault() != EventStoreException.Fault.WRONG_EXPECTED_VERSION) {
                    throw e;
                }
                logger.warn("Aggregate {} failed to append events at version {} due to wrong expected version, "
                        + "attempt {} of {}", aggregateId, state.getVersion(), attempt, attempts);
                load();
                if (attempt >= attempts) {
                    logger.error("Aggregate {} gave up on command {} after {} conflicting attempts", aggregateId,
                        command, attempts);
                    throw new AggregateConflictException(aggregateId, attempts, e);
                }
                continue;
            }
            S value = state.getValue();
            try {
                for (Object event : events) {
                    value = runtime.getAggregate().apply(value, event);
                }
            } catch (RuntimeException e) {
                // events are stored, but the state doesn't reflect them
                status = Status.UNINITIALIZED;
                throw e;
            }
            state = state.advance(state.getVersion() + events.size(), value);
            eventsSinceSnapshot += events.size();
            storeSnapshotIfNeeded();
            return new ExecutionResult<>(aggregateId, state.getVersion(), events, state.getValue());
        }
    }

    private List<EventData> toEventData(List<Object> events, ExecutionContext context) {
        List<EventData> result = new ArrayList<>(events.size());
        for (Object event : events) {
            result.add(new EventData(runtime.eventType(event), event, context.getMetadata(),
                    context.getCausationId(), context.getCorrelationId()));
        }
        return result;
    }

    /**
     * Rebuild state from the store, starting from snapshot when there is usable one.
     */
    void load() throws EventStoreException {
        long start = System.currentTimeMillis();
        Aggregate<S> aggregate = runtime.getAggregate();
        Replay replay = new Replay(aggregate.initialState(aggregateId), 0);
        if (runtime.snapshotsEnabled()) {
            replay = restoreSnapshot(replay);
        }
        long snapshotVersion = replay.version;
        try {
            EventStore store = runtime.getEventStore();
            replay = store.streamForward(aggregateId, replay.version, runtime.readBatchSize()).reduce(replay,
                (r, event) -> r.apply(aggregate, event));
        } catch (EventStoreException e) {
            if (e.getFault() != EventStoreException.Fault.STREAM_NOT_FOUND) {
                throw e;
            }
        }
        state = new AggregateState<>(aggregateId, replay.version, Collections.emptyList(), replay.value);
        eventsSinceSnapshot = (int) (replay.version - snapshotVersion);
        status = Status.READY;
        logger.info("Aggregate {} recovered in {} ms replaying {} events", aggregateId,
            System.currentTimeMillis() - start, replay.version - snapshotVersion);
    }

    private Replay restoreSnapshot(Replay initial) {
        try {
            SnapshotData snapshot = runtime.getEventStore().readSnapshot(aggregateId);
            S restored = runtime.getAggregate().restore(aggregateId, snapshot.getData());
            if (restored != null) {
                return new Replay(restored, snapshot.getSourceVersion());
            }
            logger.info("Aggregate {} refused snapshot at version {}", aggregateId, snapshot.getSourceVersion());
        } catch (EventStoreException e) {
            if (e.getFault() != EventStoreException.Fault.SNAPSHOT_NOT_FOUND) {
                logger.warn("Reading snapshot of aggregate {} failed, replaying all events", aggregateId, e);
            }
        }
        return initial;
    }

    private void storeSnapshotIfNeeded() {
        if (!runtime.snapshotsEnabled() || !runtime.shouldStoreSnapshot(state, eventsSinceSnapshot)) {
            return;
        }
        Object snapshot = runtime.getAggregate().snapshotOf(state.getValue());
        if (snapshot == null) {
            return;
        }
        try {
            runtime.getEventStore().recordSnapshot(new SnapshotData(aggregateId, state.getVersion(),
                    runtime.snapshotType(snapshot), snapshot));
            eventsSinceSnapshot = 0;
            logger.debug("Stored snapshot of aggregate {} at version {}", aggregateId, state.getVersion());
        } catch (EventStoreException | RuntimeException e) {
            logger.error("Failed to store snapshot of aggregate {} at version {}", aggregateId, state.getVersion(),
                e);
        }
    }

    private final class Replay {
        private final S value;
        private final long version;

        Replay(S value, long version) {
            this.value = value;
            this.version = version;
        }

        Replay apply(Aggregate<S> aggregate, RecordedEvent event) {
            return new Replay(aggregate.apply(value, event.getData()), version + 1);
        }
    }

    @Override
    public String toString() {
        return "AggregateProcess[" + aggregateId + ", " + status + ", state=" + state + "]";
    }
}
