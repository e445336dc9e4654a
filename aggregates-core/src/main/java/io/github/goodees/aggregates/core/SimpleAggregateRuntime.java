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

import io.github.goodees.aggregates.store.EventStore;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Runtime configured by constructor arguments. Optionally stores snapshot every {@code snapshotEvery} events.
 * @param <S> type of aggregate state
 */
public class SimpleAggregateRuntime<S> extends AggregateRuntime<S> {
    private final String name;
    private final Aggregate<S> aggregate;
    private final EventStore eventStore;
    private final ExecutorService executorService;
    private final ScheduledExecutorService scheduler;
    private final int snapshotEvery;

    public SimpleAggregateRuntime(String name, Aggregate<S> aggregate, EventStore eventStore,
            ExecutorService executorService, ScheduledExecutorService scheduler) {
        this(name, aggregate, eventStore, executorService, scheduler, 0);
    }

    /**
     * @param snapshotEvery number of events between snapshots, 0 to disable snapshots
     */
    public SimpleAggregateRuntime(String name, Aggregate<S> aggregate, EventStore eventStore,
            ExecutorService executorService, ScheduledExecutorService scheduler, int snapshotEvery) {
        if (snapshotEvery < 0) {
            throw new IllegalArgumentException("snapshotEvery must not be negative");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.aggregate = Objects.requireNonNull(aggregate, "aggregate");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.executorService = Objects.requireNonNull(executorService, "executorService");
        this.scheduler = scheduler;
        this.snapshotEvery = snapshotEvery;
    }

    @Override
    protected Aggregate<S> getAggregate() {
        return aggregate;
    }

    @Override
    protected EventStore getEventStore() {
        return eventStore;
    }

    @Override
    protected ExecutorService getExecutorService() {
        return executorService;
    }

    @Override
    protected ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    @Override
    protected String getAggregateName() {
        return name;
    }

    @Override
    protected boolean snapshotsEnabled() {
        return snapshotEvery > 0;
    }

    @Override
    protected boolean shouldStoreSnapshot(AggregateState<S> state, int eventsSinceSnapshot) {
        return eventsSinceSnapshot >= snapshotEvery;
    }
}
