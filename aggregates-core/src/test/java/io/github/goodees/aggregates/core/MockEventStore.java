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
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.EventStream;
import io.github.goodees.aggregates.store.ExpectedVersion;
import io.github.goodees.aggregates.store.Serialization;
import io.github.goodees.aggregates.store.SnapshotData;
import io.github.goodees.aggregates.store.inmemory.InMemoryEventStore;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory store that counts reads and appends, and fails appends on request.
 */
public class MockEventStore extends InMemoryEventStore {
    private final AtomicReference<EventStoreException> exception = new AtomicReference<>();
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicReference<EventStoreException> snapshotException = new AtomicReference<>();
    final AtomicInteger appends = new AtomicInteger();
    final AtomicInteger reads = new AtomicInteger();
    final AtomicInteger snapshotReads = new AtomicInteger();

    public MockEventStore() {
    }

    public MockEventStore(Serialization serialization) {
        super(serialization);
    }

    @Override
    public void appendToStream(String streamId, ExpectedVersion expectedVersion, List<EventData> events)
            throws EventStoreException {
        appends.incrementAndGet();
        if (failures.getAndUpdate(f -> f > 0 ? f - 1 : 0) > 0) {
            throw exception.get();
        }
        super.appendToStream(streamId, expectedVersion, events);
    }

    @Override
    public EventStream streamForward(String streamId, long startVersion, int batchSize) throws EventStoreException {
        reads.incrementAndGet();
        return super.streamForward(streamId, startVersion, batchSize);
    }

    @Override
    public SnapshotData readSnapshot(String sourceId) throws EventStoreException {
        snapshotReads.incrementAndGet();
        return super.readSnapshot(sourceId);
    }

    @Override
    public void recordSnapshot(SnapshotData snapshot) throws EventStoreException {
        EventStoreException ex = snapshotException.getAndSet(null);
        if (ex != null) {
            throw ex;
        }
        super.recordSnapshot(snapshot);
    }

    void throwExceptionOnce(EventStoreException ex) {
        throwException(ex, 1);
    }

    void throwException(EventStoreException ex, int times) {
        exception.set(ex);
        failures.set(times);
    }

    void failSnapshotOnce(EventStoreException ex) {
        snapshotException.set(ex);
    }
}
