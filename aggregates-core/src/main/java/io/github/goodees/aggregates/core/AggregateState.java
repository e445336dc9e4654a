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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of an aggregate process. {@code version} is the number of events applied. Pending events are
 * those produced by a command and not yet confirmed by the store.
 * @param <S> type of aggregate state
 */
public final class AggregateState<S> {
    private final String aggregateId;
    private final long version;
    private final List<EventData> pendingEvents;
    private final S value;

    public AggregateState(String aggregateId, long version, List<EventData> pendingEvents, S value) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        this.version = version;
        this.pendingEvents = pendingEvents.isEmpty()
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(pendingEvents));
        this.value = value;
    }

    public static <S> AggregateState<S> initial(String aggregateId, S value) {
        return new AggregateState<>(aggregateId, 0, Collections.emptyList(), value);
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getVersion() {
        return version;
    }

    public List<EventData> getPendingEvents() {
        return pendingEvents;
    }

    public S getValue() {
        return value;
    }

    AggregateState<S> withPendingEvents(List<EventData> events) {
        return new AggregateState<>(aggregateId, version, events, value);
    }

    AggregateState<S> withoutPendingEvents() {
        return new AggregateState<>(aggregateId, version, Collections.emptyList(), value);
    }

    AggregateState<S> advance(long newVersion, S newValue) {
        return new AggregateState<>(aggregateId, newVersion, Collections.emptyList(), newValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateState)) {
            return false;
        }
        AggregateState<?> that = (AggregateState<?>) o;
        return version == that.version && aggregateId.equals(that.aggregateId)
                && pendingEvents.equals(that.pendingEvents) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, version, value);
    }

    @Override
    public String toString() {
        return "AggregateState[" + aggregateId + "@" + version + ", pending=" + pendingEvents.size() + ", value="
                + value + "]";
    }
}
