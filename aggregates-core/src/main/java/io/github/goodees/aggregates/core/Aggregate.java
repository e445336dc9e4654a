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

/**
 * Definition of an aggregate: how its state starts and how events change it. Implementations must be pure, the same
 * events applied in the same order always give the same state.
 * @param <S> type of aggregate state
 */
public interface Aggregate<S> {

    /**
     * State of an aggregate that has no events yet.
     * @param aggregateId identity of the aggregate
     * @return initial state
     */
    S initialState(String aggregateId);

    /**
     * Fold single event into the state.
     * @param state current state
     * @param event event payload
     * @return state after the event
     */
    S apply(S state, Object event);

    /**
     * Produce snapshot of the state. Snapshots are taken only when the runtime decides so.
     * @param state current state
     * @return snapshot payload or null, when this aggregate doesn't support snapshots
     */
    default Object snapshotOf(S state) {
        return null;
    }

    /**
     * Recover state from a snapshot.
     * @param aggregateId identity of the aggregate
     * @param snapshot payload previously returned by {@link #snapshotOf(Object)}
     * @return restored state, or null if the snapshot is not usable. Full replay happens in such case.
     */
    default S restore(String aggregateId, Object snapshot) {
        return null;
    }
}
