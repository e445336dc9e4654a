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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of successful command.
 * @param <S> type of aggregate state
 */
public final class ExecutionResult<S> {
    private final String aggregateId;
    private final long aggregateVersion;
    private final List<Object> events;
    private final S state;

    ExecutionResult(String aggregateId, long aggregateVersion, List<Object> events, S state) {
        this.aggregateId = aggregateId;
        this.aggregateVersion = aggregateVersion;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.state = state;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * @return version after the command
     */
    public long getAggregateVersion() {
        return aggregateVersion;
    }

    /**
     * @return events the command appended, empty if it produced none
     */
    public List<Object> getEvents() {
        return events;
    }

    public S getState() {
        return state;
    }

    @Override
    public String toString() {
        return "ExecutionResult[" + aggregateId + "@" + aggregateVersion + ", events=" + events + "]";
    }
}
