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

import io.github.goodees.aggregates.store.EventStoreException;

/**
 * Command kept conflicting with concurrent appends to the aggregate's stream, and ran out of attempts.
 */
public class AggregateConflictException extends Exception {
    private final String aggregateId;
    private final int attempts;

    public AggregateConflictException(String aggregateId, int attempts, EventStoreException lastConflict) {
        super("Aggregate " + aggregateId + " could not append events in " + attempts + " attempts", lastConflict);
        this.aggregateId = aggregateId;
        this.attempts = attempts;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public int getAttempts() {
        return attempts;
    }
}
