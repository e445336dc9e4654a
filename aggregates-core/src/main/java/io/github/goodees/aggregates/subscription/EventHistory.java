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

import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.RecordedEvent;

import java.util.List;

/**
 * Committed history of a store as seen by subscriptions. Positions are event numbers when reading
 * {@link io.github.goodees.aggregates.store.EventStore#ALL_STREAMS}, and {@code streamVersion + 1} for single
 * stream.
 */
public interface EventHistory {

    /**
     * Read whole appends that contain events with positions greater than given one. An append is never split.
     * @param streamId stream or all streams
     * @param afterPosition last position not to be returned
     * @param maxEvents soft limit of number of events, at least one append is returned when there are any
     * @return appends in order, empty when there is nothing after the position
     * @throws EventStoreException when reading fails
     */
    List<List<RecordedEvent>> readBatches(String streamId, long afterPosition, int maxEvents)
            throws EventStoreException;

    /**
     * @param streamId stream or all streams
     * @return position of last committed event, 0 when there is none
     * @throws EventStoreException when reading fails
     */
    long currentPosition(String streamId) throws EventStoreException;
}
