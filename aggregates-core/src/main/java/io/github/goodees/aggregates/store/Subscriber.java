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
 * Receiver of subscription notifications. Calls for one subscription never overlap, and batches arrive in order.
 * Throwing from {@link #onEvents(List)} detaches the subscriber.
 */
public interface Subscriber {

    /**
     * Called once before any events are delivered.
     * @param subscription the subscription handle
     */
    default void onSubscribed(Subscription subscription) {
    }

    /**
     * Delivery of events of one append, in order.
     * @param events non-empty batch
     * @throws Exception to stop the subscription
     */
    void onEvents(List<RecordedEvent> events) throws Exception;
}
