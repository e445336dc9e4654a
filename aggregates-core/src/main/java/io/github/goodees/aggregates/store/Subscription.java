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

/**
 * Handle to an attached subscriber.
 */
public interface Subscription {

    enum Status {
        CATCHING_UP, SUBSCRIBED
    }

    /**
     * @return subscription name, {@code null} for transient subscriptions
     */
    String getName();

    String getStreamId();

    boolean isDurable();

    Status getStatus();

    /**
     * @return position of last acknowledged event, 0 if nothing was acknowledged
     */
    long getLastAcknowledged();

    /**
     * @return false once the subscriber was unsubscribed, failed, or the subscription was deleted
     */
    boolean isActive();
}
