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

/**
 * Durable state of a named subscription. Outlives its subscribers.
 */
final class SubscriptionRecord {
    private final String streamId;
    private final String name;
    private long lastAcknowledged;
    private ManagedSubscription attached;

    SubscriptionRecord(String streamId, String name, long startPosition) {
        this.streamId = streamId;
        this.name = name;
        this.lastAcknowledged = startPosition;
    }

    String getStreamId() {
        return streamId;
    }

    String getName() {
        return name;
    }

    synchronized long getLastAcknowledged() {
        return lastAcknowledged;
    }

    synchronized boolean acknowledge(long position) {
        if (position > lastAcknowledged) {
            lastAcknowledged = position;
            return true;
        }
        return false;
    }

    synchronized ManagedSubscription attached() {
        return attached;
    }

    synchronized boolean attach(ManagedSubscription subscription) {
        if (attached != null && attached.isActive()) {
            return false;
        }
        attached = subscription;
        return true;
    }

    synchronized void detach(ManagedSubscription subscription) {
        if (attached == subscription) {
            attached = null;
        }
    }
}
