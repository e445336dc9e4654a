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

import io.github.goodees.aggregates.store.RecordedEvent;
import io.github.goodees.aggregates.store.Subscriber;
import io.github.goodees.aggregates.store.Subscription;

import java.util.List;

/**
 * Subscription handle with delivery state. Status changes happen under {@link #lock}, the cursor is touched only by
 * the subscription's delivery mailbox.
 */
final class ManagedSubscription implements Subscription {
    final Object lock = new Object();
    private final String streamId;
    private final String name;
    private final String mailboxKey;
    private final Subscriber subscriber;
    private final SubscriptionRecord record;
    private volatile Status status;
    private volatile boolean active = true;
    private long cursor;

    ManagedSubscription(String streamId, String name, String mailboxKey, Subscriber subscriber,
            SubscriptionRecord record, Status status, long cursor) {
        this.streamId = streamId;
        this.name = name;
        this.mailboxKey = mailboxKey;
        this.subscriber = subscriber;
        this.record = record;
        this.status = status;
        this.cursor = cursor;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getStreamId() {
        return streamId;
    }

    @Override
    public boolean isDurable() {
        return record != null;
    }

    @Override
    public Status getStatus() {
        return status;
    }

    @Override
    public long getLastAcknowledged() {
        return record == null ? 0 : record.getLastAcknowledged();
    }

    @Override
    public boolean isActive() {
        return active;
    }

    String mailboxKey() {
        return mailboxKey;
    }

    Subscriber subscriber() {
        return subscriber;
    }

    SubscriptionRecord record() {
        return record;
    }

    long cursor() {
        return cursor;
    }

    void advanceTo(long position) {
        cursor = position;
    }

    // call with lock held
    void markSubscribed() {
        status = Status.SUBSCRIBED;
    }

    // call with lock held
    void deactivate() {
        active = false;
    }

    boolean matches(List<RecordedEvent> batch) {
        return SubscriptionManager.isAll(streamId) || streamId.equals(batch.get(0).getStreamId());
    }

    @Override
    public String toString() {
        return "Subscription[" + (name == null ? "transient" : name) + " to " + streamId + ", status=" + status
                + ", active=" + active + "]";
    }
}
