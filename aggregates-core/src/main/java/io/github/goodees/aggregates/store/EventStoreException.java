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
 * Failure of an event store operation. The {@link Fault} tells the caller whether the failure is a concurrency
 * conflict worth retrying, a caller mistake, or a storage failure.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        WRONG_EXPECTED_VERSION,
        STREAM_NOT_FOUND,
        SUBSCRIPTION_ALREADY_EXISTS,
        SUBSCRIPTION_NOT_FOUND,
        SNAPSHOT_NOT_FOUND,
        STORAGE_ERROR,
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException wrongExpectedVersion(String streamId, ExpectedVersion expected, long actual) {
        return new EventStoreException(Fault.WRONG_EXPECTED_VERSION, "Stream " + streamId + " expected at "
                + expected + " but has " + actual + " events", null);
    }

    public static EventStoreException concurrentAppend(String streamId, long expectedVersion) {
        return new EventStoreException(Fault.WRONG_EXPECTED_VERSION, "Stream " + streamId
                + " was appended concurrently past version " + expectedVersion, null);
    }

    public static EventStoreException streamNotFound(String streamId) {
        return new EventStoreException(Fault.STREAM_NOT_FOUND, "Stream " + streamId + " not found", null);
    }

    public static EventStoreException subscriptionAlreadyExists(String streamId, String name) {
        return new EventStoreException(Fault.SUBSCRIPTION_ALREADY_EXISTS, "Subscription " + name + " to "
                + streamId + " already has an active subscriber", null);
    }

    public static EventStoreException subscriptionNotFound(String streamId, String name) {
        return new EventStoreException(Fault.SUBSCRIPTION_NOT_FOUND, "Subscription " + name + " to "
                + streamId + " not found", null);
    }

    public static EventStoreException snapshotNotFound(String sourceId) {
        return new EventStoreException(Fault.SNAPSHOT_NOT_FOUND, "No snapshot of " + sourceId, null);
    }

    public static EventStoreException storeFailed(String streamId, Throwable cause) {
        return new EventStoreException(Fault.STORAGE_ERROR,
            "Store operation on " + streamId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException reservedStream(String streamId) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Cannot append to reserved stream " + streamId,
            null);
    }

    public static EventStoreException unsupported(String streamId, Object payload, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported payload for stream " + streamId
                + ": " + payload, cause);
    }
}
