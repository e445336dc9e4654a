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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An event to be appended. The store assigns identity and position when it records it.
 */
public final class EventData {
    private final String eventType;
    private final Object data;
    private final Map<String, String> metadata;
    private final UUID causationId;
    private final UUID correlationId;

    public EventData(String eventType, Object data) {
        this(eventType, data, Collections.emptyMap(), null, null);
    }

    public EventData(String eventType, Object data, Map<String, String> metadata, UUID causationId,
            UUID correlationId) {
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.data = data;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.causationId = causationId;
        this.correlationId = correlationId;
    }

    public String getEventType() {
        return eventType;
    }

    public Object getData() {
        return data;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public UUID getCausationId() {
        return causationId;
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventData)) {
            return false;
        }
        EventData that = (EventData) o;
        return eventType.equals(that.eventType) && Objects.equals(data, that.data)
                && metadata.equals(that.metadata) && Objects.equals(causationId, that.causationId)
                && Objects.equals(correlationId, that.correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, data, metadata, causationId, correlationId);
    }

    @Override
    public String toString() {
        return "EventData[type=" + eventType + ", data=" + data + ", correlationId=" + correlationId + "]";
    }
}
