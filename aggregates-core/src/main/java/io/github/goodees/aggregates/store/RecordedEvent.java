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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An event as stored. {@code streamVersion} is its 0-based position within the stream, {@code eventNumber} its
 * 1-based position across all streams.
 */
public final class RecordedEvent {
    private final UUID eventId;
    private final String streamId;
    private final long streamVersion;
    private final long eventNumber;
    private final String eventType;
    private final Object data;
    private final Map<String, String> metadata;
    private final UUID causationId;
    private final UUID correlationId;
    private final Instant createdAt;

    private RecordedEvent(Builder builder) {
        this.eventId = Objects.requireNonNull(builder.eventId, "eventId");
        this.streamId = Objects.requireNonNull(builder.streamId, "streamId");
        this.streamVersion = builder.streamVersion;
        this.eventNumber = builder.eventNumber;
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
        this.data = builder.data;
        this.metadata = builder.metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.causationId = builder.causationId;
        this.correlationId = builder.correlationId;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
    }

    public static Builder builder() {
        return new Builder();
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getStreamVersion() {
        return streamVersion;
    }

    public long getEventNumber() {
        return eventNumber;
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

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Copy of this event carrying different payload. Used by stores that keep serialized payloads.
     * @param newData payload
     * @return new instance
     */
    public RecordedEvent withData(Object newData) {
        return builder().from(this).data(newData).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordedEvent)) {
            return false;
        }
        RecordedEvent that = (RecordedEvent) o;
        return streamVersion == that.streamVersion && eventNumber == that.eventNumber
                && eventId.equals(that.eventId) && streamId.equals(that.streamId)
                && eventType.equals(that.eventType) && Objects.equals(data, that.data)
                && metadata.equals(that.metadata) && Objects.equals(causationId, that.causationId)
                && Objects.equals(correlationId, that.correlationId) && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, eventNumber);
    }

    @Override
    public String toString() {
        return "RecordedEvent[" + streamId + "@" + streamVersion + ", #" + eventNumber + ", type=" + eventType
                + ", data=" + data + "]";
    }

    public static final class Builder {
        private UUID eventId;
        private String streamId;
        private long streamVersion;
        private long eventNumber;
        private String eventType;
        private Object data;
        private Map<String, String> metadata = Collections.emptyMap();
        private UUID causationId;
        private UUID correlationId;
        private Instant createdAt;

        private Builder() {
        }

        public Builder from(RecordedEvent event) {
            return eventId(event.eventId)
                    .streamId(event.streamId)
                    .streamVersion(event.streamVersion)
                    .eventNumber(event.eventNumber)
                    .eventType(event.eventType)
                    .data(event.data)
                    .metadata(event.metadata)
                    .causationId(event.causationId)
                    .correlationId(event.correlationId)
                    .createdAt(event.createdAt);
        }

        public Builder from(EventData event) {
            return eventType(event.getEventType())
                    .data(event.getData())
                    .metadata(event.getMetadata())
                    .causationId(event.getCausationId())
                    .correlationId(event.getCorrelationId());
        }

        public Builder eventId(UUID eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder streamId(String streamId) {
            this.streamId = streamId;
            return this;
        }

        public Builder streamVersion(long streamVersion) {
            this.streamVersion = streamVersion;
            return this;
        }

        public Builder eventNumber(long eventNumber) {
            this.eventNumber = eventNumber;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder data(Object data) {
            this.data = data;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata == null ? Collections.emptyMap() : metadata;
            return this;
        }

        public Builder causationId(UUID causationId) {
            this.causationId = causationId;
            return this;
        }

        public Builder correlationId(UUID correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public RecordedEvent build() {
            return new RecordedEvent(this);
        }
    }
}
