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

/**
 * Snapshot of a source (usually an aggregate) taken after {@code sourceVersion} events were applied.
 */
public final class SnapshotData {
    private final String sourceId;
    private final long sourceVersion;
    private final String sourceType;
    private final Object data;
    private final Map<String, String> metadata;
    private final Instant createdAt;

    public SnapshotData(String sourceId, long sourceVersion, String sourceType, Object data) {
        this(sourceId, sourceVersion, sourceType, data, Collections.emptyMap(), Instant.now());
    }

    public SnapshotData(String sourceId, long sourceVersion, String sourceType, Object data,
            Map<String, String> metadata, Instant createdAt) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.sourceVersion = sourceVersion;
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType");
        this.data = data;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String getSourceId() {
        return sourceId;
    }

    public long getSourceVersion() {
        return sourceVersion;
    }

    public String getSourceType() {
        return sourceType;
    }

    public Object getData() {
        return data;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public SnapshotData withData(Object newData) {
        return new SnapshotData(sourceId, sourceVersion, sourceType, newData, metadata, createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SnapshotData)) {
            return false;
        }
        SnapshotData that = (SnapshotData) o;
        return sourceVersion == that.sourceVersion && sourceId.equals(that.sourceId)
                && sourceType.equals(that.sourceType) && Objects.equals(data, that.data)
                && metadata.equals(that.metadata) && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, sourceVersion);
    }

    @Override
    public String toString() {
        return "SnapshotData[" + sourceId + "@" + sourceVersion + ", type=" + sourceType + "]";
    }
}
