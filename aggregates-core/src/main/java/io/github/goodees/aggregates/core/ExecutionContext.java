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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Tracing data copied to every event a command produces.
 */
public final class ExecutionContext {
    private final UUID causationId;
    private final UUID correlationId;
    private final Map<String, String> metadata;

    private ExecutionContext(UUID causationId, UUID correlationId, Map<String, String> metadata) {
        this.causationId = causationId;
        this.correlationId = correlationId;
        this.metadata = metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Context with fresh correlation id and no causation.
     * @return new context
     */
    public static ExecutionContext create() {
        return new ExecutionContext(null, UUID.randomUUID(), Collections.emptyMap());
    }

    public static ExecutionContext of(UUID causationId, UUID correlationId, Map<String, String> metadata) {
        return new ExecutionContext(causationId, correlationId, metadata == null ? Collections.emptyMap() : metadata);
    }

    public ExecutionContext withMetadata(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new ExecutionContext(causationId, correlationId, copy);
    }

    public UUID getCausationId() {
        return causationId;
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "ExecutionContext[causation=" + causationId + ", correlation=" + correlationId + ", metadata="
                + metadata + "]";
    }
}
