package io.github.goodees.aggregates.serialization;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.aggregates.store.EventType;
import io.github.goodees.aggregates.store.Serialization;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON serialization of payloads with Jackson. Payload types are registered explicitly under their type names, no
 * class is ever loaded by name taken from the storage.
 */
public class JsonSerialization implements Serialization {
    private final ObjectMapper mapper;
    private final Map<String, Class<?>> types = new ConcurrentHashMap<>();

    public JsonSerialization() {
        this(createMapper());
    }

    public JsonSerialization(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Mapper supporting Optional and java.time types, writing dates as ISO strings.
     * @return new object mapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new Jdk8Module());
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Register type under its {@linkplain EventType#defaultTypeName(Class) default type name}.
     * @param type payload class
     * @return this
     */
    public JsonSerialization register(Class<?> type) {
        return register(EventType.defaultTypeName(type), type);
    }

    public JsonSerialization register(String typeName, Class<?> type) {
        Class<?> previous = types.putIfAbsent(typeName, type);
        if (previous != null && !previous.equals(type)) {
            throw new IllegalArgumentException("Type name " + typeName + " is registered for " + previous.getName());
        }
        return this;
    }

    public boolean isRegistered(String typeName) {
        return types.containsKey(typeName);
    }

    @Override
    public String serialize(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + payload, e);
        }
    }

    @Override
    public Object deserialize(String payload, String type) {
        Class<?> target = types.get(type);
        if (target == null) {
            throw new IllegalArgumentException("Unknown payload type " + type);
        }
        try {
            return mapper.readValue(payload, target);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize " + type + " from " + payload, e);
        }
    }
}
