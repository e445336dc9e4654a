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
 * Codec of event and snapshot payloads.
 */
public interface Serialization {

    /**
     * Serialize payload.
     * @param payload the payload object
     * @return its string representation
     * @throws IllegalArgumentException if the payload is not supported
     */
    String serialize(Object payload);

    /**
     * Deserialize payload.
     * @param payload serialized representation
     * @param type event type or snapshot source type it was stored with
     * @return the payload object
     * @throws IllegalArgumentException if the type is not known or payload is malformed
     */
    Object deserialize(String payload, String type);
}
