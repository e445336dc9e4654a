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
 * Naming of event types derived from payload classes.
 */
public class EventType {
    private EventType() {

    }

    /**
     * Default implementation of type name. Strips Immutable prefix, and suffix Event.
     * @param simpleClassname the name of the event class
     * @return Simple name. ImmutableMoneyDepositedEvent becomes MoneyDeposited.
     */
    public static String defaultTypeName(String simpleClassname) {
        return fromSimpleClassnameStripping(simpleClassname, "Immutable", "Event");
    }

    public static String defaultTypeName(Class<?> clazz) {
        return defaultTypeName(clazz.getSimpleName());
    }

    public static String fromSimpleClassnameStripping(String simpleClassName, String prefix, String suffix) {
        int start = simpleClassName.startsWith(prefix) ? prefix.length() : 0;
        int end = simpleClassName.endsWith(suffix) ? simpleClassName.length() - suffix.length() : simpleClassName.length();
        return simpleClassName.substring(start, Math.max(start, end));
    }
}
