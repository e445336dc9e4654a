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

import java.util.List;

/**
 * Decides which events a command produces. Must not change the state it is given.
 * @param <S> type of aggregate state
 * @param <C> type of command
 */
@FunctionalInterface
public interface CommandHandler<S, C> {

    /**
     * Handle command.
     * @param state current state of the aggregate
     * @param command the command
     * @return events to append, empty list or null when nothing happened
     * @throws Exception to reject the command. Rejections are passed to the caller as they are, without retries.
     */
    List<?> handle(S state, C command) throws Exception;
}
