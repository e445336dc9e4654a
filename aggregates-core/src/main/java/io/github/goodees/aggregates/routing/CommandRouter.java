package io.github.goodees.aggregates.routing;

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

import io.github.goodees.aggregates.core.AggregateRuntime;
import io.github.goodees.aggregates.core.CommandHandler;
import io.github.goodees.aggregates.core.ExecutionContext;
import io.github.goodees.aggregates.core.ExecutionResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Static table from command classes to the runtime, aggregate identity and handler that process them. Routes are
 * matched in order of registration, first route whose class the command is instance of wins.
 */
public class CommandRouter {

    private final List<Route<?, ?>> routes;

    private CommandRouter(Builder builder) {
        this.routes = new ArrayList<>(builder.routes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompletableFuture<? extends ExecutionResult<?>> dispatch(Object command) {
        return dispatch(command, ExecutionContext.create());
    }

    /**
     * Pass command to the runtime of its aggregate.
     * @param command the command
     * @param context tracing data for produced events
     * @return result of the runtime, or future completed with {@link UnregisteredCommandException}
     */
    public CompletableFuture<? extends ExecutionResult<?>> dispatch(Object command, ExecutionContext context) {
        if (command != null) {
            for (Route<?, ?> route : routes) {
                if (route.commandClass.isInstance(command)) {
                    return route.dispatch(command, context);
                }
            }
        }
        CompletableFuture<ExecutionResult<?>> result = new CompletableFuture<>();
        result.completeExceptionally(new UnregisteredCommandException(command));
        return result;
    }

    /**
     * @param command the command
     * @return whether any route accepts the command
     */
    public boolean isRegistered(Object command) {
        for (Route<?, ?> route : routes) {
            if (route.commandClass.isInstance(command)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Builder for command router.
     */
    public static class Builder {
        private final List<Route<?, ?>> routes = new ArrayList<>();

        /**
         * Route commands of given class.
         * @param commandClass class of command
         * @param runtime runtime of the target aggregate
         * @param identity extracts aggregate id from the command
         * @param handler command handler
         * @param <S> type of aggregate state
         * @param <C> type of command
         * @return this builder
         * @throws IllegalArgumentException when the class is routed already
         */
        public <S, C> Builder route(Class<C> commandClass, AggregateRuntime<S> runtime,
                Function<? super C, String> identity, CommandHandler<S, ? super C> handler) {
            for (Route<?, ?> route : routes) {
                if (route.commandClass.equals(commandClass)) {
                    throw new IllegalArgumentException("Command " + commandClass.getName() + " is routed already");
                }
            }
            routes.add(new Route<>(commandClass, runtime, identity, handler));
            return this;
        }

        public CommandRouter build() {
            return new CommandRouter(this);
        }
    }

    static class Route<S, C> {
        private final Class<C> commandClass;
        private final AggregateRuntime<S> runtime;
        private final Function<? super C, String> identity;
        private final CommandHandler<S, ? super C> handler;

        Route(Class<C> commandClass, AggregateRuntime<S> runtime, Function<? super C, String> identity,
                CommandHandler<S, ? super C> handler) {
            this.commandClass = Objects.requireNonNull(commandClass, "Command class must be defined");
            this.runtime = Objects.requireNonNull(runtime, "Runtime must be defined");
            this.identity = Objects.requireNonNull(identity, "Identity must be defined");
            this.handler = Objects.requireNonNull(handler, "Handler must be defined");
        }

        CompletableFuture<ExecutionResult<S>> dispatch(Object command, ExecutionContext context) {
            C cast = commandClass.cast(command);
            String aggregateId = identity.apply(cast);
            if (aggregateId == null || aggregateId.isEmpty()) {
                CompletableFuture<ExecutionResult<S>> result = new CompletableFuture<>();
                result.completeExceptionally(new IllegalArgumentException("Command " + command
                        + " does not identify its aggregate"));
                return result;
            }
            return runtime.execute(aggregateId, cast, handler, context);
        }
    }
}
