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

import io.github.goodees.aggregates.dispatch.Dispatcher;
import io.github.goodees.aggregates.dispatch.DispatcherConfiguration;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Facade for executing commands against aggregates of one kind.
 *
 * <p>The runtime keeps one {@link AggregateProcess} per aggregate id in its working memory, and passes every call
 * through a {@link Dispatcher} mailbox of that id. Calls for single aggregate therefore run one at a time in order of
 * submission, calls for different aggregates run in parallel on {@link #getExecutorService()}.</p>
 *
 * <p>Execution flow of a command:</p>
 * <ol>
 *     <li>The process is looked up in working memory. New process replays the aggregate's stream first.</li>
 *     <li>The command handler produces events from current state.</li>
 *     <li>Events are appended with expected version equal to the state's version. On success they're applied to the
 *     state and the result is returned.</li>
 *     <li>On conflict the process reloads the stream and tries again, {@link #commandAttempts()} times in total.
 *     Then the call fails with {@link AggregateConflictException}.</li>
 *     <li>Exceptions thrown by the handler fail the call as they are. Any other failure also discards the process, so
 *     that next call starts by replaying the stream.</li>
 * </ol>
 * @param <S> type of aggregate state
 */
public abstract class AggregateRuntime<S> {
    public static final int DEFAULT_COMMAND_ATTEMPTS = 3;

    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final ConcurrentMap<String, AggregateProcess<S>> workingMemory = new ConcurrentHashMap<>();
    private volatile Dispatcher dispatcher;

    protected abstract Aggregate<S> getAggregate();

    protected abstract EventStore getEventStore();

    /**
     * ExecutorService, that will run the commands. Should usually be backed by multiple threads.
     * @return instance of executor service
     */
    protected abstract ExecutorService getExecutorService();

    /**
     * ScheduledExecutorService, that will handle timeouts of the commands. Must not use same thread pool like
     * {@link #getExecutorService()}, because in case that pool is overflowing, the timeouts would not get executed
     * @return instance of ScheduledExecutorService
     */
    protected abstract ScheduledExecutorService getScheduler();

    /**
     * The abstract name for the aggregates the runtime is servicing. Used for better log messages, and log
     * destinations.
     * @return short name describing the aggregates
     */
    protected abstract String getAggregateName();

    /**
     * Number of append attempts of single command before giving up on conflicts.
     */
    protected int commandAttempts() {
        return DEFAULT_COMMAND_ATTEMPTS;
    }

    /**
     * Page size for replaying streams.
     */
    protected int readBatchSize() {
        return EventStore.DEFAULT_BATCH_SIZE;
    }

    /**
     * Whether the processes read and store snapshots at all. Runtimes enabling snapshots also override
     * {@link #shouldStoreSnapshot(AggregateState, int)}.
     */
    protected boolean snapshotsEnabled() {
        return false;
    }

    /**
     * Decide whether to snapshot the aggregate after a command.
     * @param state state after the command
     * @param eventsSinceSnapshot events applied since last snapshot, or since recovery
     * @return true to store a snapshot
     */
    protected boolean shouldStoreSnapshot(AggregateState<S> state, int eventsSinceSnapshot) {
        return false;
    }

    protected String eventType(Object event) {
        return EventType.defaultTypeName(event.getClass());
    }

    protected String snapshotType(Object snapshot) {
        return EventType.defaultTypeName(snapshot.getClass());
    }

    /**
     * Execute command with fresh execution context.
     * @see #execute(String, Object, CommandHandler, ExecutionContext)
     */
    public <C> CompletableFuture<ExecutionResult<S>> execute(String aggregateId, C command,
            CommandHandler<S, ? super C> handler) {
        return execute(aggregateId, command, handler, ExecutionContext.create());
    }

    /**
     * Execute command against an aggregate.
     * @param aggregateId identity of the aggregate
     * @param command the command
     * @param handler handler producing events
     * @param context tracing data for the events
     * @param <C> type of command
     * @return result of the command, or the handler's exception, or {@link AggregateConflictException}, or
     *     {@link EventStoreException}
     */
    public <C> CompletableFuture<ExecutionResult<S>> execute(String aggregateId, C command,
            CommandHandler<S, ? super C> handler, ExecutionContext context) {
        checkArguments(aggregateId, command, handler, context);
        return getDispatcher().execute(aggregateId, () -> invoke(aggregateId, command, handler, context));
    }

    /**
     * Execute the command with given timeout. If the command has not yet started until timeout expires, it will finish
     * with {@link java.util.concurrent.CancellationException} and will never run. If it is running at that time, it
     * finishes with {@link java.util.concurrent.TimeoutException}, but its events may still get appended.
     * @see #execute(String, Object, CommandHandler, ExecutionContext)
     */
    public <C> CompletableFuture<ExecutionResult<S>> executeWithTimeout(String aggregateId, C command,
            CommandHandler<S, ? super C> handler, ExecutionContext context, long timeout, TimeUnit unit) {
        checkArguments(aggregateId, command, handler, context);
        return getDispatcher().executeWithTimeout(aggregateId, () -> invoke(aggregateId, command, handler, context),
            timeout, unit);
    }

    /**
     * Current state of an aggregate. Waits for commands submitted before. Aggregate that is not in memory is loaded
     * from the store.
     * @param aggregateId identity of the aggregate
     * @return immutable state
     */
    public CompletableFuture<AggregateState<S>> state(String aggregateId) {
        Objects.requireNonNull(aggregateId, "aggregateId");
        return getDispatcher().execute(aggregateId, () -> {
            AggregateProcess<S> process = lookup(aggregateId);
            try {
                return process.state();
            } catch (EventStoreException | RuntimeException e) {
                evict(aggregateId, process, e);
                throw e;
            }
        });
    }

    /**
     * Remove aggregate from memory. Its next command starts by replaying its stream.
     * @param aggregateId identity of the aggregate
     * @return promise completing once previously submitted commands finish
     */
    public CompletableFuture<Void> stop(String aggregateId) {
        Objects.requireNonNull(aggregateId, "aggregateId");
        return getDispatcher().execute(aggregateId, () -> {
            if (workingMemory.remove(aggregateId) != null) {
                logger.debug("{} {} stopped", getAggregateName(), aggregateId);
            }
            return null;
        });
    }

    /**
     * @return number of aggregates held in memory
     */
    public int activeCount() {
        return workingMemory.size();
    }

    private <C> ExecutionResult<S> invoke(String aggregateId, C command, CommandHandler<S, ? super C> handler,
            ExecutionContext context) throws Exception {
        AggregateProcess<S> process = lookup(aggregateId);
        try {
            process.ensureReady();
        } catch (EventStoreException | RuntimeException e) {
            evict(aggregateId, process, e);
            throw e;
        }
        try {
            return process.execute(command, handler, context);
        } catch (EventStoreException e) {
            evict(aggregateId, process, e);
            throw e;
        }
    }

    private AggregateProcess<S> lookup(String aggregateId) {
        return workingMemory.computeIfAbsent(aggregateId, id -> new AggregateProcess<>(id, this));
    }

    private void evict(String aggregateId, AggregateProcess<S> process, Exception cause) {
        if (workingMemory.remove(aggregateId, process)) {
            logger.warn("{} {} removed from memory after failure: {}", getAggregateName(), aggregateId,
                cause.toString());
        }
    }

    private static void checkArguments(String aggregateId, Object command, Object handler, Object context) {
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(context, "context");
    }

    /**
     * Lazily initialized {@link Dispatcher}.
     * @return the dispatcher of the runtime
     */
    protected Dispatcher getDispatcher() {
        if (dispatcher == null) {
            initialize();
        }
        return dispatcher;
    }

    private synchronized void initialize() {
        if (dispatcher == null) {
            this.dispatcher = new Dispatcher(getDispatcherConfiguration());
        }
    }

    /**
     * Configuration of the dispatcher, delegating to {@link #getAggregateName()}, {@link #getExecutorService()} and
     * {@link #getScheduler()}.
     * @return dispatcher configuration
     */
    protected DispatcherConfiguration getDispatcherConfiguration() {
        return new DispatcherConfiguration() {
            @Override
            public String dispatcherName() {
                return getAggregateName();
            }

            @Override
            public ExecutorService executorService() {
                return getExecutorService();
            }

            @Override
            public ScheduledExecutorService schedulerService() {
                return getScheduler();
            }
        };
    }
}
