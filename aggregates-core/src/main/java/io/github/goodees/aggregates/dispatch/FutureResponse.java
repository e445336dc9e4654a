package io.github.goodees.aggregates.dispatch;

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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Result of a dispatched task as handed to the caller. Callers may only cancel it, completion is reserved to the
 * dispatcher. The response tracks the stage of its task, so that cancellation and timeouts can tell a queued task
 * from a running one.
 */
final class FutureResponse<T> extends CompletableFuture<T> {

    enum Stage {
        QUEUED, RUNNING, FINISHED
    }

    private final AtomicReference<Stage> stage = new AtomicReference<>(Stage.QUEUED);
    private final String key;
    private final Runnable dequeue;

    FutureResponse(String key, Runnable dequeue) {
        this.key = key;
        this.dequeue = dequeue;
    }

    /**
     * Claim the task for execution.
     * @return false if the task was cancelled or expired while queued
     */
    boolean start() {
        return stage.compareAndSet(Stage.QUEUED, Stage.RUNNING);
    }

    void succeed(T value) {
        stage.set(Stage.FINISHED);
        super.complete(value);
    }

    void fail(Throwable failure) {
        stage.set(Stage.FINISHED);
        super.completeExceptionally(failure);
    }

    /**
     * Deadline of the task passed. Queued task is cancelled, caller of running task gets {@link TimeoutException}.
     * @return the stage the task was in at the deadline
     */
    Stage expire() {
        if (cancel(true)) {
            return Stage.QUEUED;
        }
        if (stage.get() == Stage.RUNNING && super.completeExceptionally(
                new TimeoutException("Task for " + key + " did not complete in time, it is still running"))) {
            return Stage.RUNNING;
        }
        return Stage.FINISHED;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (!stage.compareAndSet(Stage.QUEUED, Stage.FINISHED)) {
            return false;
        }
        dequeue.run();
        return super.cancel(mayInterruptIfRunning);
    }

    @Override
    public boolean complete(T value) {
        throw readOnly();
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        throw readOnly();
    }

    @Override
    public void obtrudeValue(T value) {
        throw readOnly();
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw readOnly();
    }

    private static UnsupportedOperationException readOnly() {
        return new UnsupportedOperationException("Response of dispatched task is completed by the dispatcher only");
    }
}
