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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs tasks on a shared executor, one at a time per key and in submission order. Every key gets its own mailbox.
 * Tasks of different keys run in parallel. Aggregate runtimes key the tasks by aggregate id, subscriptions by
 * subscription.
 */
public class Dispatcher {

    private final DispatcherConfiguration conf;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Logger logger;

    public Dispatcher(DispatcherConfiguration conf) {
        this.conf = conf;
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
    }

    /**
     * Queue a task behind earlier tasks of the same key.
     *
     * @param key  serialization key, e.g. aggregate id
     * @param task task to run
     * @param <T>  type of result
     * @return the promise for the result
     */
    public <T> CompletableFuture<T> execute(String key, Callable<T> task) {
        return enqueue(key, task, 0, null);
    }

    /**
     * Schedule a task with timeout. If the task doesn't start until timeout, it is cancelled and will never run, and
     * the result completes with {@code CancellationException}. If it is running at that time, the result completes
     * exceptionally with {@code TimeoutException}, while the task runs to its end.
     * @param key serialization key
     * @param task the task
     * @param timeout timeout for completion
     * @param unit timeout unit
     * @param <T> result type
     * @return the promise for the result
     */
    public <T> CompletableFuture<T> executeWithTimeout(String key, Callable<T> task, long timeout, TimeUnit unit) {
        if (conf.schedulerService() == null) {
            throw new IllegalStateException("Dispatcher " + conf.dispatcherName() + " has no scheduler for timeouts");
        }
        return enqueue(key, task, timeout, unit);
    }

    private <T> CompletableFuture<T> enqueue(String key, Callable<T> task, long timeout, TimeUnit unit) {
        for (;;) {
            Mailbox mailbox = mailboxes.computeIfAbsent(key, Mailbox::new);
            CompletableFuture<T> result = mailbox.add(task, timeout, unit);
            if (result != null) {
                return result;
            }
            // the mailbox drained and retired meanwhile
            mailboxes.remove(key, mailbox);
        }
    }

    /**
     * Mailboxes are released once they have no more tasks to run.
     * @return number of keys that have tasks queued or running
     */
    public int mailboxCount() {
        return mailboxes.size();
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null
                && (ex instanceof CompletionException || ex instanceof ExecutionException)) {
            ex = ex.getCause();
        }
        return ex;
    }

    /**
     * Tasks of a single key. The mailbox is submitted to the executor when its first task arrives, and resubmits
     * itself after each task while there is more work. {@code pending} counts tasks added since the drain started,
     * and the drain only stops when that count did not change during the last empty poll. A drained mailbox retires
     * by setting the count to -1 and leaves the dispatcher, tasks are no longer accepted by it.
     */
    class Mailbox implements Runnable {
        private final String key;
        private final Deque<Entry<?>> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger pending = new AtomicInteger();
        private final AtomicReference<Entry<?>> running = new AtomicReference<>();

        Mailbox(String key) {
            this.key = key;
        }

        /**
         * @return the response, or null when the mailbox has retired
         */
        <T> CompletableFuture<T> add(Callable<T> task, long timeout, TimeUnit unit) {
            Entry<T> entry = new Entry<>(task);
            queue.add(entry);
            int before;
            do {
                before = pending.get();
                if (before < 0) {
                    queue.remove(entry);
                    return null;
                }
            } while (!pending.compareAndSet(before, before + 1));
            if (unit != null) {
                entry.arm(timeout, unit);
            }
            if (before == 0) {
                logger.debug("Starting to drain mailbox {}", key);
                conf.executorService().submit(this);
            } else {
                logger.debug("Mailbox {} is draining, {} tasks added meanwhile", key, before);
            }
            return entry.result;
        }

        @Override
        public void run() {
            Entry<?> entry = poll();
            if (entry == null) {
                return;
            }
            if (running.compareAndSet(null, entry)) {
                entry.run();
            } else {
                logger.error("Mailbox {} ran while {} was still running, returning {} to the queue", key,
                    running.get(), entry);
                queue.addFirst(entry);
            }
        }

        private Entry<?> poll() {
            for (;;) {
                int seen = pending.get();
                Entry<?> entry = queue.poll();
                if (entry != null) {
                    return entry;
                }
                // an add between the poll and here changed the count, so poll again
                if (pending.compareAndSet(seen, 0)) {
                    if (pending.compareAndSet(0, -1)) {
                        mailboxes.remove(key, this);
                        logger.debug("Mailbox {} drained and released", key);
                    }
                    return null;
                }
            }
        }

        /**
         * Single submitted task together with the response handed to its caller.
         * @param <T> result type
         */
        class Entry<T> implements Runnable {

            private final Callable<T> task;
            private final FutureResponse<T> result = new FutureResponse<>(key, this::dequeue);
            private final Instant submittedAt = Instant.now();
            private volatile ScheduledFuture<?> deadline;
            private volatile Instant startedAt;

            Entry(Callable<T> task) {
                this.task = task;
            }

            void arm(long timeout, TimeUnit unit) {
                deadline = conf.schedulerService().schedule(this::expire, timeout, unit);
            }

            @Override
            public void run() {
                if (!result.start()) {
                    logger.debug("Skipping cancelled task {}", this);
                    next();
                    return;
                }
                startedAt = Instant.now();
                try {
                    result.succeed(task.call());
                } catch (Exception e) {
                    result.fail(e);
                } catch (Error e) {
                    result.fail(e);
                    throw e;
                } finally {
                    ScheduledFuture<?> armed = deadline;
                    if (armed != null) {
                        armed.cancel(false);
                    }
                    next();
                }
            }

            private void next() {
                if (running.compareAndSet(this, null)) {
                    conf.executorService().submit(Mailbox.this);
                } else {
                    logger.error("Task {} completed but mailbox {} was running {}", this, key, running.get());
                }
            }

            private void dequeue() {
                queue.remove(this);
            }

            private void expire() {
                switch (result.expire()) {
                    case QUEUED:
                        logger.info("Task {} expired before it started, mailbox is running {}", this, running.get());
                        break;
                    case RUNNING:
                        // caller stops waiting, the task itself runs to its end
                        logger.warn("Task {} is still running past its deadline", this);
                        break;
                    default:
                        break;
                }
            }

            @Override
            public String toString() {
                return "Task[key=" + key + ", task=" + task + ", submitted=" + submittedAt + ", started=" + startedAt
                        + "]";
            }
        }
    }
}
