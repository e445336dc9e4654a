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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dependencies of Dispatcher.
 */
public interface DispatcherConfiguration {
    String dispatcherName();

    /**
     * The thread pool tasks run on.
     * @return the executor service instance
     */
    ExecutorService executorService();

    /**
     * Threadpool for handling timeouts. <strong>Should be different from executorService!</strong>. When same thread
     * pools would be used, and the execution would block, the timed out tasks would not be cancelled as there would be
     * no free threads to perform the cancellation.
     * @return scheduled executor service instance, or null when timeouts are not used
     */
    ScheduledExecutorService schedulerService();
}
