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

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dispatcher configuration given by its values.
 */
public class SimpleDispatcherConfiguration implements DispatcherConfiguration {
    private final String name;
    private final ExecutorService executorService;
    private final ScheduledExecutorService scheduler;

    public SimpleDispatcherConfiguration(String name, ExecutorService executorService,
            ScheduledExecutorService scheduler) {
        this.name = Objects.requireNonNull(name, "name");
        this.executorService = Objects.requireNonNull(executorService, "executorService");
        this.scheduler = scheduler;
    }

    /**
     * Configuration without scheduler, for dispatchers that never execute with timeout.
     */
    public SimpleDispatcherConfiguration(String name, ExecutorService executorService) {
        this(name, executorService, null);
    }

    @Override
    public String dispatcherName() {
        return name;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService schedulerService() {
        return scheduler;
    }
}
