/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.huginn.agent.support;

import dev.mars.huginn.agent.spi.TaskExecutor;
import dev.mars.huginn.core.AgentTask;
import dev.mars.huginn.core.TaskType;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Routes each task to the executor registered for its {@link TaskType}.
 *
 * <p>Tasks of a type with no registered executor fail with
 * {@link UnsupportedOperationException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class TaskTypeRouter implements TaskExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TaskTypeRouter.class);

    private final Map<TaskType, TaskExecutor> handlers = new EnumMap<>(TaskType.class);

    public TaskTypeRouter register(TaskType type, TaskExecutor executor) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(executor, "executor cannot be null");
        synchronized (handlers) {
            TaskExecutor previous = handlers.put(type, executor);
            if (previous != null) {
                logger.info("Replaced executor for task type {}", type);
            }
        }
        return this;
    }

    public boolean supports(TaskType type) {
        synchronized (handlers) {
            return handlers.containsKey(type);
        }
    }

    @Override
    public Future<JsonObject> execute(AgentTask task) {
        TaskExecutor handler;
        synchronized (handlers) {
            handler = handlers.get(task.getType());
        }
        if (handler == null) {
            return Future.failedFuture(new UnsupportedOperationException(
                    "No executor registered for task type " + task.getType()));
        }
        return handler.execute(task);
    }
}
