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

package dev.mars.huginn.agent.spi;

import dev.mars.huginn.core.AgentTask;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Runs a single task. A failed future, or an exception thrown from {@link #execute},
 * ends the task as {@code failed}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 */
@FunctionalInterface
public interface TaskExecutor {

    /**
     * @param task the task to run
     * @return a future completing with the task's result payload
     */
    Future<JsonObject> execute(AgentTask task);
}
