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

package dev.mars.huginn.agent.service;

import dev.mars.huginn.agent.config.BackendEndpoints;
import dev.mars.huginn.core.TaskResult;
import dev.mars.huginn.core.TaskStatus;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports task progress to the backend.
 *
 * <p>Reports never fail their future: a report that cannot be delivered after the
 * dispatcher's retries is logged and the loop moves on.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class TaskStatusReportingService {

    private static final Logger logger = LoggerFactory.getLogger(TaskStatusReportingService.class);

    private final RequestDispatcher dispatcher;

    public TaskStatusReportingService(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Reports that a task has been picked up.
     *
     * @return Future completing with {@code true} if the backend accepted the report
     */
    public Future<Boolean> reportRunning(String agentId, String taskId) {
        JsonObject body = new JsonObject()
                .put("agent_id", agentId)
                .put("task_id", taskId)
                .put("status", TaskStatus.RUNNING.getValue());
        return send(body, taskId, TaskStatus.RUNNING);
    }

    /**
     * Reports the terminal outcome of a task, merging its result fields into the body.
     */
    public Future<Boolean> reportResult(String agentId, TaskResult result) {
        JsonObject body = new JsonObject().put("agent_id", agentId).mergeIn(result.toJson());
        return send(body, result.getTaskId(), result.getStatus());
    }

    private Future<Boolean> send(JsonObject body, String taskId, TaskStatus status) {
        return dispatcher.request(BackendEndpoints.UPDATE_TASK, body, true)
                .map(response -> {
                    logger.debug("Reported task {} as {}", taskId, status);
                    return true;
                })
                .recover(err -> {
                    logger.error("Failed to report task {} as {}: {}", taskId, status, err.getMessage());
                    return Future.succeededFuture(false);
                });
    }
}
