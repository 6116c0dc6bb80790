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
import dev.mars.huginn.core.AgentTask;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches the tasks the backend has queued for this agent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class TaskPollingService {

    private static final Logger logger = LoggerFactory.getLogger(TaskPollingService.class);

    private final RequestDispatcher dispatcher;

    public TaskPollingService(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Poll the backend for pending tasks. Entries with a task id that cannot be
     * parsed come back as rejected so the caller can fail them; entries without
     * any task id are skipped.
     *
     * @return Future containing the polled batch; fails when the request itself fails
     */
    public Future<TaskBatch> fetchPendingTasks(String agentId) {
        return dispatcher.request(BackendEndpoints.GET_TASKS, new JsonObject().put("agent_id", agentId), true)
                .map(response -> {
                    Object raw = response.getValue("tasks");
                    if (!(raw instanceof JsonArray)) {
                        return TaskBatch.empty();
                    }
                    JsonArray entries = (JsonArray) raw;
                    List<AgentTask> tasks = new ArrayList<>(entries.size());
                    List<TaskBatch.Rejected> rejected = new ArrayList<>();
                    for (int i = 0; i < entries.size(); i++) {
                        Object value = entries.getValue(i);
                        JsonObject entry = value instanceof JsonObject ? (JsonObject) value : null;
                        Optional<String> taskId = AgentTask.idOf(entry);
                        if (taskId.isEmpty()) {
                            logger.warn("Skipping task entry {} without task_id", i);
                            continue;
                        }
                        try {
                            tasks.add(AgentTask.fromJson(entry));
                        } catch (IllegalArgumentException e) {
                            logger.warn("Task {} cannot be run: {}", taskId.get(), e.getMessage());
                            rejected.add(new TaskBatch.Rejected(taskId.get(), e.getMessage(), entry));
                        }
                    }
                    logger.debug("Polled for tasks: found {} pending tasks, {} rejected", tasks.size(),
                            rejected.size());
                    return new TaskBatch(tasks, rejected);
                });
    }
}
