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

package dev.mars.huginn.core;

import io.vertx.core.json.JsonObject;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal outcome of one task execution. Produced exactly once per task
 * and reported to the backend through {@code /agent-update-task}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public final class TaskResult {

    private final String taskId;
    private final TaskStatus status;
    private final JsonObject result;
    private final String error;
    private final Duration executionTime;
    private final Instant completedAt;

    private TaskResult(String taskId, TaskStatus status, JsonObject result, String error,
                       Duration executionTime, Instant completedAt) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Task result requires a terminal status, got " + status);
        }
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
        this.status = status;
        this.result = result;
        this.error = error;
        this.executionTime = Objects.requireNonNull(executionTime, "executionTime cannot be null");
        this.completedAt = Objects.requireNonNull(completedAt, "completedAt cannot be null");
    }

    public static TaskResult completed(String taskId, JsonObject result, Duration executionTime, Instant completedAt) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, result, null, executionTime, completedAt);
    }

    public static TaskResult failed(String taskId, String error, Duration executionTime, Instant completedAt) {
        return new TaskResult(taskId, TaskStatus.FAILED, null, error, executionTime, completedAt);
    }

    public static TaskResult timedOut(String taskId, Duration limit, Duration executionTime, Instant completedAt) {
        return new TaskResult(taskId, TaskStatus.TIMEOUT, null,
                "Task exceeded timeout of " + limit.toMillis() + "ms", executionTime, completedAt);
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public boolean isSuccessful() {
        return status.isSuccessful();
    }

    public Optional<JsonObject> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Duration getExecutionTime() {
        return executionTime;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    /**
     * Fields merged into the status report, using the backend's names.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("task_id", taskId)
                .put("status", status.getValue())
                .put("execution_time", executionTime.toMillis())
                .put("completed_at", completedAt.toString());
        if (result != null) {
            json.put("result", result);
        }
        if (error != null) {
            json.put("error", error);
        }
        return json;
    }

    @Override
    public String toString() {
        return "TaskResult{taskId='" + taskId + "', status=" + status
                + ", executionTime=" + executionTime.toMillis() + "ms}";
    }
}
