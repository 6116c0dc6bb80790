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
import java.util.Objects;
import java.util.Optional;

/**
 * A unit of administrator-issued work received from the backend.
 *
 * <p>Immutable once parsed; the payload is copied on the way in and on the
 * way out, so an executor cannot change what later reports see.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public final class AgentTask {

    private final String taskId;
    private final TaskType type;
    private final JsonObject payload;
    private final int priority;
    private final Duration timeout;
    private final String createdAt;

    public AgentTask(String taskId, TaskType type, JsonObject payload, int priority,
                     Duration timeout, String createdAt) {
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.payload = payload != null ? payload.copy() : new JsonObject();
        this.priority = priority;
        this.timeout = timeout;
        this.createdAt = createdAt;
    }

    /**
     * Parses a task entry from the {@code tasks} array of the poll response.
     * Optional fields that are missing or of the wrong shape fall back to their
     * defaults; only the id and the type are mandatory.
     *
     * @throws IllegalArgumentException if the entry has no id or an unknown type
     */
    public static AgentTask fromJson(JsonObject json) {
        String taskId = idOf(json)
                .orElseThrow(() -> new IllegalArgumentException("Task entry has no task_id"));
        Object rawType = json.getValue("type");
        TaskType type = TaskType.fromValue(rawType instanceof String ? (String) rawType : null);

        Object rawPayload = json.getValue("payload");
        JsonObject payload = rawPayload instanceof JsonObject ? (JsonObject) rawPayload : new JsonObject();

        Object rawTimeout = json.getValue("timeout");
        Duration timeout = rawTimeout instanceof Number && ((Number) rawTimeout).longValue() > 0
                ? Duration.ofMillis(((Number) rawTimeout).longValue())
                : null;

        Object rawCreatedAt = json.getValue("created_at");
        return new AgentTask(taskId, type, payload, priorityOf(json.getValue("priority")), timeout,
                rawCreatedAt instanceof String ? (String) rawCreatedAt : null);
    }

    /**
     * Extracts the task id of a raw entry, accepting string or numeric ids.
     */
    public static Optional<String> idOf(JsonObject json) {
        if (json == null) {
            return Optional.empty();
        }
        Object raw = json.getValue("task_id");
        if (raw instanceof Number) {
            return Optional.of(raw.toString());
        }
        if (raw instanceof String && !((String) raw).isBlank()) {
            return Optional.of((String) raw);
        }
        return Optional.empty();
    }

    private static int priorityOf(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).intValue();
        }
        if (raw instanceof String) {
            try {
                return Integer.parseInt(((String) raw).trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    /**
     * The wire shape of this task, as carried in task events.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("task_id", taskId)
                .put("type", type.getValue())
                .put("payload", payload.copy())
                .put("priority", priority);
        if (timeout != null) {
            json.put("timeout", timeout.toMillis());
        }
        if (createdAt != null) {
            json.put("created_at", createdAt);
        }
        return json;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskType getType() {
        return type;
    }

    public JsonObject getPayload() {
        return payload.copy();
    }

    public int getPriority() {
        return priority;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<String> getCreatedAt() {
        return Optional.ofNullable(createdAt);
    }

    @Override
    public String toString() {
        return "AgentTask{taskId='" + taskId + "', type=" + type + ", priority=" + priority + '}';
    }
}
