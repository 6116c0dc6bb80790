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

import dev.mars.huginn.core.AgentTask;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of one task poll: the entries that parsed into runnable tasks,
 * plus the entries that carried a task id but could not be parsed.
 *
 * <p>Rejected entries still have to be answered with a terminal report, so
 * they travel with the batch instead of being dropped at the parser.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public final class TaskBatch {

    private static final TaskBatch EMPTY = new TaskBatch(List.of(), List.of());

    private final List<AgentTask> tasks;
    private final List<Rejected> rejected;

    public TaskBatch(List<AgentTask> tasks, List<Rejected> rejected) {
        this.tasks = Collections.unmodifiableList(Objects.requireNonNull(tasks, "tasks cannot be null"));
        this.rejected = Collections.unmodifiableList(Objects.requireNonNull(rejected, "rejected cannot be null"));
    }

    public static TaskBatch empty() {
        return EMPTY;
    }

    public List<AgentTask> getTasks() {
        return tasks;
    }

    public List<Rejected> getRejected() {
        return rejected;
    }

    /**
     * Number of entries that need a report: parsed tasks plus rejected ones.
     */
    public int size() {
        return tasks.size() + rejected.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * A task entry with an id that could not be turned into an {@link AgentTask}.
     */
    public static final class Rejected {

        private final String taskId;
        private final String reason;
        private final JsonObject entry;

        public Rejected(String taskId, String reason, JsonObject entry) {
            this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
            this.reason = reason != null ? reason : "Malformed task entry";
            this.entry = entry != null ? entry.copy() : new JsonObject().put("task_id", taskId);
        }

        public String getTaskId() {
            return taskId;
        }

        public String getReason() {
            return reason;
        }

        /**
         * The raw entry as served by the backend.
         */
        public JsonObject getEntry() {
            return entry.copy();
        }

        /**
         * The raw type value as a metrics label, or {@code unknown} when absent.
         */
        public String getTypeLabel() {
            Object raw = entry.getValue("type");
            return raw != null ? raw.toString() : "unknown";
        }

        @Override
        public String toString() {
            return "Rejected{taskId='" + taskId + "', reason='" + reason + "'}";
        }
    }
}
