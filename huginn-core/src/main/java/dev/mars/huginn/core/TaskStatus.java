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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status values reported to the backend for a task.
 *
 * <p>{@code RUNNING} is reported when execution starts. Exactly one of the
 * terminal values follows it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public enum TaskStatus {

    RUNNING("running", false),
    COMPLETED("completed", true),
    FAILED("failed", true),
    TIMEOUT("timeout", true);

    private final String value;
    private final boolean terminal;

    TaskStatus(String value, boolean terminal) {
        this.value = value;
        this.terminal = terminal;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccessful() {
        return this == COMPLETED;
    }

    @Override
    public String toString() {
        return value;
    }
}
