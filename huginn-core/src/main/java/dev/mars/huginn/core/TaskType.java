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
 * Kinds of work an administrator can issue to an agent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public enum TaskType {

    RUN_COMMAND("run_command"),
    RUN_SCRIPT("run_script"),
    INSTALL_SOFTWARE("install_software"),
    APPLY_POLICY("apply_policy");

    private final String value;

    TaskType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @throws IllegalArgumentException if the value is {@code null} or not recognized
     */
    public static TaskType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task type must not be null");
        }
        for (TaskType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
