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

package dev.mars.huginn.agent.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle events raised by the agent, with the names hosts subscribe to.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public enum AgentEventType {

    ENROLLED("enrolled"),
    ENROLLMENT_FAILED("enrollmentFailed"),
    TOKEN_REFRESHED("tokenRefreshed"),
    TOKEN_REFRESH_FAILED("tokenRefreshFailed"),
    STARTED("started"),
    STOPPED("stopped"),
    TASK_COMPLETED("taskCompleted"),
    TASK_FAILED("taskFailed"),
    TELEMETRY_SENT("telemetrySent"),
    TELEMETRY_FAILED("telemetryFailed"),
    AUTHENTICATION_FAILED("authenticationFailed");

    private final String value;

    AgentEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static AgentEventType fromValue(String value) {
        for (AgentEventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown agent event: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
