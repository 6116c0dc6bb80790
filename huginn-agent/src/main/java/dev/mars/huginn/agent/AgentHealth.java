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

package dev.mars.huginn.agent;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * Health summary: {@code healthy} when the agent is running with valid credentials,
 * {@code degraded} when only one of the two holds, {@code unhealthy} otherwise.
 */
public final class AgentHealth {

    public enum Level {
        HEALTHY("healthy"),
        DEGRADED("degraded"),
        UNHEALTHY("unhealthy");

        private final String value;

        Level(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    private final Level status;
    private final AgentStatus details;
    private final Instant timestamp;

    public AgentHealth(Level status, AgentStatus details, Instant timestamp) {
        this.status = status;
        this.details = details;
        this.timestamp = timestamp;
    }

    static AgentHealth of(AgentStatus details, Instant timestamp) {
        Level level;
        if (details.isRunning() && details.isAuthenticated()) {
            level = Level.HEALTHY;
        } else if (details.isRunning() || details.isAuthenticated()) {
            level = Level.DEGRADED;
        } else {
            level = Level.UNHEALTHY;
        }
        return new AgentHealth(level, details, timestamp);
    }

    @JsonProperty("status")
    public Level getStatus() {
        return status;
    }

    @JsonProperty("details")
    public AgentStatus getDetails() {
        return details;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }
}
