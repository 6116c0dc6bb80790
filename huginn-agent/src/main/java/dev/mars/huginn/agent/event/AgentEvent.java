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

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Objects;

/**
 * A lifecycle event: type, payload and the instant it was raised.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public final class AgentEvent {

    private final AgentEventType type;
    private final JsonObject data;
    private final Instant timestamp;

    public AgentEvent(AgentEventType type, JsonObject data, Instant timestamp) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.data = data != null ? data.copy() : new JsonObject();
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }

    public AgentEventType getType() {
        return type;
    }

    public JsonObject getData() {
        return data.copy();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Event-bus message form: {@code {event, timestamp, data}}.
     */
    public JsonObject toJson() {
        return new JsonObject()
                .put("event", type.getValue())
                .put("timestamp", timestamp.toString())
                .put("data", data.copy());
    }

    @Override
    public String toString() {
        return "AgentEvent{" + type + ", data=" + data.encode() + '}';
    }
}
