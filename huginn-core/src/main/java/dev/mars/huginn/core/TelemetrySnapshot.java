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

import java.time.Instant;
import java.util.Objects;

/**
 * Opaque telemetry bundle produced by a telemetry collector. The agent only
 * transports it; section names and contents are owned by the collector.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public final class TelemetrySnapshot {

    public static final String HARDWARE = "hardware";
    public static final String SOFTWARE = "software";
    public static final String SECURITY = "security";
    public static final String NETWORK = "network";
    public static final String POLICIES = "policies";
    public static final String PERFORMANCE = "performance";

    private final JsonObject sections;
    private final Instant timestamp;

    public TelemetrySnapshot(JsonObject sections, Instant timestamp) {
        this.sections = Objects.requireNonNull(sections, "sections cannot be null").copy();
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }

    public JsonObject getSection(String name) {
        JsonObject section = sections.getJsonObject(name);
        return section != null ? section.copy() : new JsonObject();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public JsonObject toJson() {
        return sections.copy().put("timestamp", timestamp.toString());
    }
}
