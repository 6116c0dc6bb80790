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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the health and status views.
 */
class AgentHealthTest {

    private static final Instant NOW = Instant.parse("2026-10-12T12:00:00Z");
    private static final Instant EXPIRY = Instant.parse("2026-10-13T12:00:00Z");

    @Test
    @DisplayName("Health level should follow running and authenticated flags")
    void levels() {
        assertEquals(AgentHealth.Level.HEALTHY, level(true, true));
        assertEquals(AgentHealth.Level.DEGRADED, level(true, false));
        assertEquals(AgentHealth.Level.DEGRADED, level(false, true));
        assertEquals(AgentHealth.Level.UNHEALTHY, level(false, false));
    }

    @Test
    @DisplayName("Health should serialize with wire names and ISO instants")
    void serialization() throws Exception {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        AgentStatus status = new AgentStatus(true, true, "A1", EXPIRY, AgentState.RUNNING);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(AgentHealth.of(status, NOW)));

        assertEquals("healthy", json.get("status").asText());
        assertEquals("2026-10-12T12:00:00Z", json.get("timestamp").asText());
        JsonNode details = json.get("details");
        assertTrue(details.get("running").asBoolean());
        assertEquals("A1", details.get("agentId").asText());
        assertEquals("2026-10-13T12:00:00Z", details.get("tokenExpiry").asText());
        assertEquals("running", details.get("state").asText());
    }

    @Test
    @DisplayName("Status JSON should carry nulls for an agent without credentials")
    void statusWithoutCredentials() {
        JsonObject json = new AgentStatus(false, false, null, null, AgentState.UNINITIALIZED).toJson();

        assertEquals("uninitialized", json.getString("state"));
        assertTrue(json.containsKey("agentId"));
        assertNull(json.getString("agentId"));
        assertNull(json.getString("tokenExpiry"));
    }

    private static AgentHealth.Level level(boolean running, boolean authenticated) {
        return AgentHealth.of(new AgentStatus(running, authenticated, "A1", EXPIRY, AgentState.READY), NOW).getStatus();
    }
}
