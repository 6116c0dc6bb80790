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
import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Point-in-time view of the agent, computed when requested.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-09
 */
public final class AgentStatus {

    private final boolean running;
    private final boolean authenticated;
    private final String agentId;
    private final Instant tokenExpiry;
    private final AgentState state;

    public AgentStatus(boolean running, boolean authenticated, String agentId, Instant tokenExpiry,
                       AgentState state) {
        this.running = running;
        this.authenticated = authenticated;
        this.agentId = agentId;
        this.tokenExpiry = tokenExpiry;
        this.state = state;
    }

    @JsonProperty("running")
    public boolean isRunning() {
        return running;
    }

    @JsonProperty("authenticated")
    public boolean isAuthenticated() {
        return authenticated;
    }

    @JsonProperty("agentId")
    public String getAgentId() {
        return agentId;
    }

    @JsonProperty("tokenExpiry")
    public Instant getTokenExpiry() {
        return tokenExpiry;
    }

    @JsonProperty("state")
    public AgentState getState() {
        return state;
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("running", running)
                .put("authenticated", authenticated)
                .put("agentId", agentId)
                .put("tokenExpiry", tokenExpiry != null ? tokenExpiry.toString() : null)
                .put("state", state.getValue());
    }

    @Override
    public String toString() {
        return "AgentStatus{running=" + running + ", authenticated=" + authenticated
                + ", agentId='" + agentId + "', tokenExpiry=" + tokenExpiry + ", state=" + state + '}';
    }
}
