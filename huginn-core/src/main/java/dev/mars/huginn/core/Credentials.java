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

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable credential bundle issued to an enrolled agent.
 *
 * <p>A bundle is always complete: access token, refresh token, agent id and
 * absolute expiry are all present. A refresh replaces the bundle with a new
 * instance rather than mutating it, so readers never observe a half-updated
 * token pair.</p>
 *
 * <p>The persisted form uses the backend's field names
 * ({@code access_token}, {@code refresh_token}, {@code agent_id},
 * {@code expires_at} in epoch milliseconds).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public final class Credentials {

    private final String accessToken;
    private final String refreshToken;
    private final String agentId;
    private final Instant expiresAt;

    public Credentials(String accessToken, String refreshToken, String agentId, Instant expiresAt) {
        this.accessToken = requireText(accessToken, "accessToken");
        this.refreshToken = requireText(refreshToken, "refreshToken");
        this.agentId = requireText(agentId, "agentId");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public String getAgentId() {
        return agentId;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * True once {@code now} has reached {@code expiresAt - skew}.
     */
    public boolean isExpired(Instant now, Duration skew) {
        return !now.isBefore(expiresAt.minus(skew));
    }

    /**
     * Returns a bundle with a new access token and expiry. A {@code null}
     * refresh token or agent id keeps the current value.
     */
    public Credentials refreshed(String newAccessToken, String newRefreshToken, String newAgentId,
                                 Instant newExpiresAt) {
        return new Credentials(
                newAccessToken,
                newRefreshToken != null && !newRefreshToken.isBlank() ? newRefreshToken : refreshToken,
                newAgentId != null && !newAgentId.isBlank() ? newAgentId : agentId,
                newExpiresAt);
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("access_token", accessToken)
                .put("refresh_token", refreshToken)
                .put("agent_id", agentId)
                .put("expires_at", expiresAt.toEpochMilli());
    }

    /**
     * Parses a persisted bundle.
     *
     * @throws IllegalArgumentException if any field is missing or malformed
     */
    public static Credentials fromJson(JsonObject json) {
        if (json == null) {
            throw new IllegalArgumentException("Credential bundle is empty");
        }
        Instant expiresAt = parseExpiry(json.getValue("expires_at"));
        if (expiresAt == null) {
            throw new IllegalArgumentException("Credential bundle has no valid expires_at");
        }
        try {
            return new Credentials(
                    json.getString("access_token"),
                    json.getString("refresh_token"),
                    json.getString("agent_id"),
                    expiresAt);
        } catch (ClassCastException | NullPointerException e) {
            throw new IllegalArgumentException("Credential bundle is incomplete: " + e.getMessage(), e);
        }
    }

    /**
     * Works out the absolute expiry announced by a backend token response.
     *
     * <p>Accepts {@code expires_at} as epoch milliseconds or an ISO-8601
     * instant, then {@code expires_in} in seconds, and falls back to
     * {@code now + defaultLifetime}.</p>
     */
    public static Instant resolveExpiry(JsonObject response, Instant now, Duration defaultLifetime) {
        Instant expiresAt = parseExpiry(response.getValue("expires_at"));
        if (expiresAt != null) {
            return expiresAt;
        }
        Object expiresIn = response.getValue("expires_in");
        if (expiresIn instanceof Number) {
            return now.plusSeconds(((Number) expiresIn).longValue());
        }
        return now.plus(defaultLifetime);
    }

    static Instant parseExpiry(Object value) {
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            try {
                return Instant.parse(text);
            } catch (DateTimeException e) {
                try {
                    return Instant.ofEpochMilli(Long.parseLong(text));
                } catch (NumberFormatException ignored) {
                    return null;
                }
            }
        }
        return null;
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Credentials)) return false;
        Credentials that = (Credentials) o;
        return accessToken.equals(that.accessToken)
                && refreshToken.equals(that.refreshToken)
                && agentId.equals(that.agentId)
                && expiresAt.equals(that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessToken, refreshToken, agentId, expiresAt);
    }

    @Override
    public String toString() {
        // tokens stay out of logs
        return "Credentials{agentId='" + agentId + "', expiresAt=" + expiresAt + '}';
    }
}
