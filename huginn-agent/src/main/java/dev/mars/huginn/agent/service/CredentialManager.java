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

import dev.mars.huginn.agent.config.AgentConfiguration;
import dev.mars.huginn.agent.config.BackendEndpoints;
import dev.mars.huginn.agent.event.AgentEventPublisher;
import dev.mars.huginn.agent.event.AgentEventType;
import dev.mars.huginn.agent.spi.CredentialStore;
import dev.mars.huginn.core.Credentials;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Owns the agent's credential bundle: loading and persisting it, deciding when it is
 * expired, exchanging the refresh token, and arming the proactive refresh timer.
 *
 * <p>At most one refresh exchange is outstanding at a time. A {@link #refresh()} call made
 * while one is in flight receives the same future.</p>
 *
 * <p>Persistence failures are logged and never fail the caller; the agent keeps working
 * with the in-memory bundle.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class CredentialManager implements AuthSession {

    private static final Logger logger = LoggerFactory.getLogger(CredentialManager.class);
    private static final long NO_TIMER = -1L;

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final CredentialStore store;
    private final RequestDispatcher dispatcher;
    private final AgentEventPublisher events;
    private final Clock clock;

    private volatile Credentials credentials;
    private volatile long refreshTimerId = NO_TIMER;
    private volatile boolean schedulingEnabled = true;
    private Future<Boolean> inFlightRefresh;

    public CredentialManager(Vertx vertx, AgentConfiguration config, CredentialStore store,
                             RequestDispatcher dispatcher, AgentEventPublisher events) {
        this(vertx, config, store, dispatcher, events, Clock.systemUTC());
    }

    public CredentialManager(Vertx vertx, AgentConfiguration config, CredentialStore store,
                             RequestDispatcher dispatcher, AgentEventPublisher events, Clock clock) {
        this.vertx = vertx;
        this.config = config;
        this.store = store;
        this.dispatcher = dispatcher;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Reads the persisted bundle. A missing, unreadable or malformed bundle leaves the
     * manager empty.
     *
     * @return a future completing with {@code true} if credentials were loaded
     */
    public Future<Boolean> load() {
        return store.get(config.getServiceName())
                .map(raw -> {
                    if (raw == null || raw.isBlank()) {
                        logger.debug("No stored credentials for {}", config.getServiceName());
                        return false;
                    }
                    try {
                        credentials = Credentials.fromJson(new JsonObject(raw));
                        logger.info("Loaded stored credentials for agent {}", credentials.getAgentId());
                        return true;
                    } catch (DecodeException | ClassCastException | IllegalArgumentException e) {
                        logger.warn("Stored credentials are unreadable, ignoring them: {}", e.getMessage());
                        return false;
                    }
                })
                .recover(err -> {
                    logger.warn("Could not read credential store: {}", err.getMessage());
                    return Future.succeededFuture(false);
                });
    }

    /**
     * Persists the current bundle. Failures are logged only.
     */
    public Future<Void> save() {
        Credentials current = credentials;
        if (current == null) {
            return Future.succeededFuture();
        }
        return store.set(config.getServiceName(), current.toJson().encode())
                .recover(err -> {
                    logger.warn("Could not persist credentials, continuing in memory: {}", err.getMessage());
                    return Future.succeededFuture();
                });
    }

    /**
     * Replaces the in-memory bundle, persists it and re-arms the proactive refresh.
     */
    public Future<Void> adopt(Credentials newCredentials) {
        this.credentials = newCredentials;
        scheduleProactiveRefresh();
        return save();
    }

    @Override
    public Future<Void> clear() {
        cancelProactiveRefresh();
        credentials = null;
        return store.delete(config.getServiceName())
                .recover(err -> {
                    logger.warn("Could not delete stored credentials: {}", err.getMessage());
                    return Future.succeededFuture();
                });
    }

    @Override
    public String accessToken() {
        Credentials current = credentials;
        return current != null ? current.getAccessToken() : null;
    }

    @Override
    public boolean hasCredentials() {
        return credentials != null;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public String getAgentId() {
        Credentials current = credentials;
        return current != null ? current.getAgentId() : null;
    }

    /**
     * True when there are no credentials or the access token is within the refresh skew
     * of its expiry.
     */
    public boolean isExpired() {
        Credentials current = credentials;
        return current == null || current.isExpired(clock.instant(), config.getRefreshSkew());
    }

    @Override
    public synchronized Future<Boolean> refresh() {
        if (inFlightRefresh != null) {
            logger.debug("Token refresh already in flight, sharing its outcome");
            return inFlightRefresh;
        }
        Future<Boolean> attempt = doRefresh();
        if (!attempt.isComplete()) {
            inFlightRefresh = attempt;
            attempt.onComplete(ar -> clearInFlight(attempt));
        }
        return attempt;
    }

    private synchronized void clearInFlight(Future<Boolean> attempt) {
        if (inFlightRefresh == attempt) {
            inFlightRefresh = null;
        }
    }

    private Future<Boolean> doRefresh() {
        Credentials current = credentials;
        if (current == null) {
            logger.warn("Cannot refresh token: agent holds no credentials");
            return Future.succeededFuture(false);
        }

        JsonObject body = new JsonObject()
                .put("refresh_token", current.getRefreshToken())
                .put("agent_id", current.getAgentId());

        return dispatcher.request(BackendEndpoints.REFRESH_TOKEN, body, false)
                .compose(response -> {
                    String accessToken = response.getValue("access_token") instanceof String
                            ? response.getString("access_token") : null;
                    if (accessToken == null || accessToken.isBlank()) {
                        return Future.failedFuture(new IllegalStateException("response has no access_token"));
                    }
                    if (credentials != current) {
                        logger.info("Credentials changed during refresh, discarding refreshed token");
                        return Future.succeededFuture(credentials != null);
                    }

                    Instant expiresAt = Credentials.resolveExpiry(response, clock.instant(),
                            config.getDefaultTokenLifetime());
                    Credentials refreshed = current.refreshed(accessToken,
                            stringOrNull(response, "refresh_token"),
                            stringOrNull(response, "agent_id"),
                            expiresAt);
                    credentials = refreshed;
                    scheduleProactiveRefresh();
                    events.publish(AgentEventType.TOKEN_REFRESHED,
                            new JsonObject().put("expires_at", expiresAt.toEpochMilli()));
                    logger.info("Access token refreshed, valid until {}", expiresAt);
                    return save().map(v -> true);
                })
                .recover(err -> {
                    logger.warn("Token refresh failed: {}", err.getMessage());
                    events.publish(AgentEventType.TOKEN_REFRESH_FAILED,
                            new JsonObject().put("error", String.valueOf(err.getMessage())));
                    return Future.succeededFuture(false);
                });
    }

    /**
     * Arms a one-shot timer at {@code expiresAt - refreshSkew}, replacing any timer already
     * armed. Nothing is armed when that instant has passed or scheduling is suspended.
     */
    public void scheduleProactiveRefresh() {
        cancelProactiveRefresh();
        Credentials current = credentials;
        if (current == null || !schedulingEnabled) {
            return;
        }
        long delay = Duration.between(clock.instant(),
                current.getExpiresAt().minus(config.getRefreshSkew())).toMillis();
        if (delay <= 0) {
            logger.debug("Token already inside refresh window, not scheduling proactive refresh");
            return;
        }
        refreshTimerId = vertx.setTimer(delay, id -> {
            if (refreshTimerId == id) {
                refreshTimerId = NO_TIMER;
            }
            logger.info("Proactive token refresh");
            refresh();
        });
        logger.debug("Proactive token refresh scheduled in {}ms", delay);
    }

    public void cancelProactiveRefresh() {
        long id = refreshTimerId;
        refreshTimerId = NO_TIMER;
        if (id != NO_TIMER) {
            vertx.cancelTimer(id);
        }
    }

    public boolean hasProactiveRefreshScheduled() {
        return refreshTimerId != NO_TIMER;
    }

    /**
     * Cancels the proactive timer and keeps it disarmed until {@link #resumeScheduling()}.
     */
    public void suspendScheduling() {
        schedulingEnabled = false;
        cancelProactiveRefresh();
    }

    public void resumeScheduling() {
        schedulingEnabled = true;
        scheduleProactiveRefresh();
    }

    private static String stringOrNull(JsonObject json, String key) {
        Object value = json.getValue(key);
        return value instanceof String ? (String) value : null;
    }
}
