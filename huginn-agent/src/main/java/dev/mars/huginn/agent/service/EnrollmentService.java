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
import dev.mars.huginn.agent.spi.DeviceInfoCollector;
import dev.mars.huginn.core.Credentials;
import dev.mars.huginn.core.DeviceInfo;
import dev.mars.huginn.core.exceptions.EnrollmentException;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Enrolls the device with the backend and confirms an existing registration.
 *
 * <p>Enrollment posts the device description unauthenticated to the status endpoint. A
 * backend that already knows the device answers with {@code exists}, the {@code agent_id} and
 * an {@code api_token}; that bundle becomes the agent's credentials, so a reinstalled agent
 * reuses its record. Any other answer fails enrollment and publishes
 * {@code enrollmentFailed}. Nothing here retries enrollment on its own.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class EnrollmentService {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentService.class);
    static final String INVALID_RESPONSE = "Invalid server response";

    private final AgentConfiguration config;
    private final DeviceInfoCollector deviceInfoCollector;
    private final RequestDispatcher dispatcher;
    private final CredentialManager credentialManager;
    private final AgentEventPublisher events;
    private final Clock clock;

    public EnrollmentService(AgentConfiguration config, DeviceInfoCollector deviceInfoCollector,
                             RequestDispatcher dispatcher, CredentialManager credentialManager,
                             AgentEventPublisher events) {
        this(config, deviceInfoCollector, dispatcher, credentialManager, events, Clock.systemUTC());
    }

    public EnrollmentService(AgentConfiguration config, DeviceInfoCollector deviceInfoCollector,
                             RequestDispatcher dispatcher, CredentialManager credentialManager,
                             AgentEventPublisher events, Clock clock) {
        this.config = config;
        this.deviceInfoCollector = deviceInfoCollector;
        this.dispatcher = dispatcher;
        this.credentialManager = credentialManager;
        this.events = events;
        this.clock = clock;
    }

    public Future<Credentials> enroll() {
        return enroll(config.getEnrollmentToken());
    }

    /**
     * Runs the enrollment exchange.
     *
     * @param enrollmentToken a token supplied by the user, or {@code null}
     * @return the adopted credentials; fails with {@link EnrollmentException}
     */
    public Future<Credentials> enroll(String enrollmentToken) {
        logger.info("Enrolling agent with backend {}", config.getBaseUrl());

        return deviceInfoCollector.getDeviceInfo()
                .compose(info -> {
                    JsonObject body = describe(info);
                    if (enrollmentToken != null && !enrollmentToken.isBlank()) {
                        body.put("enrollment_token", enrollmentToken);
                    }
                    return dispatcher.request(BackendEndpoints.CHECK_AGENT_STATUS, body, false);
                })
                .compose(response -> {
                    final Credentials enrolled;
                    try {
                        enrolled = parseEnrollment(response);
                    } catch (EnrollmentException e) {
                        return Future.failedFuture(e);
                    }
                    return credentialManager.adopt(enrolled).map(v -> enrolled);
                })
                .transform(ar -> {
                    if (ar.succeeded()) {
                        Credentials enrolled = ar.result();
                        logger.info("Enrolled as agent {}", enrolled.getAgentId());
                        events.publish(AgentEventType.ENROLLED,
                                new JsonObject().put("agent_id", enrolled.getAgentId()));
                        return Future.succeededFuture(enrolled);
                    }
                    Throwable cause = ar.cause();
                    String reason = cause instanceof EnrollmentException
                            ? cause.getMessage()
                            : "Enrollment request failed: " + cause.getMessage();
                    logger.warn("Enrollment failed: {}", reason);
                    events.publish(AgentEventType.ENROLLMENT_FAILED, new JsonObject().put("reason", reason));
                    return Future.failedFuture(cause instanceof EnrollmentException
                            ? cause
                            : new EnrollmentException(reason, cause));
                });
    }

    /**
     * Asks the backend whether it still recognizes the enrolled agent, using the current
     * credentials.
     *
     * @return {@code true} only when the backend answers {@code exists: true}
     */
    public Future<Boolean> verifyRegistration() {
        String agentId = credentialManager.getAgentId();
        if (agentId == null) {
            return Future.succeededFuture(false);
        }
        return deviceInfoCollector.getDeviceInfo()
                .compose(info -> dispatcher.request(BackendEndpoints.CHECK_AGENT_STATUS,
                        describe(info).put("agent_id", agentId), true))
                .map(response -> Boolean.TRUE.equals(response.getValue("exists")))
                .recover(err -> {
                    logger.warn("Registration check failed: {}", err.getMessage());
                    return Future.succeededFuture(false);
                });
    }

    private JsonObject describe(DeviceInfo info) {
        return new JsonObject()
                .put("hostname", info.getHostname())
                .put("deviceInfo", info.toJson());
    }

    Credentials parseEnrollment(JsonObject response) throws EnrollmentException {
        if (!Boolean.TRUE.equals(response.getValue("exists"))) {
            throw new EnrollmentException(INVALID_RESPONSE);
        }
        String agentId = text(response, "agent_id");
        String apiToken = text(response, "api_token");
        if (apiToken == null) {
            apiToken = text(response, "access_token");
        }
        if (agentId == null || apiToken == null) {
            throw new EnrollmentException(INVALID_RESPONSE);
        }
        String refreshToken = text(response, "refresh_token");
        Instant expiresAt = Credentials.resolveExpiry(response, clock.instant(), config.getDefaultTokenLifetime());
        return new Credentials(apiToken, refreshToken != null ? refreshToken : apiToken, agentId, expiresAt);
    }

    private static String text(JsonObject json, String key) {
        Object value = json.getValue(key);
        if (value instanceof String && !((String) value).isBlank()) {
            return (String) value;
        }
        return null;
    }
}
