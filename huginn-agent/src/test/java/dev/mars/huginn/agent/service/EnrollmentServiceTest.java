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

import dev.mars.huginn.agent.BackendStub;
import dev.mars.huginn.agent.BackendStub.Reply;
import dev.mars.huginn.agent.TestFixtures;
import dev.mars.huginn.agent.config.AgentConfiguration;
import dev.mars.huginn.agent.config.BackendEndpoints;
import dev.mars.huginn.agent.event.AgentEvent;
import dev.mars.huginn.agent.event.AgentEventPublisher;
import dev.mars.huginn.agent.event.AgentEventType;
import dev.mars.huginn.agent.support.InMemoryCredentialStore;
import dev.mars.huginn.core.exceptions.EnrollmentException;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EnrollmentService against a stub backend.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-10
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class EnrollmentServiceTest {

    private static final String STATUS = BackendEndpoints.CHECK_AGENT_STATUS;

    private BackendStub backend;
    private AgentConfiguration config;
    private InMemoryCredentialStore store;
    private List<AgentEvent> events;
    private CredentialManager credentialManager;
    private EnrollmentService enrollment;

    @BeforeAll
    void setUp(Vertx vertx, VertxTestContext testContext) {
        BackendStub.start(vertx).onComplete(testContext.succeeding(stub -> {
            backend = stub;
            config = TestFixtures.config(stub.baseUrl()).maxRetries(0).build();
            testContext.completeNow();
        }));
    }

    @BeforeEach
    void reset(Vertx vertx) {
        backend.reset();
        store = new InMemoryCredentialStore();
        events = new CopyOnWriteArrayList<>();

        AgentEventPublisher publisher = new AgentEventPublisher(vertx, null);
        publisher.addListener(events::add);
        RequestDispatcher dispatcher = new RequestDispatcher(vertx, config, publisher);
        credentialManager = new CredentialManager(vertx, config, store, dispatcher, publisher);
        dispatcher.attachSession(credentialManager);
        enrollment = new EnrollmentService(config, TestFixtures.deviceInfo(), dispatcher, credentialManager, publisher);
    }

    @AfterEach
    void cancelTimers() {
        credentialManager.cancelProactiveRefresh();
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        backend.close().onComplete(ar -> testContext.completeNow());
    }

    @Test
    @DisplayName("A known device should adopt the returned agent id and token")
    void enrollKnownDevice(VertxTestContext testContext) {
        backend.respond(STATUS, Reply.ok(TestFixtures.enrollmentResponse("A1", "T1")));

        enrollment.enroll().onComplete(testContext.succeeding(credentials -> {
            testContext.verify(() -> {
                assertEquals("A1", credentials.getAgentId());
                assertEquals("T1", credentials.getAccessToken());
                assertEquals("T1", credentials.getRefreshToken(), "refresh token falls back to the api token");
                assertEquals(credentials, credentialManager.getCredentials());
                assertTrue(store.contains(config.getServiceName()));

                BackendStub.Received request = backend.received(STATUS).get(0);
                assertNull(request.authorization, "enrollment is unauthenticated");
                assertEquals(TestFixtures.HOSTNAME, request.body.getString("hostname"));
                assertEquals(TestFixtures.HOSTNAME, request.body.getJsonObject("deviceInfo").getString("hostname"));
                assertFalse(request.body.containsKey("enrollment_token"));

                AgentEvent enrolled = events.stream()
                        .filter(e -> e.getType() == AgentEventType.ENROLLED)
                        .findFirst()
                        .orElseThrow();
                assertEquals("A1", enrolled.getData().getString("agent_id"));
            });
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("Expiry fields in the response should set the token expiry")
    void enrollHonoursExpiresIn(VertxTestContext testContext) {
        backend.respond(STATUS, Reply.ok(TestFixtures.enrollmentResponse("A1", "T1")
                .put("refresh_token", "R1")
                .put("expires_in", 600)));

        enrollment.enroll().onComplete(testContext.succeeding(credentials -> {
            testContext.verify(() -> {
                assertEquals("R1", credentials.getRefreshToken());
                Duration remaining = Duration.between(Instant.now(), credentials.getExpiresAt());
                assertTrue(remaining.compareTo(Duration.ofSeconds(590)) > 0);
                assertTrue(remaining.compareTo(Duration.ofSeconds(601)) < 0);
            });
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("An enrollment token should be sent when supplied")
    void enrollWithToken(VertxTestContext testContext) {
        backend.respond(STATUS, Reply.ok(TestFixtures.enrollmentResponse("A2", "T2")));

        enrollment.enroll("join-me").onComplete(testContext.succeeding(credentials -> {
            testContext.verify(() -> assertEquals("join-me",
                    backend.received(STATUS).get(0).body.getString("enrollment_token")));
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("An unknown device should fail with an invalid response")
    void unknownDeviceFails(VertxTestContext testContext) {
        backend.respond(STATUS, Reply.ok(new JsonObject().put("exists", false)));

        enrollment.enroll().onComplete(testContext.failing(err -> {
            testContext.verify(() -> {
                assertInstanceOf(EnrollmentException.class, err);
                assertEquals("Invalid server response", err.getMessage());
                assertFalse(credentialManager.hasCredentials());
                assertFalse(store.contains(config.getServiceName()));

                AgentEvent failed = events.stream()
                        .filter(e -> e.getType() == AgentEventType.ENROLLMENT_FAILED)
                        .findFirst()
                        .orElseThrow();
                assertEquals("Invalid server response", failed.getData().getString("reason"));
            });
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("A response without a token should fail enrollment")
    void missingTokenFails(VertxTestContext testContext) {
        backend.respond(STATUS, Reply.ok(new JsonObject().put("exists", true).put("agent_id", "A1")));

        enrollment.enroll().onComplete(testContext.failing(err -> {
            testContext.verify(() -> {
                assertEquals("Invalid server response", err.getMessage());
                assertFalse(credentialManager.hasCredentials());
            });
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("A backend error should fail enrollment with the request cause")
    void backendErrorFails(VertxTestContext testContext) {
        backend.respond(STATUS, Reply.status(500));

        enrollment.enroll().onComplete(testContext.failing(err -> {
            testContext.verify(() -> {
                assertInstanceOf(EnrollmentException.class, err);
                assertTrue(err.getMessage().startsWith("Enrollment request failed"));
                assertNotNull(err.getCause());
                assertTrue(events.stream().anyMatch(e -> e.getType() == AgentEventType.ENROLLMENT_FAILED));
            });
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("Registration check should be authenticated and report existence")
    void verifyRegistration(VertxTestContext testContext) {
        backend.respond(STATUS, Reply.ok(TestFixtures.enrollmentResponse("A1", "T1")));

        enrollment.enroll()
                .compose(credentials -> enrollment.verifyRegistration())
                .onComplete(testContext.succeeding(exists -> {
                    testContext.verify(() -> {
                        assertTrue(exists);
                        BackendStub.Received check = backend.received(STATUS).get(1);
                        assertEquals("Bearer T1", check.authorization);
                        assertEquals("A1", check.body.getString("agent_id"));
                    });
                    testContext.completeNow();
                }));
    }

    @Test
    @DisplayName("Registration check should be false without credentials or on error")
    void verifyRegistrationNegative(VertxTestContext testContext) {
        enrollment.verifyRegistration()
                .compose(withoutCredentials -> {
                    testContext.verify(() -> {
                        assertFalse(withoutCredentials);
                        assertEquals(0, backend.count(STATUS));
                    });
                    backend.enqueue(STATUS,
                            Reply.ok(TestFixtures.enrollmentResponse("A1", "T1")),
                            Reply.ok(new JsonObject().put("exists", false)),
                            Reply.status(500));
                    return enrollment.enroll();
                })
                .compose(credentials -> enrollment.verifyRegistration())
                .compose(forgotten -> {
                    testContext.verify(() -> assertFalse(forgotten));
                    return enrollment.verifyRegistration();
                })
                .onComplete(testContext.succeeding(onError -> {
                    testContext.verify(() -> assertFalse(onError));
                    testContext.completeNow();
                }));
    }
}
