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
import dev.mars.huginn.agent.config.BackendEndpoints;
import dev.mars.huginn.agent.event.AgentEventPublisher;
import dev.mars.huginn.core.TelemetrySnapshot;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TelemetryReportingService.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-11
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TelemetryReportingServiceTest {

    private static final String TELEMETRY = BackendEndpoints.PROCESS_TELEMETRY;

    private BackendStub backend;
    private RequestDispatcher dispatcher;

    @BeforeAll
    void setUp(Vertx vertx, VertxTestContext testContext) {
        BackendStub.start(vertx).onComplete(testContext.succeeding(stub -> {
            backend = stub;
            dispatcher = new RequestDispatcher(vertx,
                    TestFixtures.config(stub.baseUrl()).maxRetries(0).build(),
                    new AgentEventPublisher(vertx, null));
            dispatcher.attachSession(new RequestDispatcherTest.StubSession());
            testContext.completeNow();
        }));
    }

    @BeforeEach
    void reset() {
        backend.reset();
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        backend.close().onComplete(ar -> testContext.completeNow());
    }

    @Test
    @DisplayName("Should upload the collected snapshot with the agent id")
    void sendTelemetry(VertxTestContext testContext) {
        TestFixtures.CountingTelemetryCollector collector = new TestFixtures.CountingTelemetryCollector();
        TelemetryReportingService service = new TelemetryReportingService(collector, dispatcher);

        service.sendTelemetry("A1").onComplete(testContext.succeeding(snapshot -> {
            testContext.verify(() -> {
                assertEquals(1, collector.collections.get());
                BackendStub.Received request = backend.received(TELEMETRY).get(0);
                assertEquals("Bearer token-1", request.authorization);
                assertEquals("A1", request.body.getString("agent_id"));
                assertEquals(snapshot.getTimestamp().toString(), request.body.getString("timestamp"));
                assertEquals(12.5, request.body.getJsonObject("telemetry")
                        .getJsonObject(TelemetrySnapshot.PERFORMANCE).getDouble("cpu"));
            });
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("A failing upload should fail the report")
    void uploadFailure(VertxTestContext testContext) {
        backend.respond(TELEMETRY, Reply.status(503));
        TelemetryReportingService service = new TelemetryReportingService(
                new TestFixtures.CountingTelemetryCollector(), dispatcher);

        service.sendTelemetry("A1").onComplete(testContext.failing(err -> testContext.completeNow()));
    }

    @Test
    @DisplayName("A collector that throws or fails should fail without contacting the backend")
    void collectorFailure(VertxTestContext testContext) {
        TelemetryReportingService throwing = new TelemetryReportingService(() -> {
            throw new IllegalStateException("no /proc");
        }, dispatcher);
        TelemetryReportingService failing = new TelemetryReportingService(
                () -> Future.failedFuture(new IllegalStateException("sensor offline")), dispatcher);

        throwing.sendTelemetry("A1")
                .recover(err -> {
                    testContext.verify(() -> assertEquals("no /proc", err.getMessage()));
                    return failing.sendTelemetry("A1");
                })
                .onComplete(testContext.failing(err -> {
                    testContext.verify(() -> {
                        assertEquals("sensor offline", err.getMessage());
                        assertEquals(0, backend.count(TELEMETRY));
                    });
                    testContext.completeNow();
                }));
    }

    @Test
    @DisplayName("Sections should survive the upload unchanged")
    void sectionsPreserved(VertxTestContext testContext) {
        JsonObject sections = new JsonObject()
                .put(TelemetrySnapshot.HARDWARE, new JsonObject().put("cpu_count", 4))
                .put(TelemetrySnapshot.SOFTWARE, new JsonObject().put("java_version", "17"));
        TelemetryReportingService service = new TelemetryReportingService(
                () -> Future.succeededFuture(new TelemetrySnapshot(sections, Instant.now())), dispatcher);

        service.sendTelemetry("A1").onComplete(testContext.succeeding(snapshot -> {
            testContext.verify(() -> {
                JsonObject telemetry = backend.received(TELEMETRY).get(0).body.getJsonObject("telemetry");
                assertEquals(4, telemetry.getJsonObject(TelemetrySnapshot.HARDWARE).getInteger("cpu_count"));
                assertEquals("17", telemetry.getJsonObject(TelemetrySnapshot.SOFTWARE).getString("java_version"));
            });
            testContext.completeNow();
        }));
    }
}
