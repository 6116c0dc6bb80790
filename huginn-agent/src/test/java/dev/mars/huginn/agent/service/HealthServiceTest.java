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

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the health endpoint.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-11
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class HealthServiceTest {

    private HealthService healthService;
    private WebClient client;
    private volatile boolean brokenStatus;

    @BeforeAll
    void setUp(Vertx vertx) throws Exception {
        healthService = new HealthService(0, () -> {
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "healthy");
            health.put("timestamp", Instant.parse("2026-10-11T08:00:00Z"));
            return health;
        }, () -> {
            if (brokenStatus) {
                throw new IllegalStateException("status unavailable");
            }
            return Map.of("running", true);
        });
        healthService.start();
        client = WebClient.create(vertx);
    }

    @AfterAll
    void tearDown() {
        client.close();
        healthService.shutdown();
        assertEquals(-1, healthService.getPort());
    }

    @Test
    @DisplayName("Health should render as JSON with ISO timestamps")
    void health(VertxTestContext testContext) {
        client.get(healthService.getPort(), "localhost", "/health")
                .send()
                .onComplete(testContext.succeeding(response -> {
                    testContext.verify(() -> {
                        assertEquals(200, response.statusCode());
                        assertEquals("application/json", response.getHeader("Content-Type"));
                        JsonObject body = response.bodyAsJsonObject();
                        assertEquals("healthy", body.getString("status"));
                        assertEquals("2026-10-11T08:00:00Z", body.getString("timestamp"));
                    });
                    testContext.completeNow();
                }));
    }

    @Test
    @DisplayName("Status rendering failures should answer 500 unhealthy")
    void statusFailure(VertxTestContext testContext) {
        brokenStatus = true;
        client.get(healthService.getPort(), "localhost", "/status")
                .send()
                .onComplete(testContext.succeeding(response -> {
                    brokenStatus = false;
                    testContext.verify(() -> {
                        assertEquals(500, response.statusCode());
                        assertEquals("unhealthy", response.bodyAsJsonObject().getString("status"));
                    });
                    testContext.completeNow();
                }));
    }

    @Test
    @DisplayName("Only GET should be allowed")
    void methodNotAllowed(VertxTestContext testContext) {
        client.post(healthService.getPort(), "localhost", "/status")
                .send()
                .onComplete(testContext.succeeding(response -> {
                    testContext.verify(() -> assertEquals(405, response.statusCode()));
                    testContext.completeNow();
                }));
    }

    @Test
    @DisplayName("Starting twice should keep the same port")
    void startIsIdempotent() throws Exception {
        int port = healthService.getPort();
        assertTrue(port > 0);
        healthService.start();
        assertEquals(port, healthService.getPort());
    }
}
