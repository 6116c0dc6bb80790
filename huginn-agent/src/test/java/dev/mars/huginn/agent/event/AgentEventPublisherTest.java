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

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AgentEventPublisher.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-11
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
class AgentEventPublisherTest {

    private static final Instant NOW = Instant.parse("2026-10-11T09:30:00Z");

    @Test
    @DisplayName("A failing listener should not keep later listeners from the event")
    void failingListenerIsIsolated(Vertx vertx) {
        AgentEventPublisher publisher = new AgentEventPublisher(vertx, null);
        List<AgentEvent> received = new ArrayList<>();
        publisher.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        publisher.addListener(received::add);

        publisher.publish(AgentEventType.ENROLLED, new JsonObject().put("agent_id", "A1"));

        assertEquals(1, received.size());
        assertEquals(AgentEventType.ENROLLED, received.get(0).getType());
        assertEquals("A1", received.get(0).getData().getString("agent_id"));
    }

    @Test
    @DisplayName("Removed listeners should no longer be notified")
    void removeListener(Vertx vertx) {
        AgentEventPublisher publisher = new AgentEventPublisher(vertx, "");
        List<AgentEvent> received = new ArrayList<>();
        AgentEventListener listener = received::add;
        publisher.addListener(listener);

        publisher.publish(AgentEventType.STARTED);
        assertTrue(publisher.removeListener(listener));
        publisher.publish(AgentEventType.STOPPED);

        assertEquals(1, received.size());
        assertFalse(publisher.removeListener(listener));
    }

    @Test
    @DisplayName("Events should be published on the event bus with their wire name")
    void publishesOnEventBus(Vertx vertx, VertxTestContext testContext) {
        AgentEventPublisher publisher = new AgentEventPublisher(vertx, "huginn.test.publisher",
                Clock.fixed(NOW, ZoneOffset.UTC));

        vertx.eventBus().<JsonObject>consumer("huginn.test.publisher", message -> {
            testContext.verify(() -> {
                JsonObject event = message.body();
                assertEquals("tokenRefreshFailed", event.getString("event"));
                assertEquals("2026-10-11T09:30:00Z", event.getString("timestamp"));
                assertEquals("timeout", event.getJsonObject("data").getString("error"));
            });
            testContext.completeNow();
        }).completion().onComplete(testContext.succeeding(v ->
                publisher.publish(AgentEventType.TOKEN_REFRESH_FAILED, new JsonObject().put("error", "timeout"))));
    }

    @Test
    @DisplayName("Event data should be isolated from later changes by the publisher")
    void eventDataIsCopied(Vertx vertx) {
        AgentEventPublisher publisher = new AgentEventPublisher(vertx, null);
        List<AgentEvent> received = new ArrayList<>();
        publisher.addListener(received::add);
        JsonObject data = new JsonObject().put("task_id", "t-1");

        publisher.publish(AgentEventType.TASK_COMPLETED, data);
        data.put("task_id", "changed");

        assertEquals("t-1", received.get(0).getData().getString("task_id"));
    }

    @Test
    @DisplayName("Wire names should map back to event types")
    void wireNames() {
        assertEquals(AgentEventType.AUTHENTICATION_FAILED, AgentEventType.fromValue("authenticationFailed"));
        assertEquals("telemetrySent", AgentEventType.TELEMETRY_SENT.getValue());
        assertThrows(IllegalArgumentException.class, () -> AgentEventType.fromValue("rebooted"));
    }
}
