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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans agent events out to registered listeners and to the Vert.x event bus.
 *
 * <p>A listener that throws is logged and skipped; the remaining listeners
 * still receive the event.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class AgentEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(AgentEventPublisher.class);

    private final Vertx vertx;
    private final String address;
    private final Clock clock;
    private final List<AgentEventListener> listeners = new CopyOnWriteArrayList<>();

    public AgentEventPublisher(Vertx vertx, String address) {
        this(vertx, address, Clock.systemUTC());
    }

    public AgentEventPublisher(Vertx vertx, String address, Clock clock) {
        this.vertx = vertx;
        this.address = address;
        this.clock = clock;
    }

    public void addListener(AgentEventListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(AgentEventListener listener) {
        return listeners.remove(listener);
    }

    public void publish(AgentEventType type) {
        publish(type, new JsonObject());
    }

    public void publish(AgentEventType type, JsonObject data) {
        AgentEvent event = new AgentEvent(type, data, clock.instant());
        logger.debug("Publishing agent event: {}", type);

        for (AgentEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                logger.warn("Agent event listener failed on {}: {}", type, e.getMessage());
                logger.debug("Listener stack trace", e);
            }
        }

        if (address != null && !address.isBlank()) {
            vertx.eventBus().publish(address, event.toJson());
        }
    }
}
