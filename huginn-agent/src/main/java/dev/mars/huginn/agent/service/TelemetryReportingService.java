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

import dev.mars.huginn.agent.config.BackendEndpoints;
import dev.mars.huginn.agent.spi.TelemetryCollector;
import dev.mars.huginn.core.TelemetrySnapshot;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects a telemetry snapshot and uploads it tagged with the agent id.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class TelemetryReportingService {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryReportingService.class);

    private final TelemetryCollector collector;
    private final RequestDispatcher dispatcher;

    public TelemetryReportingService(TelemetryCollector collector, RequestDispatcher dispatcher) {
        this.collector = collector;
        this.dispatcher = dispatcher;
    }

    /**
     * @return Future completing with the uploaded snapshot; fails if collection or upload fails
     */
    public Future<TelemetrySnapshot> sendTelemetry(String agentId) {
        Future<TelemetrySnapshot> collected;
        try {
            collected = collector.collect();
            if (collected == null) {
                collected = Future.failedFuture(new IllegalStateException("telemetry collector returned no snapshot"));
            }
        } catch (Exception e) {
            collected = Future.failedFuture(e);
        }
        return collected.compose(snapshot -> {
            JsonObject body = new JsonObject()
                    .put("agent_id", agentId)
                    .put("telemetry", snapshot.toJson())
                    .put("timestamp", snapshot.getTimestamp().toString());
            return dispatcher.request(BackendEndpoints.PROCESS_TELEMETRY, body, true)
                    .map(response -> {
                        logger.debug("Telemetry snapshot from {} uploaded", snapshot.getTimestamp());
                        return snapshot;
                    });
        });
    }
}
