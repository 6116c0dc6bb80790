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

package dev.mars.huginn.agent.support;

import dev.mars.huginn.agent.spi.TelemetryCollector;
import dev.mars.huginn.core.TelemetrySnapshot;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;
import java.time.Clock;

/**
 * Telemetry collector reporting what the JVM can see of its host: memory, processors,
 * load average and uptime.
 */
public class RuntimeTelemetryCollector implements TelemetryCollector {

    private final Vertx vertx;
    private final Clock clock;

    public RuntimeTelemetryCollector(Vertx vertx) {
        this(vertx, Clock.systemUTC());
    }

    public RuntimeTelemetryCollector(Vertx vertx, Clock clock) {
        this.vertx = vertx;
        this.clock = clock;
    }

    @Override
    public Future<TelemetrySnapshot> collect() {
        return vertx.executeBlocking(this::snapshot);
    }

    TelemetrySnapshot snapshot() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();

        JsonObject hardware = new JsonObject()
                .put("availableProcessors", os.getAvailableProcessors())
                .put("arch", os.getArch());
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean sunOs = (com.sun.management.OperatingSystemMXBean) os;
            hardware.put("totalMemory", sunOs.getTotalMemorySize())
                    .put("freeMemory", sunOs.getFreeMemorySize());
        }

        JsonObject software = new JsonObject()
                .put("osName", os.getName())
                .put("osVersion", os.getVersion())
                .put("javaVersion", System.getProperty("java.version"))
                .put("javaVendor", System.getProperty("java.vendor"));

        JsonObject performance = new JsonObject()
                .put("systemLoadAverage", os.getSystemLoadAverage())
                .put("heapUsed", memory.getHeapMemoryUsage().getUsed())
                .put("heapMax", memory.getHeapMemoryUsage().getMax())
                .put("nonHeapUsed", memory.getNonHeapMemoryUsage().getUsed())
                .put("uptimeMs", runtime.getUptime());

        JsonObject sections = new JsonObject()
                .put(TelemetrySnapshot.HARDWARE, hardware)
                .put(TelemetrySnapshot.SOFTWARE, software)
                .put(TelemetrySnapshot.PERFORMANCE, performance);
        return new TelemetrySnapshot(sections, clock.instant());
    }
}
