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

package dev.mars.huginn.agent.observability;

import dev.mars.huginn.agent.AgentState;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * OpenTelemetry metrics for the Huginn agent. Instruments are registered against
 * {@link GlobalOpenTelemetry}, so they are no-ops until the host installs an SDK.
 *
 * Provides:
 * - huginn.agent.state (gauge) - Agent state ordinal (see {@link AgentState})
 * - huginn.agent.enrollments.total / .failed (counter) - Enrollment attempts
 * - huginn.agent.token.refreshes.total / .failed (counter) - Token refresh attempts
 * - huginn.agent.auth.failures (counter) - Irrecoverable authentication failures
 * - huginn.agent.tasks.polled (counter) - Tasks received from the backend
 * - huginn.agent.tasks.completed / .failed (counter) - Terminal task outcomes
 * - huginn.agent.tasks.active (gauge) - Tasks currently executing
 * - huginn.agent.telemetry.sent / .failed (counter) - Telemetry uploads
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-09
 * @version 1.0 (OpenTelemetry)
 */
public class AgentMetrics {

    private static final Logger logger = LoggerFactory.getLogger(AgentMetrics.class);
    private static final String METER_NAME = "huginn-agent";

    private static final AttributeKey<String> SERVICE_KEY = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> TASK_TYPE_KEY = AttributeKey.stringKey("task.type");
    private static final AttributeKey<String> TASK_STATUS_KEY = AttributeKey.stringKey("task.status");

    private final LongCounter enrollmentsTotal;
    private final LongCounter enrollmentsFailed;
    private final LongCounter refreshesTotal;
    private final LongCounter refreshesFailed;
    private final LongCounter authFailures;
    private final LongCounter tasksPolled;
    private final LongCounter tasksCompleted;
    private final LongCounter tasksFailed;
    private final LongCounter telemetrySent;
    private final LongCounter telemetryFailed;

    private final AtomicLong state = new AtomicLong(AgentState.UNINITIALIZED.ordinal());
    private final Attributes baseAttributes;

    /**
     * @param serviceName   the credential-store service name, used as the metrics label
     * @param activeTasks   supplies the number of tasks currently executing
     */
    public AgentMetrics(String serviceName, IntSupplier activeTasks) {
        this.baseAttributes = Attributes.of(SERVICE_KEY, serviceName);

        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        enrollmentsTotal = counter(meter, "huginn.agent.enrollments.total", "Total number of enrollment attempts");
        enrollmentsFailed = counter(meter, "huginn.agent.enrollments.failed", "Number of failed enrollments");
        refreshesTotal = counter(meter, "huginn.agent.token.refreshes.total", "Total number of token refreshes");
        refreshesFailed = counter(meter, "huginn.agent.token.refreshes.failed", "Number of failed token refreshes");
        authFailures = counter(meter, "huginn.agent.auth.failures", "Irrecoverable authentication failures");
        tasksPolled = counter(meter, "huginn.agent.tasks.polled", "Total number of tasks received");
        tasksCompleted = counter(meter, "huginn.agent.tasks.completed", "Total number of completed tasks");
        tasksFailed = counter(meter, "huginn.agent.tasks.failed", "Total number of failed or timed out tasks");
        telemetrySent = counter(meter, "huginn.agent.telemetry.sent", "Telemetry snapshots uploaded");
        telemetryFailed = counter(meter, "huginn.agent.telemetry.failed", "Telemetry uploads that failed");

        meter.gaugeBuilder("huginn.agent.state")
                .setDescription("Agent state (0=uninitialized, 1=enrolling, 2=ready, 3=running, 4=stopped, 5=error)")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(state.get(), baseAttributes));

        meter.gaugeBuilder("huginn.agent.tasks.active")
                .setDescription("Number of currently executing tasks")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeTasks.getAsInt(), baseAttributes));

        logger.debug("AgentMetrics initialized for service: {}", serviceName);
    }

    private static LongCounter counter(Meter meter, String name, String description) {
        return meter.counterBuilder(name)
                .setDescription(description)
                .setUnit("1")
                .build();
    }

    public void recordState(AgentState newState) {
        state.set(newState.ordinal());
    }

    public void recordEnrollment(boolean success) {
        enrollmentsTotal.add(1, baseAttributes);
        if (!success) {
            enrollmentsFailed.add(1, baseAttributes);
        }
    }

    public void recordTokenRefresh(boolean success) {
        refreshesTotal.add(1, baseAttributes);
        if (!success) {
            refreshesFailed.add(1, baseAttributes);
        }
    }

    public void recordAuthenticationFailure() {
        authFailures.add(1, baseAttributes);
    }

    public void recordTasksPolled(int count) {
        if (count > 0) {
            tasksPolled.add(count, baseAttributes);
        }
    }

    public void recordTaskFinished(String taskType, String status, boolean success) {
        Attributes attrs = baseAttributes.toBuilder()
                .put(TASK_TYPE_KEY, taskType)
                .put(TASK_STATUS_KEY, status)
                .build();
        if (success) {
            tasksCompleted.add(1, attrs);
        } else {
            tasksFailed.add(1, attrs);
        }
    }

    public void recordTelemetry(boolean success) {
        if (success) {
            telemetrySent.add(1, baseAttributes);
        } else {
            telemetryFailed.add(1, baseAttributes);
        }
    }
}
