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

package dev.mars.huginn.agent;

import dev.mars.huginn.agent.config.AgentConfig;
import dev.mars.huginn.agent.config.AgentConfiguration;
import dev.mars.huginn.agent.event.AgentEvent;
import dev.mars.huginn.agent.event.AgentEventListener;
import dev.mars.huginn.agent.event.AgentEventPublisher;
import dev.mars.huginn.agent.event.AgentEventType;
import dev.mars.huginn.agent.observability.AgentMetrics;
import dev.mars.huginn.agent.service.CredentialManager;
import dev.mars.huginn.agent.service.EnrollmentService;
import dev.mars.huginn.agent.service.HealthService;
import dev.mars.huginn.agent.service.RequestDispatcher;
import dev.mars.huginn.agent.service.TaskBatch;
import dev.mars.huginn.agent.service.TaskExecutionService;
import dev.mars.huginn.agent.service.TaskPollingService;
import dev.mars.huginn.agent.service.TaskStatusReportingService;
import dev.mars.huginn.agent.service.TelemetryReportingService;
import dev.mars.huginn.agent.spi.CredentialStore;
import dev.mars.huginn.agent.spi.DeviceInfoCollector;
import dev.mars.huginn.agent.spi.TaskExecutor;
import dev.mars.huginn.agent.spi.TelemetryCollector;
import dev.mars.huginn.agent.support.FileCredentialStore;
import dev.mars.huginn.agent.support.RuntimeTelemetryCollector;
import dev.mars.huginn.agent.support.SystemDeviceInfoCollector;
import dev.mars.huginn.agent.support.TaskTypeRouter;
import dev.mars.huginn.core.AgentTask;
import dev.mars.huginn.core.Credentials;
import dev.mars.huginn.core.TaskResult;
import dev.mars.huginn.core.exceptions.InvalidTransitionException;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Main class for the Huginn agent. Enrolls the device, keeps its credentials fresh, polls
 * the backend for tasks and uploads telemetry.
 *
 * <p>The agent pins itself to the Vert.x context it is created on. Every public operation
 * runs there, along with every timer callback and I/O continuation, so the loops and the
 * refresh timer never run at the same time. Three timers may be armed: the task poll and
 * telemetry loops while running, and the one-shot proactive token refresh.</p>
 *
 * <p>Lifecycle: {@code uninitialized -> enrolling -> ready -> running -> stopped}, with
 * {@code error} entered when the backend rejects both tokens. From {@code error} the host
 * recovers by calling {@link #initialize()} again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-09
 * @version 1.0
 */
public class HuginnAgent {

    private static final Logger logger = LoggerFactory.getLogger(HuginnAgent.class);
    private static final long NO_TIMER = -1L;

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final Context context;
    private final Clock clock;

    private final AgentEventPublisher events;
    private final RequestDispatcher dispatcher;
    private final CredentialManager credentialManager;
    private final EnrollmentService enrollmentService;
    private final TaskPollingService taskPollingService;
    private final TaskStatusReportingService taskStatusReportingService;
    private final TaskExecutionService taskExecutionService;
    private final TelemetryReportingService telemetryReportingService;
    private final AgentMetrics metrics;

    // Vert.x timer IDs for proper cleanup
    private volatile long pollTimerId = NO_TIMER;
    private volatile long telemetryTimerId = NO_TIMER;

    private final Set<String> tasksInProgress = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private volatile AgentState state = AgentState.UNINITIALIZED;

    /**
     * Creates an agent bound to the current Vert.x context, or a new one when called from
     * outside Vert.x.
     *
     * @throws NullPointerException if any argument is null
     */
    public HuginnAgent(Vertx vertx, AgentConfiguration config, CredentialStore credentialStore,
                       DeviceInfoCollector deviceInfoCollector, TelemetryCollector telemetryCollector,
                       TaskExecutor taskExecutor) {
        this(vertx, config, credentialStore, deviceInfoCollector, telemetryCollector, taskExecutor,
                Clock.systemUTC());
    }

    public HuginnAgent(Vertx vertx, AgentConfiguration config, CredentialStore credentialStore,
                       DeviceInfoCollector deviceInfoCollector, TelemetryCollector telemetryCollector,
                       TaskExecutor taskExecutor, Clock clock) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.config = Objects.requireNonNull(config, "AgentConfiguration cannot be null");
        Objects.requireNonNull(credentialStore, "CredentialStore cannot be null");
        Objects.requireNonNull(deviceInfoCollector, "DeviceInfoCollector cannot be null");
        Objects.requireNonNull(telemetryCollector, "TelemetryCollector cannot be null");
        Objects.requireNonNull(taskExecutor, "TaskExecutor cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.context = vertx.getOrCreateContext();

        this.events = new AgentEventPublisher(vertx, config.getEventBusAddress(), clock);
        this.dispatcher = new RequestDispatcher(vertx, config, events);
        this.credentialManager = new CredentialManager(vertx, config, credentialStore, dispatcher, events, clock);
        this.dispatcher.attachSession(credentialManager);
        this.enrollmentService = new EnrollmentService(config, deviceInfoCollector, dispatcher,
                credentialManager, events, clock);
        this.taskPollingService = new TaskPollingService(dispatcher);
        this.taskStatusReportingService = new TaskStatusReportingService(dispatcher);
        this.taskExecutionService = new TaskExecutionService(vertx, taskExecutor, clock);
        this.telemetryReportingService = new TelemetryReportingService(telemetryCollector, dispatcher);
        this.metrics = new AgentMetrics(config.getServiceName(), taskExecutionService::getActiveTaskCount);

        // registered first so hosts observe the state change when they see the event
        this.events.addListener(this::onInternalEvent);

        logger.info("Huginn agent created for backend {}", config.getBaseUrl());
    }

    /**
     * Creates an agent with file-backed credential storage and the built-in device and
     * telemetry collectors.
     */
    public static HuginnAgent withDefaults(Vertx vertx, AgentConfiguration config, TaskExecutor taskExecutor) {
        return new HuginnAgent(vertx, config,
                new FileCredentialStore(vertx, config.getCredentialDirectory()),
                new SystemDeviceInfoCollector(vertx),
                new RuntimeTelemetryCollector(vertx),
                taskExecutor);
    }

    public static void main(String[] args) {
        logger.info("Starting Huginn Agent...");

        Vertx vertx = Vertx.vertx();
        CountDownLatch shutdownLatch = new CountDownLatch(1);

        try {
            AgentConfig agentConfig = AgentConfig.get();
            agentConfig.logConfiguration();
            agentConfig.validate();
            AgentConfiguration config = AgentConfiguration.fromConfig(agentConfig);

            HuginnAgent agent = HuginnAgent.withDefaults(vertx, config, new TaskTypeRouter());
            HealthService healthService = config.isHealthEnabled()
                    ? new HealthService(config.getHealthPort(), agent::getHealth, agent::getStatus)
                    : null;

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                if (healthService != null) {
                    healthService.shutdown();
                }
                try {
                    agent.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
                } catch (Exception e) {
                    logger.error("Error stopping Huginn agent", e);
                }
                vertx.close().onComplete(ar -> {
                    if (ar.succeeded()) {
                        logger.info("Vert.x instance closed successfully");
                    } else {
                        logger.error("Error closing Vert.x instance", ar.cause());
                    }
                    shutdownLatch.countDown();
                });
            }));

            if (healthService != null) {
                healthService.start();
            }

            boolean ready = agent.initialize().toCompletionStage().toCompletableFuture().get();
            if (!ready) {
                logger.error("Agent could not obtain confirmed credentials; set huginn.agent.enrollment-token and restart");
                vertx.close();
                System.exit(2);
            }
            agent.start().toCompletionStage().toCompletableFuture().get();

            shutdownLatch.await();
        } catch (Exception e) {
            logger.error("Failed to start Huginn Agent", e);
            vertx.close();
            System.exit(1);
        }

        logger.info("Huginn Agent stopped");
    }

    // ==================== Lifecycle ====================

    /**
     * Loads stored credentials, refreshing or enrolling as needed, then confirms the
     * registration with the backend and re-enrolls if the backend no longer knows the agent.
     *
     * @return a future completing with {@code true} once confirmed credentials exist; never fails
     */
    public Future<Boolean> initialize() {
        return onContext(this::doInitialize);
    }

    /**
     * Runs enrollment with a user-supplied token, for hosts recovering from
     * {@code enrollmentFailed}.
     *
     * @return a future completing with {@code true} if enrollment succeeded; never fails
     */
    public Future<Boolean> enrollWithToken(String enrollmentToken) {
        return onContext(() -> {
            if (running) {
                logger.warn("Ignoring enrollment request while the agent is running");
                return Future.succeededFuture(false);
            }
            return enroll(enrollmentToken).map(enrolled -> {
                if (enrolled) {
                    moveTo(AgentState.READY);
                }
                return enrolled;
            });
        });
    }

    /**
     * Arms the task poll and telemetry loops and runs one iteration of each straight away.
     * Calling it while running has no effect.
     *
     * @return a future failing if the agent holds no credentials or cannot start from its state
     */
    public Future<Void> start() {
        return onContext(this::doStart);
    }

    /**
     * Cancels the loop timers and the refresh timer and stops the dispatcher from sending or
     * retrying. The timers are cancelled before this method returns. Idempotent.
     */
    public Future<Void> stop() {
        boolean wasRunning = running;
        running = false;
        cancelLoopTimers();
        credentialManager.suspendScheduling();
        dispatcher.halt();

        return onContext(() -> {
            // a refresh completing in between may have re-armed its timer
            credentialManager.suspendScheduling();
            dispatcher.halt();
            if (state != AgentState.STOPPED && state.canTransitionTo(AgentState.STOPPED)) {
                moveTo(AgentState.STOPPED);
            }
            if (wasRunning) {
                logger.info("Huginn agent stopped");
                events.publish(AgentEventType.STOPPED, agentIdPayload());
            }
            return Future.succeededFuture();
        });
    }

    /**
     * Stops the agent and releases its HTTP client. The agent cannot be used afterwards.
     */
    public Future<Void> close() {
        if (closed.getAndSet(true)) {
            return Future.succeededFuture();
        }
        return stop().compose(v -> dispatcher.shutdown());
    }

    // ==================== Host Operations ====================

    public Future<Boolean> forceTokenRefresh() {
        return onContext(credentialManager::refresh);
    }

    /**
     * Collects and uploads one telemetry snapshot outside the regular interval.
     */
    public Future<Void> forceTelemetryReport() {
        return onContext(() -> reportTelemetry(false));
    }

    public void addListener(AgentEventListener listener) {
        events.addListener(listener);
    }

    public boolean removeListener(AgentEventListener listener) {
        return events.removeListener(listener);
    }

    // ==================== Status ====================

    public AgentStatus getStatus() {
        Credentials current = credentialManager.getCredentials();
        return new AgentStatus(
                running,
                isAuthenticated(),
                current != null ? current.getAgentId() : null,
                current != null ? current.getExpiresAt() : null,
                state);
    }

    public AgentHealth getHealth() {
        return AgentHealth.of(getStatus(), clock.instant());
    }

    public boolean isAuthenticated() {
        return credentialManager.hasCredentials() && !credentialManager.isExpired();
    }

    public boolean isRunning() {
        return running;
    }

    public AgentState getState() {
        return state;
    }

    public Optional<String> getAgentId() {
        return Optional.ofNullable(credentialManager.getAgentId());
    }

    public AgentConfiguration getConfiguration() {
        return config;
    }

    // ==================== Internals ====================

    private Future<Boolean> doInitialize() {
        if (running) {
            logger.warn("initialize() called while running, keeping current credentials");
            return Future.succeededFuture(isAuthenticated());
        }
        dispatcher.resume();

        return credentialManager.load()
                .compose(loaded -> {
                    if (!loaded) {
                        logger.info("No stored credentials, enrolling");
                        return enroll(config.getEnrollmentToken());
                    }
                    if (!credentialManager.isExpired()) {
                        return confirmRegistration();
                    }
                    logger.info("Stored credentials expired, refreshing");
                    return credentialManager.refresh().compose(refreshed -> refreshed
                            ? confirmRegistration()
                            : enroll(config.getEnrollmentToken()));
                })
                .map(ready -> {
                    if (ready) {
                        credentialManager.resumeScheduling();
                        moveTo(AgentState.READY);
                        logger.info("Huginn agent initialized as {}", credentialManager.getAgentId());
                    }
                    return ready;
                })
                .recover(err -> {
                    logger.error("Initialization failed: {}", err.getMessage());
                    if (state == AgentState.ENROLLING) {
                        moveTo(AgentState.UNINITIALIZED);
                    }
                    return Future.succeededFuture(false);
                });
    }

    private Future<Boolean> confirmRegistration() {
        return enrollmentService.verifyRegistration().compose(confirmed -> {
            if (confirmed) {
                return Future.succeededFuture(true);
            }
            logger.warn("Backend did not confirm agent {}, re-enrolling", credentialManager.getAgentId());
            return enroll(config.getEnrollmentToken());
        });
    }

    private Future<Boolean> enroll(String enrollmentToken) {
        moveTo(AgentState.ENROLLING);
        return enrollmentService.enroll(enrollmentToken)
                .map(credentials -> true)
                .recover(err -> {
                    moveTo(AgentState.UNINITIALIZED);
                    return Future.succeededFuture(false);
                });
    }

    private Future<Void> doStart() {
        if (closed.get()) {
            return Future.failedFuture(new IllegalStateException("Agent is closed, cannot start"));
        }
        if (running) {
            logger.debug("Agent already running");
            return Future.succeededFuture();
        }
        if (!credentialManager.hasCredentials()) {
            return Future.failedFuture(new IllegalStateException("Agent is not enrolled; call initialize() first"));
        }
        try {
            state.transitionTo(AgentState.RUNNING);
        } catch (InvalidTransitionException e) {
            return Future.failedFuture(e);
        }

        dispatcher.resume();
        credentialManager.resumeScheduling();
        running = true;
        moveTo(AgentState.RUNNING);

        pollTimerId = vertx.setPeriodic(config.getPollInterval().toMillis(), id -> runTaskCycle());
        telemetryTimerId = vertx.setPeriodic(config.getTelemetryInterval().toMillis(),
                id -> reportTelemetry(true));
        logger.info("Huginn agent started (poll every {}ms, telemetry every {}ms) [timer IDs: {}, {}]",
                config.getPollInterval().toMillis(), config.getTelemetryInterval().toMillis(),
                pollTimerId, telemetryTimerId);

        events.publish(AgentEventType.STARTED, agentIdPayload());

        runTaskCycle();
        reportTelemetry(true);
        return Future.succeededFuture();
    }

    private void cancelLoopTimers() {
        long poll = pollTimerId;
        pollTimerId = NO_TIMER;
        if (poll != NO_TIMER) {
            vertx.cancelTimer(poll);
        }
        long telemetry = telemetryTimerId;
        telemetryTimerId = NO_TIMER;
        if (telemetry != NO_TIMER) {
            vertx.cancelTimer(telemetry);
        }
    }

    boolean hasArmedTimers() {
        return pollTimerId != NO_TIMER || telemetryTimerId != NO_TIMER
                || credentialManager.hasProactiveRefreshScheduled();
    }

    private void runTaskCycle() {
        if (!running) {
            return;
        }
        String agentId = credentialManager.getAgentId();
        if (agentId == null) {
            logger.warn("Skipping task poll: agent holds no credentials");
            return;
        }

        taskPollingService.fetchPendingTasks(agentId)
                .compose(batch -> {
                    metrics.recordTasksPolled(batch.size());
                    if (!running) {
                        logger.debug("Agent stopped during poll, discarding {} tasks", batch.size());
                        return Future.succeededFuture();
                    }
                    if (!batch.isEmpty()) {
                        logger.info("Found {} pending task(s)", batch.size());
                    }
                    List<Future<Void>> runs = new ArrayList<>(batch.size());
                    for (AgentTask task : batch.getTasks()) {
                        runs.add(processTask(agentId, task));
                    }
                    for (TaskBatch.Rejected entry : batch.getRejected()) {
                        runs.add(rejectTask(agentId, entry));
                    }
                    return Future.all(runs).<Void>mapEmpty();
                })
                .onFailure(err -> logger.warn("Task poll failed, waiting for next interval: {}",
                        err.getMessage()));
    }

    private Future<Void> processTask(String agentId, AgentTask task) {
        if (!tasksInProgress.add(task.getTaskId())) {
            logger.debug("Task {} is already executing, skipping", task.getTaskId());
            return Future.succeededFuture();
        }

        return taskStatusReportingService.reportRunning(agentId, task.getTaskId())
                .compose(accepted -> taskExecutionService.execute(task))
                .compose(result -> finishTask(agentId, task.toJson(), task.getType().getValue(), result))
                .onComplete(ar -> tasksInProgress.remove(task.getTaskId()))
                .<Void>mapEmpty()
                .recover(err -> {
                    logger.error("Unexpected error processing task {}: {}", task.getTaskId(), err.getMessage());
                    return Future.succeededFuture();
                });
    }

    // Entries the agent cannot run go through the same running/failed lifecycle as an executor failure.
    private Future<Void> rejectTask(String agentId, TaskBatch.Rejected entry) {
        String taskId = entry.getTaskId();
        if (!tasksInProgress.add(taskId)) {
            logger.debug("Task {} is already executing, skipping", taskId);
            return Future.succeededFuture();
        }

        return taskStatusReportingService.reportRunning(agentId, taskId)
                .compose(accepted -> finishTask(agentId, entry.getEntry(), entry.getTypeLabel(),
                        TaskResult.failed(taskId, entry.getReason(), Duration.ZERO, clock.instant())))
                .onComplete(ar -> tasksInProgress.remove(taskId))
                .<Void>mapEmpty()
                .recover(err -> {
                    logger.error("Unexpected error rejecting task {}: {}", taskId, err.getMessage());
                    return Future.succeededFuture();
                });
    }

    private Future<Boolean> finishTask(String agentId, JsonObject task, String taskType, TaskResult result) {
        metrics.recordTaskFinished(taskType, result.getStatus().getValue(), result.isSuccessful());
        events.publish(result.isSuccessful() ? AgentEventType.TASK_COMPLETED : AgentEventType.TASK_FAILED,
                new JsonObject().put("task", task).put("result", result.toJson()));

        if (!running) {
            logger.info("Agent stopped, not reporting {} result of task {}", result.getStatus(),
                    result.getTaskId());
            return Future.succeededFuture(false);
        }
        return taskStatusReportingService.reportResult(agentId, result);
    }

    private Future<Void> reportTelemetry(boolean loopTick) {
        if (loopTick && !running) {
            return Future.succeededFuture();
        }
        String agentId = credentialManager.getAgentId();
        if (agentId == null) {
            logger.warn("Skipping telemetry report: agent holds no credentials");
            return Future.failedFuture(new IllegalStateException("Agent is not enrolled"));
        }

        return telemetryReportingService.sendTelemetry(agentId)
                .transform(ar -> {
                    if (loopTick && !running) {
                        logger.debug("Agent stopped during telemetry upload, discarding outcome");
                        return Future.succeededFuture();
                    }
                    metrics.recordTelemetry(ar.succeeded());
                    if (ar.succeeded()) {
                        events.publish(AgentEventType.TELEMETRY_SENT,
                                new JsonObject().put("timestamp", ar.result().getTimestamp().toString()));
                        return Future.succeededFuture();
                    }
                    logger.warn("Telemetry report failed: {}", ar.cause().getMessage());
                    events.publish(AgentEventType.TELEMETRY_FAILED,
                            new JsonObject().put("error", String.valueOf(ar.cause().getMessage())));
                    if (loopTick) {
                        return Future.succeededFuture();
                    }
                    return Future.failedFuture(ar.cause());
                });
    }

    private void onInternalEvent(AgentEvent event) {
        switch (event.getType()) {
            case AUTHENTICATION_FAILED:
                metrics.recordAuthenticationFailure();
                running = false;
                cancelLoopTimers();
                credentialManager.cancelProactiveRefresh();
                moveTo(AgentState.ERROR);
                logger.error("Authentication failed irrecoverably; loops disarmed, re-initialization required");
                break;
            case ENROLLED:
                metrics.recordEnrollment(true);
                break;
            case ENROLLMENT_FAILED:
                metrics.recordEnrollment(false);
                break;
            case TOKEN_REFRESHED:
                metrics.recordTokenRefresh(true);
                break;
            case TOKEN_REFRESH_FAILED:
                metrics.recordTokenRefresh(false);
                break;
            default:
                break;
        }
    }

    private void moveTo(AgentState target) {
        AgentState current = state;
        if (current == target) {
            return;
        }
        try {
            state = current.transitionTo(target);
            metrics.recordState(target);
            logger.debug("Agent state {} -> {}", current, target);
        } catch (InvalidTransitionException e) {
            logger.warn("Ignoring state change: {}", e.getMessage());
        }
    }

    private JsonObject agentIdPayload() {
        return new JsonObject().put("agent_id", credentialManager.getAgentId());
    }

    /**
     * Runs the action on the agent's context and relays its outcome. A synchronous throw
     * becomes a failed future.
     */
    private <T> Future<T> onContext(Supplier<Future<T>> action) {
        Promise<T> promise = Promise.promise();
        Runnable task = () -> {
            Future<T> result;
            try {
                result = action.get();
            } catch (Exception e) {
                result = Future.failedFuture(e);
            }
            result.onComplete(ar -> {
                if (ar.succeeded()) {
                    promise.complete(ar.result());
                } else {
                    promise.fail(ar.cause());
                }
            });
        };
        if (Vertx.currentContext() == context) {
            task.run();
        } else {
            context.runOnContext(v -> task.run());
        }
        return promise.future();
    }
}
