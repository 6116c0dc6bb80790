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

import dev.mars.huginn.agent.spi.TaskExecutor;
import dev.mars.huginn.core.AgentTask;
import dev.mars.huginn.core.TaskResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks through the configured {@link TaskExecutor} and turns every outcome into a
 * terminal {@link TaskResult}.
 *
 * <p>The returned future always succeeds. An executor that throws, returns {@code null} or
 * fails its future produces a {@code failed} result. A task with a timeout that the executor
 * does not meet produces a {@code timeout} result, and the executor's late outcome is
 * dropped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class TaskExecutionService {

    private static final Logger logger = LoggerFactory.getLogger(TaskExecutionService.class);

    private final Vertx vertx;
    private final TaskExecutor executor;
    private final Clock clock;
    private final AtomicInteger activeTasks = new AtomicInteger(0);

    public TaskExecutionService(Vertx vertx, TaskExecutor executor) {
        this(vertx, executor, Clock.systemUTC());
    }

    public TaskExecutionService(Vertx vertx, TaskExecutor executor, Clock clock) {
        this.vertx = vertx;
        this.executor = executor;
        this.clock = clock;
    }

    public Future<TaskResult> execute(AgentTask task) {
        Instant started = clock.instant();
        Promise<TaskResult> promise = Promise.promise();
        activeTasks.incrementAndGet();
        promise.future().onComplete(ar -> activeTasks.decrementAndGet());

        logger.info("Executing task {} ({})", task.getTaskId(), task.getType());

        long timerId = task.getTimeout()
                .map(limit -> vertx.setTimer(Math.max(1, limit.toMillis()), id -> {
                    if (promise.tryComplete(TaskResult.timedOut(task.getTaskId(), limit,
                            elapsedSince(started), clock.instant()))) {
                        logger.warn("Task {} timed out after {}ms", task.getTaskId(), limit.toMillis());
                    }
                }))
                .orElse(-1L);

        Future<JsonObject> outcome;
        try {
            outcome = executor.execute(task);
            if (outcome == null) {
                outcome = Future.failedFuture(new IllegalStateException("executor returned no result"));
            }
        } catch (Exception e) {
            outcome = Future.failedFuture(e);
        }

        outcome.onComplete(ar -> {
            if (timerId >= 0) {
                vertx.cancelTimer(timerId);
            }
            TaskResult result = ar.succeeded()
                    ? TaskResult.completed(task.getTaskId(), ar.result(), elapsedSince(started), clock.instant())
                    : TaskResult.failed(task.getTaskId(), describe(ar.cause()), elapsedSince(started),
                            clock.instant());
            if (!promise.tryComplete(result)) {
                logger.debug("Ignoring late outcome of task {}", task.getTaskId());
            } else if (!result.isSuccessful()) {
                logger.warn("Task {} failed: {}", task.getTaskId(), result.getError().orElse("unknown error"));
            }
        });

        return promise.future();
    }

    public int getActiveTaskCount() {
        return activeTasks.get();
    }

    private Duration elapsedSince(Instant started) {
        Duration elapsed = Duration.between(started, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
