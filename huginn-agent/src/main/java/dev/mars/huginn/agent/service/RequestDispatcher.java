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

import dev.mars.huginn.agent.config.AgentConfiguration;
import dev.mars.huginn.agent.event.AgentEventPublisher;
import dev.mars.huginn.agent.event.AgentEventType;
import dev.mars.huginn.core.exceptions.AuthenticationException;
import dev.mars.huginn.core.exceptions.BackendRequestException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends JSON requests to the backend with bearer authentication, exponential backoff and
 * token refresh on {@code 401}.
 *
 * <p>Response handling:
 * <ul>
 *   <li>2xx: the parsed JSON body, or an empty object when there is none</li>
 *   <li>401 on an authenticated call: one credential refresh, then the same call again with
 *       the retry count incremented. If the refresh fails or retries are used up the
 *       credentials are cleared and {@code authenticationFailed} is published.</li>
 *   <li>404: an empty object. Some endpoints have nothing to return yet.</li>
 *   <li>anything else, or a transport error: retried after {@code backoffBase * 2^retryCount}
 *       up to {@code maxRetries}, then failed with {@link BackendRequestException}</li>
 * </ul>
 *
 * <p>Token values and request bodies are never logged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class RequestDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);

    private final Vertx vertx;
    private final AgentConfiguration config;
    private final AgentEventPublisher events;
    private final WebClient webClient;
    private final Map<Long, PendingRetry> pendingRetries = new ConcurrentHashMap<>();

    private volatile AuthSession session;
    private volatile boolean halted;

    public RequestDispatcher(Vertx vertx, AgentConfiguration config, AgentEventPublisher events) {
        this.vertx = vertx;
        this.config = config;
        this.events = events;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout(config.getHttpConnectTimeoutMs())
                .setIdleTimeout(config.getHttpIdleTimeoutSeconds())
                .setUserAgent(config.getUserAgent()));
        logger.debug("RequestDispatcher initialized (baseUrl={}, maxRetries={}, backoffBase={}ms)",
                config.getBaseUrl(), config.getMaxRetries(), config.getBackoffBase().toMillis());
    }

    /**
     * Sets the session supplying bearer tokens and handling refresh.
     */
    public void attachSession(AuthSession session) {
        this.session = session;
    }

    /**
     * Sends a request as a first attempt.
     *
     * @param endpoint path relative to the base URL
     * @param body     JSON body, {@code null} for an empty object
     * @param useAuth  whether to send the bearer token and handle {@code 401}
     * @return the parsed response body
     */
    public Future<JsonObject> request(String endpoint, JsonObject body, boolean useAuth) {
        return request(endpoint, body, useAuth, 0);
    }

    Future<JsonObject> request(String endpoint, JsonObject body, boolean useAuth, int retryCount) {
        if (halted) {
            return Future.failedFuture(new BackendRequestException(endpoint,
                    "dispatcher is stopped", (Throwable) null));
        }

        HttpRequest<Buffer> request = webClient.postAbs(config.endpointUrl(endpoint))
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "application/json")
                .idleTimeout(config.getHttpRequestTimeoutMs());

        if (useAuth) {
            AuthSession current = session;
            String token = current != null ? current.accessToken() : null;
            if (token != null) {
                request.putHeader("Authorization", "Bearer " + token);
            }
        }

        JsonObject payload = body != null ? body : new JsonObject();
        logger.debug("POST {} (auth={}, retry={})", endpoint, useAuth, retryCount);

        return request.sendBuffer(payload.toBuffer()).transform(ar -> {
            if (ar.failed()) {
                return retryOrFail(endpoint, payload, useAuth, retryCount,
                        new BackendRequestException(endpoint, ar.cause().getMessage(), ar.cause()));
            }

            HttpResponse<Buffer> response = ar.result();
            int status = response.statusCode();
            logger.debug("POST {} -> HTTP {} (retry={})", endpoint, status, retryCount);

            if (status == 401 && useAuth) {
                return handleUnauthorized(endpoint, payload, retryCount);
            }
            if (status == 404) {
                return Future.succeededFuture(new JsonObject());
            }
            if (status >= 200 && status < 300) {
                return parseBody(endpoint, status, response.body());
            }
            return retryOrFail(endpoint, payload, useAuth, retryCount,
                    new BackendRequestException(endpoint, status, "HTTP " + status));
        });
    }

    /**
     * Rejects new requests and cancels every scheduled retry. Requests already on the
     * wire are left to complete.
     */
    public void halt() {
        halted = true;
        for (Map.Entry<Long, PendingRetry> entry : pendingRetries.entrySet()) {
            if (pendingRetries.remove(entry.getKey()) != null) {
                vertx.cancelTimer(entry.getKey());
                PendingRetry pending = entry.getValue();
                pending.promise.tryFail(new BackendRequestException(pending.endpoint,
                        "retry cancelled, dispatcher is stopped", (Throwable) null));
            }
        }
    }

    /**
     * Accepts requests again after {@link #halt()}.
     */
    public void resume() {
        halted = false;
    }

    public boolean isHalted() {
        return halted;
    }

    int pendingRetryCount() {
        return pendingRetries.size();
    }

    /**
     * Delay before the attempt following {@code retryCount}: {@code backoffBase * 2^retryCount}.
     */
    long backoffDelayMs(int retryCount) {
        return config.getBackoffBase().toMillis() * (1L << Math.min(retryCount, 30));
    }

    /**
     * Closes the underlying web client.
     */
    public Future<Void> shutdown() {
        logger.debug("Shutting down RequestDispatcher WebClient");
        halt();
        webClient.close();
        return Future.succeededFuture();
    }

    private Future<JsonObject> handleUnauthorized(String endpoint, JsonObject body, int retryCount) {
        AuthSession current = session;
        if (current == null) {
            return authenticationFailed(null, endpoint, "No credentials available");
        }

        logger.info("Backend rejected token for {}, refreshing credentials", endpoint);
        return current.refresh()
                .recover(err -> {
                    logger.warn("Token refresh raised an error: {}", err.getMessage());
                    return Future.succeededFuture(false);
                })
                .compose(refreshed -> {
                    if (Boolean.TRUE.equals(refreshed) && retryCount < config.getMaxRetries()) {
                        return request(endpoint, body, true, retryCount + 1);
                    }
                    String reason = Boolean.TRUE.equals(refreshed)
                            ? "Retries exhausted after token refresh"
                            : "Token refresh failed";
                    return authenticationFailed(current, endpoint, reason);
                });
    }

    private Future<JsonObject> authenticationFailed(AuthSession current, String endpoint, String reason) {
        AuthenticationException failure = new AuthenticationException(endpoint, reason);
        if (current == null || !current.hasCredentials()) {
            // another request already cleared the credentials and raised the event
            return Future.failedFuture(failure);
        }

        logger.error("Authentication failed for {}: {}. Clearing credentials", endpoint, reason);
        Future<Void> cleared = current.clear();
        events.publish(AgentEventType.AUTHENTICATION_FAILED,
                new JsonObject().put("endpoint", endpoint).put("reason", reason));
        return cleared
                .recover(err -> {
                    logger.warn("Could not remove stored credentials: {}", err.getMessage());
                    return Future.succeededFuture();
                })
                .compose(v -> Future.failedFuture(failure));
    }

    private Future<JsonObject> retryOrFail(String endpoint, JsonObject body, boolean useAuth, int retryCount,
                                           BackendRequestException error) {
        if (halted || retryCount >= config.getMaxRetries()) {
            logger.warn("Giving up on {} after {} retries: {}", endpoint, retryCount, error.getMessage());
            return Future.failedFuture(error);
        }

        long delay = Math.max(1, backoffDelayMs(retryCount));
        logger.debug("Retrying {} in {}ms (attempt {} of {})", endpoint, delay, retryCount + 1,
                config.getMaxRetries());

        Promise<JsonObject> promise = Promise.promise();
        long timerId = vertx.setTimer(delay, id -> {
            if (pendingRetries.remove(id) == null) {
                return;
            }
            request(endpoint, body, useAuth, retryCount + 1).onComplete(ar -> {
                if (ar.succeeded()) {
                    promise.tryComplete(ar.result());
                } else {
                    promise.tryFail(ar.cause());
                }
            });
        });
        pendingRetries.put(timerId, new PendingRetry(endpoint, promise));
        return promise.future();
    }

    private Future<JsonObject> parseBody(String endpoint, int status, Buffer body) {
        if (body == null || body.length() == 0) {
            return Future.succeededFuture(new JsonObject());
        }
        try {
            return Future.succeededFuture(body.toJsonObject());
        } catch (DecodeException | ClassCastException e) {
            return Future.failedFuture(new BackendRequestException(endpoint, status,
                    "response body is not a JSON object"));
        }
    }

    private static final class PendingRetry {
        private final String endpoint;
        private final Promise<JsonObject> promise;

        private PendingRetry(String endpoint, Promise<JsonObject> promise) {
            this.endpoint = endpoint;
            this.promise = promise;
        }
    }
}
