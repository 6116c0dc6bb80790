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

import io.vertx.core.Future;

/**
 * The authentication state the {@link RequestDispatcher} consults: the current bearer
 * token, a way to refresh it, and a way to discard it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 */
public interface AuthSession {

    /**
     * @return the current access token, or {@code null} if the agent holds no credentials
     */
    String accessToken();

    boolean hasCredentials();

    /**
     * Exchanges the refresh token for a new access token. Concurrent callers share
     * one exchange.
     *
     * @return a future completing with {@code true} if new credentials were obtained
     */
    Future<Boolean> refresh();

    /**
     * Discards the credentials in memory and in persistent storage.
     */
    Future<Void> clear();
}
