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

package dev.mars.huginn.agent.spi;

import io.vertx.core.Future;

/**
 * Secure key-value storage for the persisted credential bundle, keyed by service name.
 *
 * <p>{@link #get(String)} completes with {@code null} when nothing is stored.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 */
public interface CredentialStore {

    Future<String> get(String service);

    Future<Void> set(String service, String value);

    Future<Void> delete(String service);
}
