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

import dev.mars.huginn.agent.spi.CredentialStore;
import io.vertx.core.Future;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local credential store. Credentials are lost on restart, so the agent
 * re-enrolls every time it starts.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Future<String> get(String service) {
        return Future.succeededFuture(entries.get(service));
    }

    @Override
    public Future<Void> set(String service, String value) {
        entries.put(service, value);
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> delete(String service) {
        entries.remove(service);
        return Future.succeededFuture();
    }

    public boolean contains(String service) {
        return entries.containsKey(service);
    }
}
