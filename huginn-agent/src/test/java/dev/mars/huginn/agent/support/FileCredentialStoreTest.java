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

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileCredentialStore.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-11
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
class FileCredentialStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Values should round-trip through a file named after the service")
    void setGetDelete(Vertx vertx, VertxTestContext testContext) {
        Path directory = tempDir.resolve("credentials");
        FileCredentialStore store = new FileCredentialStore(vertx, directory);

        store.set("huginn-agent", "{\"agent_id\":\"A1\"}")
                .compose(v -> {
                    testContext.verify(() -> assertTrue(Files.exists(directory.resolve("huginn-agent.json"))));
                    return store.get("huginn-agent");
                })
                .compose(value -> {
                    testContext.verify(() -> assertEquals("{\"agent_id\":\"A1\"}", value));
                    return store.delete("huginn-agent");
                })
                .compose(v -> store.get("huginn-agent"))
                .onComplete(testContext.succeeding(afterDelete -> {
                    testContext.verify(() -> {
                        assertNull(afterDelete);
                        assertFalse(Files.exists(directory.resolve("huginn-agent.json")));
                    });
                    testContext.completeNow();
                }));
    }

    @Test
    @DisplayName("Missing entries read as null and delete quietly")
    void missingEntry(Vertx vertx, VertxTestContext testContext) {
        FileCredentialStore store = new FileCredentialStore(vertx, tempDir);

        store.get("absent")
                .compose(value -> {
                    testContext.verify(() -> assertNull(value));
                    return store.delete("absent");
                })
                .onComplete(testContext.succeeding(v -> testContext.completeNow()));
    }

    @Test
    @DisplayName("Service names should not escape the credential directory")
    void serviceNameIsSanitized(Vertx vertx, VertxTestContext testContext) {
        FileCredentialStore store = new FileCredentialStore(vertx, tempDir);

        store.set("../evil/name", "x").onComplete(testContext.succeeding(v -> {
            testContext.verify(() -> {
                assertTrue(Files.exists(tempDir.resolve(".._evil_name.json")));
                assertFalse(Files.exists(tempDir.getParent().resolve("evil")));
            });
            testContext.completeNow();
        }));
    }
}
