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

import dev.mars.huginn.core.AgentTask;
import dev.mars.huginn.core.TaskType;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskTypeRouter.
 */
class TaskTypeRouterTest {

    @Test
    @DisplayName("Tasks should be routed to the executor registered for their type")
    void routesByType() {
        TaskTypeRouter router = new TaskTypeRouter()
                .register(TaskType.RUN_COMMAND, task -> Future.succeededFuture(new JsonObject().put("by", "command")))
                .register(TaskType.RUN_SCRIPT, task -> Future.succeededFuture(new JsonObject().put("by", "script")));

        assertTrue(router.supports(TaskType.RUN_SCRIPT));
        assertFalse(router.supports(TaskType.APPLY_POLICY));
        assertEquals("command", router.execute(task(TaskType.RUN_COMMAND)).result().getString("by"));
        assertEquals("script", router.execute(task(TaskType.RUN_SCRIPT)).result().getString("by"));
    }

    @Test
    @DisplayName("Unregistered types should fail rather than throw")
    void unsupportedType() {
        Future<JsonObject> outcome = new TaskTypeRouter().execute(task(TaskType.INSTALL_SOFTWARE));

        assertTrue(outcome.failed());
        assertInstanceOf(UnsupportedOperationException.class, outcome.cause());
        assertTrue(outcome.cause().getMessage().contains("INSTALL_SOFTWARE"));
    }

    @Test
    @DisplayName("Registering a type again should replace its executor")
    void replaceExecutor() {
        TaskTypeRouter router = new TaskTypeRouter()
                .register(TaskType.APPLY_POLICY, task -> Future.succeededFuture(new JsonObject().put("v", 1)))
                .register(TaskType.APPLY_POLICY, task -> Future.succeededFuture(new JsonObject().put("v", 2)));

        assertEquals(2, router.execute(task(TaskType.APPLY_POLICY)).result().getInteger("v"));
        assertThrows(NullPointerException.class, () -> router.register(null, task -> null));
    }

    private static AgentTask task(TaskType type) {
        return new AgentTask("t-" + type.getValue(), type, null, 0, null, null);
    }
}
