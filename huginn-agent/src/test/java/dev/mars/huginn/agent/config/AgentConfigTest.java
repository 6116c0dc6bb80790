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

package dev.mars.huginn.agent.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AgentConfig layered lookup and the runtime configuration built from it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-10
 */
class AgentConfigTest {

    private static final String OVERRIDE_KEY = "huginn.agent.tasks.poll-interval-ms";

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(OVERRIDE_KEY);
    }

    @Test
    @DisplayName("Should return singleton instance")
    void shouldReturnSingletonInstance() {
        assertSame(AgentConfig.get(), AgentConfig.get(), "Should return the same singleton instance");
    }

    @Test
    @DisplayName("Should read values from the classpath properties file")
    void shouldReadClasspathProperties() {
        AgentConfig config = AgentConfig.get();

        assertEquals("http://localhost:9999/api", config.getBaseUrl());
        assertEquals("huginn-agent-test", config.getServiceName());
        assertEquals(2, config.getMaxRetries());
    }

    @Test
    @DisplayName("Should fall back to defaults for absent keys")
    void shouldFallBackToDefaults() {
        AgentConfig config = AgentConfig.of(new Properties());

        assertEquals(AgentConfiguration.DEFAULT_SERVICE_NAME, config.getServiceName());
        assertEquals(120_000L, config.getPollIntervalMs());
        assertEquals(1_800_000L, config.getTelemetryIntervalMs());
        assertEquals(3, config.getMaxRetries());
        assertEquals(300_000L, config.getRefreshSkewMs());
        assertFalse(config.isHealthEnabled());
    }

    @Test
    @DisplayName("System property should override the properties file")
    void systemPropertyOverridesFile() {
        Properties properties = new Properties();
        properties.setProperty(OVERRIDE_KEY, "5000");
        AgentConfig config = AgentConfig.of(properties);
        assertEquals(5000L, config.getPollIntervalMs());

        System.setProperty(OVERRIDE_KEY, "7000");
        assertEquals(7000L, config.getPollIntervalMs());
    }

    @Test
    @DisplayName("Malformed numbers should fall back to the default")
    void malformedNumberUsesDefault() {
        Properties properties = new Properties();
        properties.setProperty("huginn.agent.http.max-retries", "three");

        assertEquals(3, AgentConfig.of(properties).getMaxRetries());
    }

    @Test
    @DisplayName("Validation should reject a non-HTTP base URL")
    void validateRejectsBadBaseUrl() {
        Properties properties = new Properties();
        properties.setProperty("huginn.agent.base-url", "ftp://backend");

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> AgentConfig.of(properties).validate());
        assertTrue(e.getMessage().contains("ftp://backend"));
    }

    @Test
    @DisplayName("Validation should reject non-positive intervals")
    void validateRejectsZeroInterval() {
        Properties properties = new Properties();
        properties.setProperty("huginn.agent.telemetry.interval-ms", "0");

        assertThrows(IllegalStateException.class, () -> AgentConfig.of(properties).validate());
    }

    @Test
    @DisplayName("Runtime configuration should be built from layered properties")
    void buildsRuntimeConfiguration() {
        Properties properties = new Properties();
        properties.setProperty("huginn.agent.base-url", "https://backend.example.com/functions/");
        properties.setProperty("huginn.agent.telemetry.interval-ms", "60000");
        properties.setProperty("huginn.agent.enrollment-token", "enroll-me");

        AgentConfiguration configuration = AgentConfiguration.fromConfig(AgentConfig.of(properties));

        assertEquals("https://backend.example.com/functions", configuration.getBaseUrl());
        assertEquals("https://backend.example.com/functions/agent-get-tasks",
                configuration.endpointUrl(BackendEndpoints.GET_TASKS));
        assertEquals(Duration.ofMinutes(1), configuration.getTelemetryInterval());
        assertEquals(Duration.ofMinutes(2), configuration.getPollInterval());
        assertEquals(Duration.ofMinutes(5), configuration.getRefreshSkew());
        assertEquals(Duration.ofHours(24), configuration.getDefaultTokenLifetime());
        assertEquals("enroll-me", configuration.getEnrollmentToken());
    }

    @Test
    @DisplayName("Builder should reject missing base URL and bad intervals")
    void builderValidates() {
        assertThrows(IllegalArgumentException.class, () -> new AgentConfiguration.Builder().build());
        assertThrows(IllegalArgumentException.class, () -> new AgentConfiguration.Builder()
                .baseUrl("http://localhost")
                .pollInterval(Duration.ZERO)
                .build());
        assertThrows(IllegalArgumentException.class, () -> new AgentConfiguration.Builder()
                .baseUrl("http://localhost")
                .maxRetries(-1)
                .build());
    }
}
