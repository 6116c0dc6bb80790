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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Centralized configuration loader for the Huginn agent.
 *
 * <p>Loads configuration from {@code huginn-agent.properties} on the classpath with environment
 * variable and system property overrides. Environment variables use the property key upper-cased
 * with dots and dashes replaced by underscores ({@code huginn.agent.base-url} becomes
 * {@code HUGINN_AGENT_BASE_URL}).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 */
public final class AgentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);
    private static final String CONFIG_FILE = "huginn-agent.properties";
    private static final AgentConfig INSTANCE = new AgentConfig(loadProperties());

    private final Properties properties;

    private AgentConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Gets the singleton configuration instance backed by the classpath properties file.
     */
    public static AgentConfig get() {
        return INSTANCE;
    }

    /**
     * Creates a configuration backed by the given properties instead of the classpath file.
     * Environment variables and system properties still take precedence.
     */
    public static AgentConfig of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new AgentConfig(copy);
    }

    // ==================== Backend Connection ====================

    public String getBaseUrl() {
        return getString("huginn.agent.base-url", "http://localhost:8080/api");
    }

    public String getServiceName() {
        return getString("huginn.agent.service-name", AgentConfiguration.DEFAULT_SERVICE_NAME);
    }

    public String getEnrollmentToken() {
        return getString("huginn.agent.enrollment-token", "");
    }

    // ==================== Loop Intervals ====================

    public long getPollIntervalMs() {
        return getLong("huginn.agent.tasks.poll-interval-ms", AgentConfiguration.DEFAULT_POLL_INTERVAL_MS);
    }

    public long getTelemetryIntervalMs() {
        return getLong("huginn.agent.telemetry.interval-ms", AgentConfiguration.DEFAULT_TELEMETRY_INTERVAL_MS);
    }

    // ==================== Retry and Tokens ====================

    public int getMaxRetries() {
        return getInt("huginn.agent.http.max-retries", AgentConfiguration.DEFAULT_MAX_RETRIES);
    }

    public long getBackoffBaseMs() {
        return getLong("huginn.agent.http.backoff-base-ms", AgentConfiguration.DEFAULT_BACKOFF_BASE_MS);
    }

    public long getRefreshSkewMs() {
        return getLong("huginn.agent.token.refresh-skew-ms", AgentConfiguration.DEFAULT_REFRESH_SKEW_MS);
    }

    public long getDefaultTokenLifetimeMs() {
        return getLong("huginn.agent.token.default-lifetime-ms",
                AgentConfiguration.DEFAULT_TOKEN_LIFETIME_MS);
    }

    // ==================== HTTP Client ====================

    public int getHttpConnectTimeoutMs() {
        return getInt("huginn.agent.http.connect-timeout-ms", AgentConfiguration.DEFAULT_CONNECT_TIMEOUT_MS);
    }

    public int getHttpIdleTimeoutSeconds() {
        return getInt("huginn.agent.http.idle-timeout-seconds", AgentConfiguration.DEFAULT_IDLE_TIMEOUT_SECONDS);
    }

    public long getHttpRequestTimeoutMs() {
        return getLong("huginn.agent.http.request-timeout-ms", AgentConfiguration.DEFAULT_REQUEST_TIMEOUT_MS);
    }

    // ==================== Local Storage and Health ====================

    public String getCredentialDirectory() {
        return getString("huginn.agent.credentials.directory",
                System.getProperty("user.home") + "/.huginn/credentials");
    }

    public boolean isHealthEnabled() {
        return getBoolean("huginn.agent.health.enabled", false);
    }

    public int getHealthPort() {
        return getInt("huginn.agent.health.port", 8090);
    }

    public String getEventBusAddress() {
        return getString("huginn.agent.events.address", AgentConfiguration.DEFAULT_EVENT_ADDRESS);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., HUGINN_AGENT_BASE_URL)</li>
     *   <li>System property (e.g., -Dhuginn.agent.base-url=...)</li>
     *   <li>Properties file (huginn-agent.properties)</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        return properties.getProperty(key, defaultValue);
    }

    /**
     * Validates that values are sensible. Called during startup to fail fast on misconfiguration.
     *
     * @throws IllegalStateException if any value is invalid
     */
    public void validate() {
        String baseUrl = getBaseUrl();
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            throw new IllegalStateException("Base URL must start with http:// or https://, got: " + baseUrl);
        }
        if (getServiceName().isBlank()) {
            throw new IllegalStateException("Credential service name must not be blank");
        }
        if (getPollIntervalMs() <= 0) {
            throw new IllegalStateException("Poll interval must be positive, got: " + getPollIntervalMs());
        }
        if (getTelemetryIntervalMs() <= 0) {
            throw new IllegalStateException(
                    "Telemetry interval must be positive, got: " + getTelemetryIntervalMs());
        }
        if (getMaxRetries() < 0) {
            throw new IllegalStateException("Max retries must not be negative, got: " + getMaxRetries());
        }
        int port = getHealthPort();
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("Health port must be between 0 and 65535, got: " + port);
        }
        logger.info("Agent configuration validated successfully");
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream input = AgentConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables",
                        CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
        return properties;
    }

    /**
     * Logs the effective configuration. The enrollment token is never printed.
     */
    public void logConfiguration() {
        logger.info("=== Huginn Agent Configuration ===");
        logger.info("  Base URL:             {}", getBaseUrl());
        logger.info("  Service Name:         {}", getServiceName());
        logger.info("  Enrollment Token:     {}", getEnrollmentToken().isEmpty() ? "<none>" : "<set>");
        logger.info("  --- Loops ---");
        logger.info("  Poll Interval:        {}ms", getPollIntervalMs());
        logger.info("  Telemetry Interval:   {}ms", getTelemetryIntervalMs());
        logger.info("  --- HTTP ---");
        logger.info("  Max Retries:          {}", getMaxRetries());
        logger.info("  Backoff Base:         {}ms", getBackoffBaseMs());
        logger.info("  Request Timeout:      {}ms", getHttpRequestTimeoutMs());
        logger.info("  --- Tokens ---");
        logger.info("  Refresh Skew:         {}ms", getRefreshSkewMs());
        logger.info("  Default Lifetime:     {}ms", getDefaultTokenLifetimeMs());
        logger.info("  --- Health ---");
        logger.info("  Enabled:              {}", isHealthEnabled());
        logger.info("  Port:                 {}", getHealthPort());
        logger.info("==================================");
    }
}
