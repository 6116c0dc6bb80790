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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable runtime configuration of the agent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class AgentConfiguration {

    public static final String DEFAULT_SERVICE_NAME = "huginn-agent";
    public static final long DEFAULT_POLL_INTERVAL_MS = 120_000;
    public static final long DEFAULT_TELEMETRY_INTERVAL_MS = 1_800_000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BACKOFF_BASE_MS = 1_000;
    public static final long DEFAULT_REFRESH_SKEW_MS = 300_000;
    public static final long DEFAULT_TOKEN_LIFETIME_MS = 86_400_000;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 30;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000;
    public static final String DEFAULT_EVENT_ADDRESS = "huginn.agent.events";
    public static final String DEFAULT_USER_AGENT = "Huginn-Agent/1.0";

    private final String baseUrl;
    private final String serviceName;
    private final Duration pollInterval;
    private final Duration telemetryInterval;
    private final int maxRetries;
    private final Duration backoffBase;
    private final Duration refreshSkew;
    private final Duration defaultTokenLifetime;
    private final int httpConnectTimeoutMs;
    private final int httpIdleTimeoutSeconds;
    private final long httpRequestTimeoutMs;
    private final String userAgent;
    private final Path credentialDirectory;
    private final boolean healthEnabled;
    private final int healthPort;
    private final String eventBusAddress;
    private final String enrollmentToken;

    private AgentConfiguration(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.serviceName = builder.serviceName;
        this.pollInterval = builder.pollInterval;
        this.telemetryInterval = builder.telemetryInterval;
        this.maxRetries = builder.maxRetries;
        this.backoffBase = builder.backoffBase;
        this.refreshSkew = builder.refreshSkew;
        this.defaultTokenLifetime = builder.defaultTokenLifetime;
        this.httpConnectTimeoutMs = builder.httpConnectTimeoutMs;
        this.httpIdleTimeoutSeconds = builder.httpIdleTimeoutSeconds;
        this.httpRequestTimeoutMs = builder.httpRequestTimeoutMs;
        this.userAgent = builder.userAgent;
        this.credentialDirectory = builder.credentialDirectory;
        this.healthEnabled = builder.healthEnabled;
        this.healthPort = builder.healthPort;
        this.eventBusAddress = builder.eventBusAddress;
        this.enrollmentToken = builder.enrollmentToken;
    }

    /**
     * Builds the runtime configuration from layered properties.
     */
    public static AgentConfiguration fromConfig(AgentConfig config) {
        String token = config.getEnrollmentToken();
        return new Builder()
                .baseUrl(config.getBaseUrl())
                .serviceName(config.getServiceName())
                .pollInterval(Duration.ofMillis(config.getPollIntervalMs()))
                .telemetryInterval(Duration.ofMillis(config.getTelemetryIntervalMs()))
                .maxRetries(config.getMaxRetries())
                .backoffBase(Duration.ofMillis(config.getBackoffBaseMs()))
                .refreshSkew(Duration.ofMillis(config.getRefreshSkewMs()))
                .defaultTokenLifetime(Duration.ofMillis(config.getDefaultTokenLifetimeMs()))
                .httpConnectTimeoutMs(config.getHttpConnectTimeoutMs())
                .httpIdleTimeoutSeconds(config.getHttpIdleTimeoutSeconds())
                .httpRequestTimeoutMs(config.getHttpRequestTimeoutMs())
                .credentialDirectory(Paths.get(config.getCredentialDirectory()))
                .healthEnabled(config.isHealthEnabled())
                .healthPort(config.getHealthPort())
                .eventBusAddress(config.getEventBusAddress())
                .enrollmentToken(token.isBlank() ? null : token)
                .build();
    }

    /**
     * Absolute URL of a backend endpoint path such as {@code /agent-get-tasks}.
     */
    public String endpointUrl(String endpoint) {
        return baseUrl + (endpoint.startsWith("/") ? endpoint : "/" + endpoint);
    }

    // Getters
    public String getBaseUrl() { return baseUrl; }
    public String getServiceName() { return serviceName; }
    public Duration getPollInterval() { return pollInterval; }
    public Duration getTelemetryInterval() { return telemetryInterval; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getBackoffBase() { return backoffBase; }
    public Duration getRefreshSkew() { return refreshSkew; }
    public Duration getDefaultTokenLifetime() { return defaultTokenLifetime; }
    public int getHttpConnectTimeoutMs() { return httpConnectTimeoutMs; }
    public int getHttpIdleTimeoutSeconds() { return httpIdleTimeoutSeconds; }
    public long getHttpRequestTimeoutMs() { return httpRequestTimeoutMs; }
    public String getUserAgent() { return userAgent; }
    public Path getCredentialDirectory() { return credentialDirectory; }
    public boolean isHealthEnabled() { return healthEnabled; }
    public int getHealthPort() { return healthPort; }
    public String getEventBusAddress() { return eventBusAddress; }
    public String getEnrollmentToken() { return enrollmentToken; }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "AgentConfiguration{baseUrl='" + baseUrl + "', serviceName='" + serviceName
                + "', pollInterval=" + pollInterval + ", telemetryInterval=" + telemetryInterval
                + ", maxRetries=" + maxRetries + '}';
    }

    public static class Builder {
        private String baseUrl;
        private String serviceName = DEFAULT_SERVICE_NAME;
        private Duration pollInterval = Duration.ofMillis(DEFAULT_POLL_INTERVAL_MS);
        private Duration telemetryInterval = Duration.ofMillis(DEFAULT_TELEMETRY_INTERVAL_MS);
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration backoffBase = Duration.ofMillis(DEFAULT_BACKOFF_BASE_MS);
        private Duration refreshSkew = Duration.ofMillis(DEFAULT_REFRESH_SKEW_MS);
        private Duration defaultTokenLifetime = Duration.ofMillis(DEFAULT_TOKEN_LIFETIME_MS);
        private int httpConnectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        private int httpIdleTimeoutSeconds = DEFAULT_IDLE_TIMEOUT_SECONDS;
        private long httpRequestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
        private String userAgent = DEFAULT_USER_AGENT;
        private Path credentialDirectory = Paths.get(System.getProperty("user.home"), ".huginn", "credentials");
        private boolean healthEnabled = false;
        private int healthPort = 8090;
        private String eventBusAddress = DEFAULT_EVENT_ADDRESS;
        private String enrollmentToken;

        public Builder baseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
        public Builder serviceName(String serviceName) { this.serviceName = serviceName; return this; }
        public Builder pollInterval(Duration pollInterval) { this.pollInterval = pollInterval; return this; }
        public Builder telemetryInterval(Duration telemetryInterval) { this.telemetryInterval = telemetryInterval; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder backoffBase(Duration backoffBase) { this.backoffBase = backoffBase; return this; }
        public Builder refreshSkew(Duration refreshSkew) { this.refreshSkew = refreshSkew; return this; }
        public Builder defaultTokenLifetime(Duration lifetime) { this.defaultTokenLifetime = lifetime; return this; }
        public Builder httpConnectTimeoutMs(int timeoutMs) { this.httpConnectTimeoutMs = timeoutMs; return this; }
        public Builder httpIdleTimeoutSeconds(int seconds) { this.httpIdleTimeoutSeconds = seconds; return this; }
        public Builder httpRequestTimeoutMs(long timeoutMs) { this.httpRequestTimeoutMs = timeoutMs; return this; }
        public Builder userAgent(String userAgent) { this.userAgent = userAgent; return this; }
        public Builder credentialDirectory(Path directory) { this.credentialDirectory = directory; return this; }
        public Builder healthEnabled(boolean healthEnabled) { this.healthEnabled = healthEnabled; return this; }
        public Builder healthPort(int healthPort) { this.healthPort = healthPort; return this; }
        public Builder eventBusAddress(String address) { this.eventBusAddress = address; return this; }
        public Builder enrollmentToken(String enrollmentToken) { this.enrollmentToken = enrollmentToken; return this; }

        public AgentConfiguration build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl is required");
            }
            if (serviceName == null || serviceName.isBlank()) {
                throw new IllegalArgumentException("serviceName is required");
            }
            requirePositive(pollInterval, "pollInterval");
            requirePositive(telemetryInterval, "telemetryInterval");
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            Objects.requireNonNull(backoffBase, "backoffBase cannot be null");
            Objects.requireNonNull(refreshSkew, "refreshSkew cannot be null");
            requirePositive(defaultTokenLifetime, "defaultTokenLifetime");
            if (backoffBase.isNegative() || refreshSkew.isNegative()) {
                throw new IllegalArgumentException("backoffBase and refreshSkew must not be negative");
            }
            return new AgentConfiguration(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
