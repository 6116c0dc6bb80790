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

package dev.mars.huginn.core;

import io.vertx.core.json.JsonObject;

import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time identity snapshot of the device the agent runs on.
 * Sent to the backend during enrollment and registration checks.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public final class DeviceInfo {

    private final String hostname;
    private final String platform;
    private final String arch;
    private final String osVersion;
    private final String cpuModel;
    private final long totalMemory;
    private final String macAddress;
    private final String serialNumber;

    private DeviceInfo(Builder builder) {
        this.hostname = Objects.requireNonNull(builder.hostname, "hostname is required");
        this.platform = builder.platform;
        this.arch = builder.arch;
        this.osVersion = builder.osVersion;
        this.cpuModel = builder.cpuModel;
        this.totalMemory = builder.totalMemory;
        this.macAddress = builder.macAddress;
        this.serialNumber = builder.serialNumber;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getHostname() { return hostname; }
    public String getPlatform() { return platform; }
    public String getArch() { return arch; }
    public String getOsVersion() { return osVersion; }
    public String getCpuModel() { return cpuModel; }
    public long getTotalMemory() { return totalMemory; }
    public String getMacAddress() { return macAddress; }
    public Optional<String> getSerialNumber() { return Optional.ofNullable(serialNumber); }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("hostname", hostname)
                .put("platform", platform)
                .put("arch", arch)
                .put("version", osVersion)
                .put("cpuModel", cpuModel)
                .put("totalMemory", totalMemory)
                .put("macAddress", macAddress);
        if (serialNumber != null) {
            json.put("serialNumber", serialNumber);
        }
        return json;
    }

    @Override
    public String toString() {
        return "DeviceInfo{hostname='" + hostname + "', platform='" + platform + "', arch='" + arch + "'}";
    }

    public static class Builder {
        private String hostname;
        private String platform = "unknown";
        private String arch = "unknown";
        private String osVersion = "unknown";
        private String cpuModel = "unknown";
        private long totalMemory;
        private String macAddress = "unknown";
        private String serialNumber;

        public Builder hostname(String hostname) { this.hostname = hostname; return this; }
        public Builder platform(String platform) { this.platform = platform; return this; }
        public Builder arch(String arch) { this.arch = arch; return this; }
        public Builder osVersion(String osVersion) { this.osVersion = osVersion; return this; }
        public Builder cpuModel(String cpuModel) { this.cpuModel = cpuModel; return this; }
        public Builder totalMemory(long totalMemory) { this.totalMemory = totalMemory; return this; }
        public Builder macAddress(String macAddress) { this.macAddress = macAddress; return this; }
        public Builder serialNumber(String serialNumber) { this.serialNumber = serialNumber; return this; }

        public DeviceInfo build() {
            return new DeviceInfo(this);
        }
    }
}
