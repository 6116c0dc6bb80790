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

import dev.mars.huginn.agent.spi.DeviceInfoCollector;
import dev.mars.huginn.core.DeviceInfo;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

/**
 * Inspects the local machine: hostname, operating system, CPU, memory and the first
 * hardware MAC address. Runs on a worker thread since hostname lookup can block.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class SystemDeviceInfoCollector implements DeviceInfoCollector {

    private static final Logger logger = LoggerFactory.getLogger(SystemDeviceInfoCollector.class);
    private static final Path CPU_INFO = Paths.get("/proc/cpuinfo");

    private final Vertx vertx;

    public SystemDeviceInfoCollector(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public Future<DeviceInfo> getDeviceInfo() {
        return vertx.executeBlocking(this::inspect);
    }

    DeviceInfo inspect() {
        return DeviceInfo.builder()
                .hostname(hostname())
                .platform(System.getProperty("os.name", "unknown"))
                .arch(System.getProperty("os.arch", "unknown"))
                .osVersion(System.getProperty("os.version", "unknown"))
                .cpuModel(cpuModel())
                .totalMemory(totalMemory())
                .macAddress(macAddress())
                .build();
    }

    private String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Could not determine hostname: {}", e.getMessage());
            String env = System.getenv("HOSTNAME");
            return env != null && !env.isBlank() ? env : "unknown-host";
        }
    }

    private String cpuModel() {
        if (Files.isReadable(CPU_INFO)) {
            try {
                List<String> lines = Files.readAllLines(CPU_INFO);
                for (String line : lines) {
                    if (line.startsWith("model name")) {
                        int colon = line.indexOf(':');
                        if (colon >= 0) {
                            return line.substring(colon + 1).trim();
                        }
                    }
                }
            } catch (IOException e) {
                logger.debug("Could not read {}: {}", CPU_INFO, e.getMessage());
            }
        }
        String identifier = System.getenv("PROCESSOR_IDENTIFIER");
        if (identifier != null && !identifier.isBlank()) {
            return identifier;
        }
        return Runtime.getRuntime().availableProcessors() + " x " + System.getProperty("os.arch", "unknown");
    }

    private long totalMemory() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            return ((com.sun.management.OperatingSystemMXBean) os).getTotalMemorySize();
        }
        return Runtime.getRuntime().maxMemory();
    }

    private String macAddress() {
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (nic.isLoopback() || nic.isVirtual()) {
                    continue;
                }
                byte[] mac = nic.getHardwareAddress();
                if (mac != null && mac.length == 6) {
                    return formatMac(mac);
                }
            }
        } catch (SocketException e) {
            logger.debug("Could not enumerate network interfaces: {}", e.getMessage());
        }
        return "unknown";
    }

    static String formatMac(byte[] mac) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < mac.length; i++) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(String.format("%02x", mac[i]));
        }
        return sb.toString();
    }
}
