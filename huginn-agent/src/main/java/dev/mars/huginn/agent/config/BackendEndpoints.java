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

/**
 * Backend endpoint paths, relative to the configured base URL.
 */
public final class BackendEndpoints {

    /** Enrollment and authenticated registration check. */
    public static final String CHECK_AGENT_STATUS = "/check-agent-status";
    public static final String REFRESH_TOKEN = "/refresh-token";
    public static final String GET_TASKS = "/agent-get-tasks";
    public static final String UPDATE_TASK = "/agent-update-task";
    public static final String PROCESS_TELEMETRY = "/process-agent-telemetry";

    private BackendEndpoints() {
    }
}
