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

package dev.mars.huginn.core.exceptions;

/**
 * Thrown when a call to the management backend fails after all retries,
 * or when the dispatcher refuses to send it.
 *
 * <p>The status code is the HTTP status returned by the backend, or
 * {@link #NO_STATUS} when the request never produced a response
 * (connection refused, timeout, dispatcher halted).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class BackendRequestException extends HuginnException {

    public static final int NO_STATUS = -1;

    private final String endpoint;
    private final int statusCode;

    public BackendRequestException(String endpoint, int statusCode, String message) {
        super(message);
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }

    public BackendRequestException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
        this.statusCode = NO_STATUS;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode != NO_STATUS;
    }

    @Override
    public String getMessage() {
        return String.format("Request to %s failed: %s", endpoint, super.getMessage());
    }
}
