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
 * Thrown when the backend does not hand out a usable credential bundle
 * during enrollment: no matching agent record, or a response missing
 * the agent id or token.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class EnrollmentException extends HuginnException {

    public EnrollmentException(String reason) {
        super(reason);
    }

    public EnrollmentException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
