/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.datatest.requirement;

import org.fireflyframework.datatest.DataValidationException;

/**
 * Thrown when a raw requirement cannot be normalized into a {@link Requirement},
 * for example a mapping value of an unsupported shape or a negative tolerance.
 *
 * <p>This is a usage error, distinct from data that fails validation.</p>
 */
public class MalformedRequirementException extends DataValidationException {

    public MalformedRequirementException(String message) {
        super(message);
    }

    public MalformedRequirementException(String message, Throwable cause) {
        super(message, cause);
    }
}
