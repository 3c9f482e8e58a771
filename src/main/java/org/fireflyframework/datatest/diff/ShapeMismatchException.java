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

package org.fireflyframework.datatest.diff;

import org.fireflyframework.datatest.DataValidationException;
import org.fireflyframework.datatest.requirement.Requirement;

import java.util.Locale;

/**
 * Thrown when a requirement and the observed data have incompatible shapes, for
 * example a sequence requirement against a single value. Shapes are never coerced.
 */
public class ShapeMismatchException extends DataValidationException {

    private final transient Requirement requirement;
    private final ObservedShape observedShape;

    public ShapeMismatchException(Requirement requirement, ObservedShape observedShape) {
        super(requirement.getClass().getSimpleName() + " cannot be compared against "
                + observedShape.name().toLowerCase(Locale.ROOT) + " data");
        this.requirement = requirement;
        this.observedShape = observedShape;
    }

    public ShapeMismatchException(String message, Requirement requirement, ObservedShape observedShape) {
        super(message);
        this.requirement = requirement;
        this.observedShape = observedShape;
    }

    public Requirement getRequirement() {
        return requirement;
    }

    public ObservedShape getObservedShape() {
        return observedShape;
    }
}
