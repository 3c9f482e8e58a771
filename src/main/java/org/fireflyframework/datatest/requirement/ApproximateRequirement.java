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

import org.fireflyframework.datatest.difference.ValueFormat;
import org.fireflyframework.datatest.match.NumericDeviation;
import org.fireflyframework.datatest.match.NumericValues;

import java.math.BigDecimal;

/**
 * Requires an observed number to lie within a tolerance of an expected number.
 *
 * @param expected  the expected number
 * @param tolerance the tolerance, never negative
 * @param mode      whether the tolerance is absolute or a fraction of {@code expected}
 */
public record ApproximateRequirement(BigDecimal expected, BigDecimal tolerance, ToleranceMode mode)
        implements ElementRequirement {

    public ApproximateRequirement {
        if (expected == null) {
            throw new MalformedRequirementException("Approximate requirement needs an expected number");
        }
        if (tolerance == null || tolerance.signum() < 0) {
            throw new MalformedRequirementException(
                    "Tolerance must not be negative, got " + ValueFormat.format(tolerance));
        }
        if (mode == null) {
            mode = ToleranceMode.ABSOLUTE;
        }
    }

    /**
     * Creates an absolute-tolerance requirement.
     *
     * @param expected  the expected number, must be finite
     * @param tolerance the largest allowed absolute deviation, must be finite and non-negative
     * @return the requirement
     * @throws MalformedRequirementException if either number is not finite or the tolerance is negative
     */
    public static ApproximateRequirement of(Number expected, Number tolerance) {
        return of(expected, tolerance, ToleranceMode.ABSOLUTE);
    }

    /**
     * Creates a requirement with the given tolerance mode.
     *
     * @param expected  the expected number, must be finite
     * @param tolerance the tolerance, must be finite and non-negative
     * @param mode      the tolerance mode
     * @return the requirement
     * @throws MalformedRequirementException if either number is not finite or the tolerance is negative
     */
    public static ApproximateRequirement of(Number expected, Number tolerance, ToleranceMode mode) {
        if (expected == null || !NumericValues.isFinite(expected)) {
            throw new MalformedRequirementException(
                    "Expected value must be a finite number, got " + ValueFormat.format(expected));
        }
        if (tolerance == null || !NumericValues.isFinite(tolerance)) {
            throw new MalformedRequirementException(
                    "Tolerance must be a finite number, got " + ValueFormat.format(tolerance));
        }
        return new ApproximateRequirement(
                NumericValues.toBigDecimal(expected), NumericValues.toBigDecimal(tolerance), mode);
    }

    /**
     * Returns the largest allowed absolute deviation.
     *
     * @return the tolerance for {@link ToleranceMode#ABSOLUTE}, otherwise {@code |expected| * tolerance}
     */
    public BigDecimal allowedDeviation() {
        return mode == ToleranceMode.PERCENT ? expected.abs().multiply(tolerance) : tolerance;
    }

    @Override
    public boolean matches(Object observed) {
        return NumericDeviation.isWithin(observed, expected, allowedDeviation());
    }

    @Override
    public String failureMessage() {
        return "does not approximate " + ValueFormat.format(expected)
                + " within " + ValueFormat.format(allowedDeviation());
    }
}
