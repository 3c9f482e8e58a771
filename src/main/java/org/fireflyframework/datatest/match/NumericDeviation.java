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

package org.fireflyframework.datatest.match;

import org.fireflyframework.datatest.difference.Deviation;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Compares observed numbers against expected numbers within a tolerance.
 *
 * <p>Finite values are subtracted as {@link BigDecimal}s taken from their decimal
 * string form, so {@code 11.01 - 10} is exactly {@code 1.01} and a delta equal to
 * the tolerance is still within it. Infinite values fall back to {@code double}
 * arithmetic and always exceed a finite tolerance.</p>
 */
public final class NumericDeviation {

    private NumericDeviation() {}

    /**
     * Computes the signed deviation {@code observed - expected}.
     *
     * @param observed the observed number
     * @param expected the expected number
     * @return a {@link BigDecimal} for finite operands, otherwise a {@link Double}
     */
    public static Number delta(Number observed, Number expected) {
        if (NumericValues.isFinite(observed) && NumericValues.isFinite(expected)) {
            return NumericValues.toBigDecimal(observed).subtract(NumericValues.toBigDecimal(expected));
        }
        return observed.doubleValue() - expected.doubleValue();
    }

    /**
     * Returns whether the magnitude of a delta is greater than the allowed tolerance.
     *
     * @param delta     a delta produced by {@link #delta(Number, Number)}
     * @param tolerance the allowed absolute deviation, never negative
     * @return {@code true} if the delta is out of tolerance
     */
    public static boolean exceeds(Number delta, BigDecimal tolerance) {
        if (delta instanceof BigDecimal decimal) {
            return decimal.abs().compareTo(tolerance) > 0;
        }
        double value = delta.doubleValue();
        return Double.isNaN(value) || Double.isInfinite(value) || Math.abs(value) > tolerance.doubleValue();
    }

    /**
     * Compares an observed number against the expected number.
     *
     * @param observed  the observed number, must not be NaN
     * @param expected  the expected number
     * @param tolerance the allowed absolute deviation
     * @return the deviation if it exceeds the tolerance, otherwise empty
     */
    public static Optional<Deviation> compare(Number observed, Number expected, BigDecimal tolerance) {
        Number delta = delta(observed, expected);
        if (exceeds(delta, tolerance)) {
            return Optional.of(new Deviation(observed, expected, delta));
        }
        return Optional.empty();
    }

    /**
     * Returns whether the observed value lies within the tolerance of the expected number.
     * Non-numeric values and NaN never do.
     *
     * @param observed  the observed value
     * @param expected  the expected number
     * @param tolerance the allowed absolute deviation
     * @return {@code true} if the value is a number within tolerance
     */
    public static boolean isWithin(Object observed, Number expected, BigDecimal tolerance) {
        if (!(observed instanceof Number number) || NumericValues.isNaN(number)) {
            return false;
        }
        return !exceeds(delta(number, expected), tolerance);
    }
}
