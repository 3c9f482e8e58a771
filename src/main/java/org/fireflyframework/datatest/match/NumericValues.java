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

import org.fireflyframework.datatest.Absent;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric helpers shared by literal matching and deviation computation.
 *
 * <p>Numbers of different boxed types are compared by value, so {@code 1},
 * {@code 1L}, {@code 1.0} and {@code BigDecimal("1.00")} are all equal.
 * NaN is never equal to anything.</p>
 */
public final class NumericValues {

    private NumericValues() {}

    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    /**
     * Returns whether the value is a NaN marker ({@link Double#NaN} or {@link Float#NaN}).
     *
     * @param value the value to test
     * @return {@code true} for NaN
     */
    public static boolean isNaN(Object value) {
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    /**
     * Returns whether the value is a number that can be represented exactly as a {@link BigDecimal}.
     *
     * @param value the value to test
     * @return {@code true} for finite numbers
     */
    public static boolean isFinite(Object value) {
        if (value instanceof Double d) {
            return Double.isFinite(d);
        }
        if (value instanceof Float f) {
            return Float.isFinite(f);
        }
        return value instanceof Number;
    }

    /**
     * Converts a finite number to a {@link BigDecimal} using its decimal string form,
     * so that {@code 11.01} becomes exactly {@code 11.01}.
     *
     * @param number a finite number
     * @return the decimal value
     * @throws NumberFormatException if the number is not finite
     */
    public static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        return new BigDecimal(number.toString());
    }

    /**
     * Compares two numbers by value. NaN never equals anything; infinities equal
     * only infinities of the same sign.
     *
     * @param left  the first number
     * @param right the second number
     * @return {@code true} if both denote the same value
     */
    public static boolean numericallyEqual(Number left, Number right) {
        if (isNaN(left) || isNaN(right)) {
            return false;
        }
        if (!isFinite(left) || !isFinite(right)) {
            return left.doubleValue() == right.doubleValue();
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right)) == 0;
    }

    /**
     * Returns a hashing key under which numerically equal values collide and all
     * other values keep their own identity.
     *
     * @param value any value
     * @return the canonical key
     */
    public static Object canonicalKey(Object value) {
        if (Absent.isAbsent(value)) {
            return Absent.VALUE;
        }
        if (value instanceof Number number && isFinite(number)) {
            BigDecimal decimal = toBigDecimal(number);
            return decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value;
    }
}
