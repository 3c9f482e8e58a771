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

package org.fireflyframework.datatest.match.matchers;

import org.fireflyframework.datatest.Absent;
import org.fireflyframework.datatest.match.Literals;
import org.fireflyframework.datatest.match.NumericValues;
import org.fireflyframework.datatest.match.PredicateMatcher;
import org.fireflyframework.datatest.difference.ValueFormat;

import java.util.Objects;

/**
 * Built-in matcher for literal values.
 *
 * <p>Numbers compare by value regardless of their boxed type, arrays compare deeply,
 * and everything else uses {@link Object#equals(Object)}. A literal of "no value"
 * ({@code null} or {@link Absent#VALUE}) matches only an absence marker. NaN
 * matches nothing, not even another NaN.</p>
 */
public class EqualsMatcher implements PredicateMatcher {

    private final Object expected;

    public EqualsMatcher(Object expected) {
        this.expected = Absent.isAbsent(expected) ? Absent.VALUE : Literals.freeze(expected);
    }

    @Override
    public boolean matches(Object observed) {
        return literalEquals(expected, observed);
    }

    /**
     * Compares a literal against an observed value with the rules of this matcher.
     *
     * @param expected the literal, {@code null} or {@link Absent#VALUE} for "no value"
     * @param observed the observed value
     * @return {@code true} if the observed value equals the literal
     */
    public static boolean literalEquals(Object expected, Object observed) {
        if (Absent.isAbsent(expected) || Absent.isAbsent(observed)) {
            return Absent.isAbsent(expected) && Absent.isAbsent(observed);
        }
        if (expected instanceof Number number && observed instanceof Number other) {
            return NumericValues.numericallyEqual(other, number);
        }
        if (NumericValues.isNaN(observed)) {
            return false;
        }
        return Objects.deepEquals(expected, observed);
    }

    /**
     * Returns the literal this matcher compares against.
     *
     * @return the expected value, {@link Absent#VALUE} for "no value"
     */
    public Object getExpected() {
        return expected;
    }

    @Override
    public String toString() {
        return ValueFormat.format(expected);
    }
}
