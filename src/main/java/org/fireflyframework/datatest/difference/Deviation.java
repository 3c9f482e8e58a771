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

package org.fireflyframework.datatest.difference;

/**
 * A numeric element whose distance from the expected value exceeds the allowed tolerance.
 *
 * <p>The {@code delta} is always {@code observed - expected}: positive when the
 * observed value is too large, negative when it is too small.</p>
 *
 * @param observed the observed number
 * @param expected the expected number
 * @param delta    the signed deviation {@code observed - expected}
 * @param key      the group key, or {@code null} for ungrouped data
 */
public record Deviation(Number observed, Number expected, Number delta, Object key) implements Difference {

    public Deviation(Number observed, Number expected, Number delta) {
        this(observed, expected, delta, null);
    }

    @Override
    public DifferenceKind kind() {
        return DifferenceKind.DEVIATION;
    }

    @Override
    public Deviation withKey(Object key) {
        return new Deviation(observed, expected, delta, key);
    }

    @Override
    public String toString() {
        return "Deviation(" + ValueFormat.formatSigned(delta) + ", " + ValueFormat.format(expected)
                + Missing.keySuffix(key) + ")";
    }
}
