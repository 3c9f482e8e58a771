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

package org.fireflyframework.datatest;

/**
 * Explicit marker for "no value" in observed data and requirements.
 *
 * <p>Loaders use {@link #VALUE} for empty cells or absent fields. A requirement of
 * {@code null} or {@code Absent.VALUE} matches only this marker (or {@code null}),
 * never {@code 0} or the empty string.</p>
 */
public enum Absent {

    VALUE;

    /**
     * Returns whether the given value denotes absence.
     *
     * @param value the value to test
     * @return {@code true} for {@code null} and {@link #VALUE}
     */
    public static boolean isAbsent(Object value) {
        return value == null || value == VALUE;
    }

    @Override
    public String toString() {
        return "Absent";
    }
}
