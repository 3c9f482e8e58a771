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
 * A required element that is absent from the observed data.
 *
 * @param expected the required value, or the matcher describing it
 * @param key      the group key, or {@code null} for ungrouped data
 */
public record Missing(Object expected, Object key) implements Difference {

    public Missing(Object expected) {
        this(expected, null);
    }

    @Override
    public DifferenceKind kind() {
        return DifferenceKind.MISSING;
    }

    @Override
    public Missing withKey(Object key) {
        return new Missing(expected, key);
    }

    @Override
    public String toString() {
        return "Missing(" + ValueFormat.format(expected) + keySuffix(key) + ")";
    }

    static String keySuffix(Object key) {
        return key == null ? "" : ", key=" + ValueFormat.format(key);
    }
}
