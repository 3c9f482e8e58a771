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
 * An observed element that is not sanctioned by any requirement.
 *
 * @param observed the unexpected value
 * @param key      the group key, or {@code null} for ungrouped data
 */
public record Extra(Object observed, Object key) implements Difference {

    public Extra(Object observed) {
        this(observed, null);
    }

    @Override
    public DifferenceKind kind() {
        return DifferenceKind.EXTRA;
    }

    @Override
    public Extra withKey(Object key) {
        return new Extra(observed, key);
    }

    @Override
    public String toString() {
        return "Extra(" + ValueFormat.format(observed) + Missing.keySuffix(key) + ")";
    }
}
