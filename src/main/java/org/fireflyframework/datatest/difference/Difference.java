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
 * A single detected discrepancy between observed data and a requirement.
 *
 * <p>Differences are immutable value objects. When a difference was found inside
 * a group of a grouped data set, {@link #key()} returns that group key; otherwise
 * it returns {@code null}.</p>
 */
public sealed interface Difference permits Missing, Extra, Invalid, Deviation {

    /**
     * Returns the kind of this difference.
     *
     * @return the difference kind
     */
    DifferenceKind kind();

    /**
     * Returns the group key this difference belongs to.
     *
     * @return the group key, or {@code null} for ungrouped data
     */
    Object key();

    /**
     * Returns a copy of this difference tagged with the given group key.
     *
     * @param key the group key
     * @return the tagged difference
     */
    Difference withKey(Object key);
}
