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

/**
 * Uniform boolean test around a requirement atom.
 *
 * <p>Implementations must be pure: no side effects, and no exceptions for
 * well-formed observed values (strings, numbers, or other comparable atoms).
 * Matchers are built once during requirement normalization and may be shared
 * between concurrent validations.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * PredicateMatcher isoDate = PredicateMatchers.of(Pattern.compile("\\d{4}-\\d{2}-\\d{2}"));
 * isoDate.matches("2024-01-31"); // true
 * isoDate.matches("31/01/2024"); // false
 * }</pre>
 */
@FunctionalInterface
public interface PredicateMatcher {

    /**
     * Tests the observed value.
     *
     * @param observed the observed value, may be {@code null}
     * @return {@code true} if the value satisfies this matcher
     */
    boolean matches(Object observed);
}
