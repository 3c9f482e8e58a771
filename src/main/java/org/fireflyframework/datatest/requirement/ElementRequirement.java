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

/**
 * A requirement on a single value. Element requirements are the members of
 * set requirements and the items of sequence requirements.
 */
public sealed interface ElementRequirement extends Requirement
        permits EqualityRequirement, PredicateRequirement, FunctionRequirement, ApproximateRequirement {

    /**
     * Tests a single observed value.
     *
     * @param observed the observed value, may be {@code null}
     * @return {@code true} if the value satisfies this requirement
     */
    boolean matches(Object observed);

    /**
     * Returns the value reported as "expected" when this requirement is unmet:
     * the literal, the matcher, or the expected number.
     *
     * @return the expected value
     */
    Object expected();
}
