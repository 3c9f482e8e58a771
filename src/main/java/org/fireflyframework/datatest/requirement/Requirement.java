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
 * A normalized requirement: an immutable tree describing what valid data looks like.
 *
 * <p>The hierarchy is closed. Element requirements ({@link EqualityRequirement},
 * {@link PredicateRequirement}, {@link ApproximateRequirement}) test single values;
 * {@link SetRequirement} and {@link SequenceRequirement} describe collections of
 * values; {@link MappingRequirement} partitions data into keyed groups.</p>
 *
 * <p>Trees are built by {@link RequirementNormalizer} and may be reused across any
 * number of validations, including concurrent ones.</p>
 */
public sealed interface Requirement
        permits ElementRequirement, SetRequirement, SequenceRequirement, MappingRequirement {

    /**
     * Returns a short clause describing a violation of this requirement,
     * e.g. {@code "does not satisfy set membership"}.
     *
     * @return the failure clause
     */
    String failureMessage();
}
