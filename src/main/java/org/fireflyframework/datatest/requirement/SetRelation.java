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
 * Relation that observed elements must have to the members of a {@link SetRequirement}.
 *
 * <ul>
 *   <li>{@link #EQUAL} - Every member is matched and every element is sanctioned</li>
 *   <li>{@link #SUBSET} - Every element is sanctioned; unmatched members are allowed</li>
 *   <li>{@link #SUPERSET} - Every member is matched; unsanctioned elements are allowed</li>
 * </ul>
 */
public enum SetRelation {

    EQUAL,
    SUBSET,
    SUPERSET;

    boolean reportsMissing() {
        return this != SUBSET;
    }

    boolean reportsExtra() {
        return this != SUPERSET;
    }
}
