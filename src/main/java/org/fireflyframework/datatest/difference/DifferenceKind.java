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
 * Kinds of discrepancy between observed data and a requirement.
 *
 * <ul>
 *   <li>{@link #MISSING} - A required element is absent from the observed data</li>
 *   <li>{@link #EXTRA} - An observed element is not sanctioned by any requirement</li>
 *   <li>{@link #INVALID} - An observed element is present but fails its match</li>
 *   <li>{@link #DEVIATION} - A numeric element lies outside its tolerance</li>
 * </ul>
 */
public enum DifferenceKind {

    MISSING,
    EXTRA,
    INVALID,
    DEVIATION
}
