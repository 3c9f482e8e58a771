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
 * Condition over the fields of a row, applied as {@code test(field1, field2, ...)}.
 *
 * <p>Rows are observed elements given as a {@link java.util.List} or an
 * {@code Object[]}; any other element fails the condition.</p>
 *
 * <pre>{@code
 * RowPredicate ordered = fields -> ((Integer) fields[0]) <= ((Integer) fields[2]);
 * }</pre>
 */
@FunctionalInterface
public interface RowPredicate {

    boolean test(Object... fields);
}
