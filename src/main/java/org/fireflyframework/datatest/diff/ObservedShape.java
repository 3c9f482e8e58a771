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

package org.fireflyframework.datatest.diff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The canonical shapes of observed data.
 *
 * <ul>
 *   <li>{@link #SCALAR} - A single value (including strings and primitive arrays)</li>
 *   <li>{@link #ORDERED} - A {@link List}, {@code Object[]} or other non-set {@link Collection}</li>
 *   <li>{@link #UNORDERED} - A {@link Set}</li>
 *   <li>{@link #GROUPED} - A {@link Map} from group key to scalar or collection</li>
 * </ul>
 */
public enum ObservedShape {

    SCALAR,
    ORDERED,
    UNORDERED,
    GROUPED;

    /**
     * Classifies an observed value.
     *
     * @param observed the observed value, may be {@code null}
     * @return its shape
     */
    public static ObservedShape of(Object observed) {
        if (observed instanceof Map<?, ?>) {
            return GROUPED;
        }
        if (observed instanceof Set<?>) {
            return UNORDERED;
        }
        if (observed instanceof Collection<?> || observed instanceof Object[]) {
            return ORDERED;
        }
        return SCALAR;
    }

    /**
     * Returns whether this shape is a collection of elements.
     *
     * @return {@code true} for {@link #ORDERED} and {@link #UNORDERED}
     */
    public boolean isCollection() {
        return this == ORDERED || this == UNORDERED;
    }

    /**
     * Lists the elements of an ordered or unordered observed value in iteration order.
     * A scalar yields a single element.
     *
     * @param observed the observed value, must not be a map
     * @return the elements
     */
    static List<Object> elements(Object observed) {
        if (observed instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (observed instanceof Object[] array) {
            return Arrays.asList(array);
        }
        List<Object> single = new ArrayList<>(1);
        single.add(observed);
        return single;
    }
}
