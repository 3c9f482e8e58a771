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

import org.fireflyframework.datatest.match.NumericValues;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Total, deterministic ordering of group keys.
 *
 * <p>{@code null} sorts first. Numbers compare by value (ties broken by type name),
 * lists compare element by element, values of the same {@link Comparable} type use
 * their natural order, and anything else is ordered by type name and then by its
 * string form.</p>
 */
public final class GroupKeyOrder implements Comparator<Object> {

    public static final GroupKeyOrder INSTANCE = new GroupKeyOrder();

    private GroupKeyOrder() {}

    /**
     * Returns the identity under which a group key is matched between a requirement
     * and observed data. Numbers are reduced to their value, so {@code 1}, {@code 1L}
     * and {@code 1.0} name the same group; lists are reduced element by element and
     * {@code null} maps to {@link org.fireflyframework.datatest.Absent#VALUE}.
     *
     * @param key the group key, may be {@code null}
     * @return the canonical key
     */
    public static Object canonicalKey(Object key) {
        if (key instanceof List<?> parts) {
            List<Object> canonical = new ArrayList<>(parts.size());
            for (Object part : parts) {
                canonical.add(canonicalKey(part));
            }
            return canonical;
        }
        return NumericValues.canonicalKey(key);
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public int compare(Object left, Object right) {
        if (left == right) {
            return 0;
        }
        if (left == null || right == null) {
            return left == null ? -1 : 1;
        }
        if (left instanceof Number a && right instanceof Number b) {
            int result = compareNumbers(a, b);
            return result != 0 ? result : typeName(left).compareTo(typeName(right));
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            return compareLists(a, b);
        }
        if (left.getClass() == right.getClass() && left instanceof Comparable comparable) {
            return comparable.compareTo(right);
        }
        int byType = typeName(left).compareTo(typeName(right));
        return byType != 0 ? byType : String.valueOf(left).compareTo(String.valueOf(right));
    }

    private int compareNumbers(Number left, Number right) {
        if (NumericValues.isFinite(left) && NumericValues.isFinite(right)) {
            BigDecimal a = NumericValues.toBigDecimal(left);
            BigDecimal b = NumericValues.toBigDecimal(right);
            return a.compareTo(b);
        }
        return Double.compare(left.doubleValue(), right.doubleValue());
    }

    private int compareLists(List<?> left, List<?> right) {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int result = compare(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static String typeName(Object value) {
        return value.getClass().getName();
    }
}
