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

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Stable textual rendering of observed and expected values.
 */
public final class ValueFormat {

    private ValueFormat() {}

    /**
     * Renders a value for display. Strings and characters are single-quoted,
     * collections and arrays are rendered element by element.
     *
     * @param value the value to render, may be {@code null}
     * @return the rendered text
     */
    public static String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return "'" + value.toString().replace("'", "\\'") + "'";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(entry -> format(entry.getKey()) + ": " + format(entry.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(ValueFormat::format)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Object[] array) {
            return format(Arrays.asList(array));
        }
        if (value.getClass().isArray()) {
            return arrayToString(value);
        }
        return value.toString();
    }

    /**
     * Renders a numeric delta with an explicit sign, e.g. {@code +1.01} or {@code -2}.
     *
     * @param delta the delta to render
     * @return the signed text
     */
    public static String formatSigned(Number delta) {
        String text = format(delta);
        return text.startsWith("-") || text.startsWith("NaN") ? text : "+" + text;
    }

    private static String arrayToString(Object array) {
        if (array instanceof byte[] bytes) {
            return Arrays.toString(bytes);
        }
        if (array instanceof int[] ints) {
            return Arrays.toString(ints);
        }
        if (array instanceof long[] longs) {
            return Arrays.toString(longs);
        }
        if (array instanceof double[] doubles) {
            return Arrays.toString(doubles);
        }
        if (array instanceof char[] chars) {
            return Arrays.toString(chars);
        }
        if (array instanceof boolean[] booleans) {
            return Arrays.toString(booleans);
        }
        if (array instanceof short[] shorts) {
            return Arrays.toString(shorts);
        }
        if (array instanceof float[] floats) {
            return Arrays.toString(floats);
        }
        return array.toString();
    }
}
