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

package org.fireflyframework.datatest.match.matchers;

import org.fireflyframework.datatest.match.PredicateMatcher;
import org.fireflyframework.datatest.match.RowPredicate;

import java.util.List;
import java.util.function.BiPredicate;

/**
 * Built-in matcher that unpacks row elements into a multi-argument test,
 * e.g. {@code (low, high) -> low < high} against {@code List.of(1, 3)}.
 *
 * <p>Rows are {@link List}s or {@code Object[]}s. Other values fail the match, as does
 * a row of the wrong length for a fixed-arity test or a test that throws.</p>
 */
public class TupleFunctionMatcher implements PredicateMatcher {

    /** Arity of a test that accepts rows of any length. */
    public static final int ANY_ARITY = -1;

    private final RowPredicate test;
    private final int arity;
    private final String name;

    public TupleFunctionMatcher(BiPredicate<Object, Object> test) {
        this(fields -> test.test(fields[0], fields[1]), 2, "condition");
    }

    public TupleFunctionMatcher(RowPredicate test) {
        this(test, ANY_ARITY, "condition");
    }

    /**
     * Creates a row matcher.
     *
     * @param test  the test applied to the unpacked fields
     * @param arity the required row length, or {@link #ANY_ARITY}
     * @param name  the name used when rendering this matcher
     */
    public TupleFunctionMatcher(RowPredicate test, int arity, String name) {
        this.test = test;
        this.arity = arity;
        this.name = name;
    }

    @Override
    public boolean matches(Object observed) {
        Object[] fields = fields(observed);
        if (fields == null || (arity != ANY_ARITY && fields.length != arity)) {
            return false;
        }
        try {
            return test.test(fields);
        } catch (RuntimeException e) {
            return false;
        }
    }

    public int getArity() {
        return arity;
    }

    @Override
    public String toString() {
        return name;
    }

    private static Object[] fields(Object observed) {
        if (observed instanceof List<?> row) {
            return row.toArray();
        }
        if (observed instanceof Object[] row) {
            return row.clone();
        }
        return null;
    }
}
