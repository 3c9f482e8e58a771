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

import org.fireflyframework.datatest.match.matchers.EqualsMatcher;
import org.fireflyframework.datatest.match.matchers.FunctionMatcher;
import org.fireflyframework.datatest.match.matchers.InstanceOfMatcher;
import org.fireflyframework.datatest.match.matchers.PatternMatcher;
import org.fireflyframework.datatest.match.matchers.TupleFunctionMatcher;

import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Builds a {@link PredicateMatcher} from a raw requirement atom.
 *
 * <p>Atoms are recognised in priority order:</p>
 * <ol>
 *   <li>a {@link Predicate} is used directly; a {@link BiPredicate} tests two-element rows and a
 *       {@link RowPredicate} tests rows of any length</li>
 *   <li>a {@link Pattern} must fully match the string form of the value</li>
 *   <li>a {@link Class} requires the value to be an instance of it</li>
 *   <li>anything else is a literal compared with {@link EqualsMatcher}</li>
 * </ol>
 */
public final class PredicateMatchers {

    private PredicateMatchers() {}

    /**
     * Creates the matcher for the given atom.
     *
     * @param atom the raw requirement atom, may be {@code null}
     * @return the matcher
     */
    @SuppressWarnings("unchecked")
    public static PredicateMatcher of(Object atom) {
        if (atom instanceof PredicateMatcher matcher) {
            return matcher;
        }
        if (atom instanceof Predicate<?> predicate) {
            return new FunctionMatcher((Predicate<Object>) predicate);
        }
        if (atom instanceof BiPredicate<?, ?> predicate) {
            return new TupleFunctionMatcher((BiPredicate<Object, Object>) predicate);
        }
        if (atom instanceof RowPredicate predicate) {
            return new TupleFunctionMatcher(predicate);
        }
        if (atom instanceof Pattern pattern) {
            return new PatternMatcher(pattern);
        }
        if (atom instanceof Class<?> type) {
            return new InstanceOfMatcher(type);
        }
        return new EqualsMatcher(atom);
    }

    /**
     * Returns whether the atom is a literal, i.e. would be compared by equality.
     *
     * @param atom the raw requirement atom
     * @return {@code true} if the atom is compared by equality rather than called or matched
     */
    public static boolean isLiteral(Object atom) {
        return !(atom instanceof PredicateMatcher
                || atom instanceof Predicate<?>
                || atom instanceof BiPredicate<?, ?>
                || atom instanceof RowPredicate
                || atom instanceof Function<?, ?>
                || atom instanceof Pattern
                || atom instanceof Class<?>);
    }

    /**
     * Creates a named matcher from a single-argument test; the name is used when
     * the matcher is rendered in a difference.
     *
     * @param name the display name
     * @param test the test
     * @param <T>  the value type the test accepts
     * @return the matcher
     */
    @SuppressWarnings("unchecked")
    public static <T> PredicateMatcher named(String name, Predicate<? super T> test) {
        return new FunctionMatcher(value -> ((Predicate<Object>) test).test(value), name);
    }

    /**
     * Creates a matcher that requires the full string form of a value to match the regex.
     *
     * @param regex the regular expression
     * @return the matcher
     */
    public static PredicateMatcher regex(String regex) {
        return new PatternMatcher(Pattern.compile(regex));
    }
}
