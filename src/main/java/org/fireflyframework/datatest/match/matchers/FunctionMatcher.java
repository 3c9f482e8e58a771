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

import java.util.function.Predicate;

/**
 * Built-in matcher around a user-supplied single-argument test.
 *
 * <p>A test that throws counts as a failed match, so one bad cell cannot abort
 * the whole validation.</p>
 */
public class FunctionMatcher implements PredicateMatcher {

    private final Predicate<Object> test;
    private final String name;

    public FunctionMatcher(Predicate<Object> test) {
        this(test, "condition");
    }

    public FunctionMatcher(Predicate<Object> test, String name) {
        this.test = test;
        this.name = name;
    }

    @Override
    public boolean matches(Object observed) {
        try {
            return test.test(observed);
        } catch (RuntimeException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
