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

import org.fireflyframework.datatest.match.PredicateMatcher;
import org.fireflyframework.datatest.match.matchers.PatternMatcher;

import java.util.Objects;

/**
 * Requires an observed value to satisfy a {@link PredicateMatcher}.
 *
 * @param matcher the matcher built from a callable, pattern or type
 */
public record PredicateRequirement(PredicateMatcher matcher) implements ElementRequirement {

    public PredicateRequirement {
        Objects.requireNonNull(matcher, "matcher");
    }

    @Override
    public boolean matches(Object observed) {
        return matcher.matches(observed);
    }

    @Override
    public Object expected() {
        return matcher;
    }

    @Override
    public String failureMessage() {
        if (matcher instanceof PatternMatcher) {
            return "does not satisfy " + matcher + " regex";
        }
        return "does not satisfy " + matcher;
    }
}
