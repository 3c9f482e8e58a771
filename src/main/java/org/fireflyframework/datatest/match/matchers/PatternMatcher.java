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

import org.fireflyframework.datatest.Absent;
import org.fireflyframework.datatest.match.PredicateMatcher;

import java.util.regex.Pattern;

/**
 * Built-in matcher that requires the string form of a value to fully match a
 * regular expression. Partial matches do not count.
 */
public class PatternMatcher implements PredicateMatcher {

    private final Pattern pattern;

    public PatternMatcher(Pattern pattern) {
        this.pattern = pattern;
    }

    @Override
    public boolean matches(Object observed) {
        if (Absent.isAbsent(observed)) {
            return false;
        }
        return pattern.matcher(String.valueOf(observed)).matches();
    }

    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "/" + pattern.pattern() + "/";
    }
}
