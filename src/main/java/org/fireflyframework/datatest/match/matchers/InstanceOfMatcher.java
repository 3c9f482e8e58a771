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

/**
 * Built-in matcher that requires a value to be an instance of a given type.
 */
public class InstanceOfMatcher implements PredicateMatcher {

    private final Class<?> type;

    public InstanceOfMatcher(Class<?> type) {
        this.type = type;
    }

    @Override
    public boolean matches(Object observed) {
        return type.isInstance(observed);
    }

    public Class<?> getType() {
        return type;
    }

    @Override
    public String toString() {
        return "instanceOf(" + type.getSimpleName() + ")";
    }
}
