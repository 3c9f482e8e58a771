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

import org.fireflyframework.datatest.Absent;
import org.fireflyframework.datatest.difference.ValueFormat;
import org.fireflyframework.datatest.match.Literals;
import org.fireflyframework.datatest.match.matchers.EqualsMatcher;

/**
 * Requires an observed value to equal a literal.
 *
 * <p>Collections and arrays are copied on construction, so changing the caller's
 * object afterwards does not change the requirement.</p>
 *
 * @param value the literal; {@code null} is stored as {@link Absent#VALUE}
 */
public record EqualityRequirement(Object value) implements ElementRequirement {

    public EqualityRequirement {
        value = value == null ? Absent.VALUE : Literals.freeze(value);
    }

    @Override
    public boolean matches(Object observed) {
        return EqualsMatcher.literalEquals(value, observed);
    }

    @Override
    public Object expected() {
        return value;
    }

    @Override
    public String failureMessage() {
        return "does not equal " + ValueFormat.format(value);
    }
}
