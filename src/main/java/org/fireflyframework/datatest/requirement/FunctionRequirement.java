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

import org.fireflyframework.datatest.difference.Difference;
import org.fireflyframework.datatest.difference.Invalid;
import org.fireflyframework.datatest.difference.ValueFormat;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Requires an observed value to pass a function that decides the outcome itself.
 *
 * <p>The function returns {@code true} when the value is acceptable, {@code false}
 * for an {@link Invalid} difference, or a {@link Difference} which is reported as
 * is. A function that throws counts as {@code false}. Any other return value is a
 * programming error and fails the validation with a
 * {@link MalformedRequirementException}.</p>
 *
 * <pre>{@code
 * FunctionRequirement atMostTen = FunctionRequirement.of("at most 10", (Integer value) ->
 *         value <= 10 ? true : new Deviation(value, 10, value - 10));
 * }</pre>
 *
 * @param function the function applied to the observed value
 * @param name     the name used in failure messages
 */
public record FunctionRequirement(Function<Object, ?> function, String name) implements ElementRequirement {

    public FunctionRequirement {
        Objects.requireNonNull(function, "function");
        name = Objects.requireNonNullElse(name, "function");
    }

    /**
     * Creates a named requirement from a typed function. A value of another type
     * fails the cast inside the function and is reported as {@link Invalid}.
     *
     * @param name     the name used in failure messages
     * @param function the function returning a {@link Boolean} or a {@link Difference}
     * @param <T>      the expected value type
     * @return the requirement
     */
    @SuppressWarnings("unchecked")
    public static <T> FunctionRequirement of(String name, Function<? super T, ?> function) {
        return new FunctionRequirement(value -> ((Function<Object, ?>) function).apply(value), name);
    }

    /**
     * Applies the function to an observed value.
     *
     * @param observed the observed value, may be {@code null}
     * @return the difference to report, empty if the value is acceptable
     * @throws MalformedRequirementException if the function returns neither a
     *                                       {@link Boolean} nor a {@link Difference}
     */
    public Optional<Difference> evaluate(Object observed) {
        Object outcome;
        try {
            outcome = function.apply(observed);
        } catch (RuntimeException e) {
            outcome = Boolean.FALSE;
        }
        if (Boolean.TRUE.equals(outcome)) {
            return Optional.empty();
        }
        if (Boolean.FALSE.equals(outcome)) {
            return Optional.of(new Invalid(observed, this));
        }
        if (outcome instanceof Difference difference) {
            return Optional.of(difference);
        }
        throw new MalformedRequirementException("Function '" + name + "' returned " + ValueFormat.format(outcome)
                + ", should return true, false or a Difference");
    }

    @Override
    public boolean matches(Object observed) {
        return evaluate(observed).isEmpty();
    }

    @Override
    public Object expected() {
        return this;
    }

    @Override
    public String failureMessage() {
        return "does not satisfy " + name;
    }

    @Override
    public String toString() {
        return name;
    }
}
