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

/**
 * Tolerance annotation for raw requirements: "approximately {@code expected}".
 *
 * <p>The annotation is checked when it is normalized, not when it is created, so a
 * negative tolerance surfaces as a {@link MalformedRequirementException} from
 * {@link RequirementNormalizer#normalize(Object)}.</p>
 *
 * <pre>{@code
 * Map<String, Object> totals = Map.of(
 *     "north", Approx.of(1250.0, 0.5),
 *     "south", Approx.percent(980, 0.02));
 * }</pre>
 *
 * @param expected  the expected number
 * @param tolerance the tolerance
 * @param mode      how the tolerance is interpreted
 */
public record Approx(Number expected, Number tolerance, ToleranceMode mode) {

    /**
     * Annotates {@code expected} with an absolute tolerance.
     *
     * @param expected  the expected number
     * @param tolerance the largest allowed absolute deviation
     * @return the annotation
     */
    public static Approx of(Number expected, Number tolerance) {
        return new Approx(expected, tolerance, ToleranceMode.ABSOLUTE);
    }

    /**
     * Annotates {@code expected} with a tolerance relative to its magnitude,
     * e.g. {@code 0.05} for five percent.
     *
     * @param expected the expected number
     * @param fraction the allowed deviation as a fraction of {@code |expected|}
     * @return the annotation
     */
    public static Approx percent(Number expected, Number fraction) {
        return new Approx(expected, fraction, ToleranceMode.PERCENT);
    }

    ApproximateRequirement toRequirement() {
        return ApproximateRequirement.of(expected, tolerance, mode);
    }
}
