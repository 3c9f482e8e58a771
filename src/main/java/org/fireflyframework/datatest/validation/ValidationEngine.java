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

package org.fireflyframework.datatest.validation;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.datatest.diff.Differ;
import org.fireflyframework.datatest.difference.Difference;
import org.fireflyframework.datatest.event.DataValidationEvent;
import org.fireflyframework.datatest.requirement.Requirement;
import org.fireflyframework.datatest.requirement.RequirementNormalizer;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Entry point that validates observed data against a raw requirement.
 *
 * <p>{@link #validate(Object, Object)} normalizes the requirement, computes every
 * difference in one pass and returns a {@link ValidationResult}. It is pure: it
 * does not log, publish or modify its input, and usage errors
 * ({@link org.fireflyframework.datatest.requirement.MalformedRequirementException},
 * {@link org.fireflyframework.datatest.diff.ShapeMismatchException}) abort the call
 * without a partial result.</p>
 *
 * <p>{@link #evaluate(Object, Object)} is the reactive variant. When an
 * {@link ApplicationEventPublisher} is provided, a {@link DataValidationEvent} is
 * published after each evaluation for observability.</p>
 *
 * <pre>{@code
 * ValidationEngine engine = new ValidationEngine();
 * ValidationResult result = engine.validate(
 *     Map.of("x", List.of(1, 2), "z", List.of(9)),
 *     Map.of("x", Set.of(1, 2), "y", Set.of(3)));
 * // Missing(3, key='y'), Extra(9, key='z')
 * }</pre>
 */
@Slf4j
public class ValidationEngine {

    private final RequirementNormalizer normalizer;
    private final Differ differ;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates an engine with exact numeric comparison and no event publishing.
     */
    public ValidationEngine() {
        this(new RequirementNormalizer(), null);
    }

    /**
     * Creates an engine with the given normalizer and no event publishing.
     *
     * @param normalizer the requirement normalizer
     */
    public ValidationEngine(RequirementNormalizer normalizer) {
        this(normalizer, null);
    }

    /**
     * Creates an engine with the given normalizer and optional event publisher.
     *
     * @param normalizer     the requirement normalizer
     * @param eventPublisher the event publisher, or {@code null} to disable event publishing
     */
    public ValidationEngine(RequirementNormalizer normalizer, ApplicationEventPublisher eventPublisher) {
        this.normalizer = normalizer;
        this.differ = new Differ();
        this.eventPublisher = eventPublisher;
    }

    /**
     * Validates observed data using the normalizer's default tolerance.
     *
     * @param observed       a scalar, collection or map of groups
     * @param rawRequirement the raw requirement or a normalized {@link Requirement}
     * @return success, or a failure carrying every difference
     */
    public ValidationResult validate(Object observed, Object rawRequirement) {
        return compare(observed, normalizer.normalize(rawRequirement));
    }

    /**
     * Validates observed data, treating numeric literals in the requirement as
     * approximate within {@code defaultTolerance}.
     *
     * @param observed         a scalar, collection or map of groups
     * @param rawRequirement   the raw requirement
     * @param defaultTolerance the tolerance for numeric literals, {@code 0} for exact comparison
     * @return success, or a failure carrying every difference
     */
    public ValidationResult validate(Object observed, Object rawRequirement, Number defaultTolerance) {
        return compare(observed, normalizer.withDefaultTolerance(defaultTolerance).normalize(rawRequirement));
    }

    /**
     * Reactive variant of {@link #validate(Object, Object)}. Usage errors are
     * signalled as {@link Mono#error(Throwable)}.
     *
     * @param observed       a scalar, collection or map of groups
     * @param rawRequirement the raw requirement
     * @return a {@link Mono} emitting the {@link ValidationResult}
     */
    public Mono<ValidationResult> evaluate(Object observed, Object rawRequirement) {
        return Mono.fromCallable(() -> validate(observed, rawRequirement))
                .doOnNext(this::logResult)
                .doOnNext(this::publishEvent);
    }

    public RequirementNormalizer getNormalizer() {
        return normalizer;
    }

    private ValidationResult compare(Object observed, Requirement requirement) {
        List<Difference> differences = differ.diff(requirement, observed);
        if (differences.isEmpty()) {
            return ValidationResult.success();
        }
        return ValidationResult.failure(new ValidationFailure(requirement.failureMessage(), differences));
    }

    private void logResult(ValidationResult result) {
        if (result.isSuccess()) {
            log.debug("Validation passed");
        } else {
            log.debug("Validation failed with {} differences", result.getDifferences().size());
        }
    }

    private void publishEvent(ValidationResult result) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new DataValidationEvent(result));
        }
    }
}
