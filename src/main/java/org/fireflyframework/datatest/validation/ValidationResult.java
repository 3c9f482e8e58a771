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

import lombok.EqualsAndHashCode;
import org.fireflyframework.datatest.difference.Difference;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a validation: either success or a {@link ValidationFailure}.
 */
@EqualsAndHashCode
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(null);

    private final ValidationFailure failure;

    private ValidationResult(ValidationFailure failure) {
        this.failure = failure;
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(ValidationFailure failure) {
        return new ValidationResult(failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    public Optional<ValidationFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Returns the differences found, empty on success.
     *
     * @return the ordered differences
     */
    public List<Difference> getDifferences() {
        return failure == null ? List.of() : failure.getDifferences();
    }

    /**
     * Returns normally on success and throws on failure.
     *
     * @throws DataValidationFailedException if the data did not conform
     */
    public void orElseThrow() {
        if (failure != null) {
            throw new DataValidationFailedException(failure);
        }
    }

    @Override
    public String toString() {
        return failure == null ? "ValidationResult(success)" : "ValidationResult(" + failure.render() + ")";
    }
}
