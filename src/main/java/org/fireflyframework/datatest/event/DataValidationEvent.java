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

package org.fireflyframework.datatest.event;

import lombok.Data;
import org.fireflyframework.datatest.difference.DifferenceKind;
import org.fireflyframework.datatest.validation.ValidationFailure;
import org.fireflyframework.datatest.validation.ValidationResult;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Event published by the {@link org.fireflyframework.datatest.validation.ValidationEngine}
 * after a reactive evaluation.
 *
 * <p>Besides the full result, the event carries a per-kind summary so listeners such
 * as metrics or audit sinks need not walk the differences. Every
 * {@link DifferenceKind} is present in {@link #getCounts()}, zero on success.</p>
 */
@Data
public class DataValidationEvent {

    private final ValidationResult result;
    private final boolean passed;
    private final String failureMessage;
    private final int differenceCount;
    private final Map<DifferenceKind, Integer> counts;
    private final Instant timestamp;

    public DataValidationEvent(ValidationResult result) {
        this.result = result;
        this.passed = result.isSuccess();
        this.failureMessage = result.getFailure().map(ValidationFailure::getMessage).orElse(null);
        this.differenceCount = result.getDifferences().size();
        this.counts = result.getFailure().map(ValidationFailure::getCounts).orElseGet(DataValidationEvent::noDifferences);
        this.timestamp = Instant.now();
    }

    private static Map<DifferenceKind, Integer> noDifferences() {
        Map<DifferenceKind, Integer> counts = new EnumMap<>(DifferenceKind.class);
        for (DifferenceKind kind : DifferenceKind.values()) {
            counts.put(kind, 0);
        }
        return Collections.unmodifiableMap(counts);
    }
}
