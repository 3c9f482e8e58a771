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
import lombok.Getter;
import org.fireflyframework.datatest.difference.Difference;
import org.fireflyframework.datatest.difference.DifferenceKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The "data does not conform" outcome of a validation.
 *
 * <p>Carries the complete, ordered list of differences found in one pass, a count
 * per {@link DifferenceKind} (every kind is present, zero when unused), and the
 * failure clause of the requirement that was checked.</p>
 */
@Getter
@EqualsAndHashCode
public class ValidationFailure {

    private final String message;
    private final List<Difference> differences;
    private final Map<DifferenceKind, Integer> counts;

    /**
     * Creates a failure from a non-empty list of differences.
     *
     * @param message     the failure clause, e.g. {@code "does not satisfy set membership"}
     * @param differences the differences in the order they were found
     */
    public ValidationFailure(String message, List<Difference> differences) {
        if (differences.isEmpty()) {
            throw new IllegalArgumentException("A validation failure needs at least one difference");
        }
        this.message = message;
        this.differences = List.copyOf(differences);
        this.counts = Collections.unmodifiableMap(countByKind(this.differences));
    }

    /**
     * Returns the number of differences of the given kind.
     *
     * @param kind the difference kind
     * @return the count, zero if none
     */
    public int count(DifferenceKind kind) {
        return counts.get(kind);
    }

    /**
     * Returns only the differences of the given kind, in the order they were found.
     *
     * @param kind the difference kind
     * @return the matching differences
     */
    public List<Difference> getByKind(DifferenceKind kind) {
        return differences.stream()
                .filter(difference -> difference.kind() == kind)
                .toList();
    }

    /**
     * Renders this failure as stable, human-readable text: a summary line followed
     * by one line per difference. Lines are separated by {@code \n} on every platform.
     *
     * @return the rendered failure
     */
    public String render() {
        StringBuilder text = new StringBuilder("data ")
                .append(message)
                .append(" (")
                .append(differences.size())
                .append(differences.size() == 1 ? " difference: " : " differences: ");
        DifferenceKind[] kinds = DifferenceKind.values();
        for (int i = 0; i < kinds.length; i++) {
            if (i > 0) {
                text.append(", ");
            }
            text.append(counts.get(kinds[i])).append(' ').append(kinds[i].name().toLowerCase(Locale.ROOT));
        }
        text.append("):");
        for (Difference difference : differences) {
            text.append('\n').append("  ").append(difference);
        }
        return text.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    private static Map<DifferenceKind, Integer> countByKind(List<Difference> differences) {
        Map<DifferenceKind, Integer> counts = new EnumMap<>(DifferenceKind.class);
        for (DifferenceKind kind : DifferenceKind.values()) {
            counts.put(kind, 0);
        }
        for (Difference difference : differences) {
            counts.merge(difference.kind(), 1, Integer::sum);
        }
        return counts;
    }
}
