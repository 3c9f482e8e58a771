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

package org.fireflyframework.datatest.diff;

import org.fireflyframework.datatest.Absent;
import org.fireflyframework.datatest.difference.Difference;
import org.fireflyframework.datatest.difference.Extra;
import org.fireflyframework.datatest.difference.Invalid;
import org.fireflyframework.datatest.difference.Missing;
import org.fireflyframework.datatest.match.NumericDeviation;
import org.fireflyframework.datatest.match.NumericValues;
import org.fireflyframework.datatest.requirement.ApproximateRequirement;
import org.fireflyframework.datatest.requirement.ElementRequirement;
import org.fireflyframework.datatest.requirement.EqualityRequirement;
import org.fireflyframework.datatest.requirement.FunctionRequirement;
import org.fireflyframework.datatest.requirement.MappingRequirement;
import org.fireflyframework.datatest.requirement.Requirement;
import org.fireflyframework.datatest.requirement.SequenceRequirement;
import org.fireflyframework.datatest.requirement.SetRequirement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the ordered differences between one requirement and the matching slice
 * of observed data.
 *
 * <p>Dispatch is on the requirement type and the {@link ObservedShape}:</p>
 * <ul>
 *   <li>element requirements against a single value yield at most one difference</li>
 *   <li>set requirements against a collection consume one observed element per
 *       member; leftovers become {@link Extra} (first-seen order) followed by
 *       {@link Missing} (declared order)</li>
 *   <li>sequence requirements against an ordered collection compare position by
 *       position, with no alignment search</li>
 *   <li>mapping requirements, and any requirement against grouped data, are handed
 *       to the {@link GroupComparator}</li>
 * </ul>
 *
 * <p>Any other combination raises {@link ShapeMismatchException}. The differ holds
 * no mutable state and can be shared freely.</p>
 */
public class Differ {

    private final GroupComparator groupComparator = new GroupComparator(this);

    /**
     * Computes the differences between a requirement and observed data.
     *
     * @param requirement the requirement
     * @param observed    a scalar, collection or map of groups; {@code null} means absent
     * @return the differences in deterministic order, empty when the data conforms
     * @throws ShapeMismatchException if the requirement cannot apply to the data's shape
     */
    public List<Difference> diff(Requirement requirement, Object observed) {
        Object value = observed == null ? Absent.VALUE : observed;
        ObservedShape shape = ObservedShape.of(value);

        if (requirement instanceof MappingRequirement mapping) {
            if (shape != ObservedShape.GROUPED) {
                throw new ShapeMismatchException(requirement, shape);
            }
            return groupComparator.diffGroups(mapping, (Map<?, ?>) value);
        }
        if (shape == ObservedShape.GROUPED) {
            return groupComparator.diffEach(requirement, (Map<?, ?>) value);
        }
        if (requirement instanceof ElementRequirement element) {
            if (shape != ObservedShape.SCALAR) {
                throw new ShapeMismatchException(requirement, shape);
            }
            return diffElement(element, value).map(List::of).orElse(List.of());
        }
        if (requirement instanceof SetRequirement set) {
            if (!shape.isCollection()) {
                throw new ShapeMismatchException(requirement, shape);
            }
            return diffSet(set, ObservedShape.elements(value));
        }
        if (requirement instanceof SequenceRequirement sequence) {
            if (shape != ObservedShape.ORDERED) {
                throw new ShapeMismatchException(requirement, shape);
            }
            return diffSequence(sequence, ObservedShape.elements(value));
        }
        throw new IllegalStateException("Unsupported requirement type: " + requirement.getClass().getName());
    }

    /**
     * Compares a single observed value against an element requirement.
     *
     * @param requirement the element requirement
     * @param observed    the observed value
     * @return an {@link Invalid} or {@code Deviation} if the value does not conform
     */
    public Optional<Difference> diffElement(ElementRequirement requirement, Object observed) {
        if (requirement instanceof ApproximateRequirement approximate) {
            return diffApproximate(approximate, observed);
        }
        if (requirement instanceof FunctionRequirement function) {
            return function.evaluate(observed);
        }
        if (requirement.matches(observed)) {
            return Optional.empty();
        }
        return Optional.of(new Invalid(observed, requirement.expected()));
    }

    private Optional<Difference> diffApproximate(ApproximateRequirement requirement, Object observed) {
        if (!(observed instanceof Number number) || NumericValues.isNaN(number)) {
            return Optional.of(new Invalid(observed, requirement.expected()));
        }
        return NumericDeviation.compare(number, requirement.expected(), requirement.allowedDeviation())
                .map(Difference.class::cast);
    }

    private List<Difference> diffSet(SetRequirement requirement, List<Object> observed) {
        boolean[] consumed = new boolean[observed.size()];
        List<ElementRequirement> unmatched = supportsHashMatching(requirement)
                ? consumeByHash(requirement, observed, consumed)
                : consumeByScan(requirement, observed, consumed);

        List<Difference> differences = new ArrayList<>();
        if (requirement.reportsExtra()) {
            for (int i = 0; i < observed.size(); i++) {
                if (!consumed[i]) {
                    differences.add(new Extra(observed.get(i)));
                }
            }
        }
        if (requirement.reportsMissing()) {
            for (ElementRequirement member : unmatched) {
                differences.add(new Missing(member.expected()));
            }
        }
        return differences;
    }

    // O(n*m): predicates cannot be hashed, so every member scans the observed elements.
    private List<ElementRequirement> consumeByScan(SetRequirement requirement, List<Object> observed,
                                                   boolean[] consumed) {
        List<ElementRequirement> unmatched = new ArrayList<>();
        for (ElementRequirement member : requirement.members()) {
            boolean found = false;
            for (int i = 0; i < observed.size() && !found; i++) {
                if (!consumed[i] && member.matches(observed.get(i))) {
                    consumed[i] = true;
                    found = true;
                }
            }
            if (!found) {
                unmatched.add(member);
            }
        }
        return unmatched;
    }

    private List<ElementRequirement> consumeByHash(SetRequirement requirement, List<Object> observed,
                                                   boolean[] consumed) {
        Map<Object, ArrayDeque<Integer>> positions = new HashMap<>();
        for (int i = 0; i < observed.size(); i++) {
            Object element = observed.get(i);
            if (!NumericValues.isNaN(element)) {
                positions.computeIfAbsent(NumericValues.canonicalKey(element), k -> new ArrayDeque<>()).add(i);
            }
        }

        List<ElementRequirement> unmatched = new ArrayList<>();
        for (ElementRequirement member : requirement.members()) {
            Object value = ((EqualityRequirement) member).value();
            ArrayDeque<Integer> candidates = NumericValues.isNaN(value)
                    ? null
                    : positions.get(NumericValues.canonicalKey(value));
            if (candidates == null || candidates.isEmpty()) {
                unmatched.add(member);
            } else {
                consumed[candidates.poll()] = true;
            }
        }
        return unmatched;
    }

    private boolean supportsHashMatching(SetRequirement requirement) {
        return requirement.isLiteralOnly() && requirement.members().stream()
                .map(member -> ((EqualityRequirement) member).value())
                .noneMatch(value -> value.getClass().isArray());
    }

    private List<Difference> diffSequence(SequenceRequirement requirement, List<Object> observed) {
        List<ElementRequirement> items = requirement.items();
        int shared = Math.min(items.size(), observed.size());

        List<Difference> differences = new ArrayList<>();
        for (int i = 0; i < shared; i++) {
            diffElement(items.get(i), observed.get(i)).ifPresent(differences::add);
        }
        for (int i = shared; i < items.size(); i++) {
            differences.add(new Missing(items.get(i).expected()));
        }
        for (int i = shared; i < observed.size(); i++) {
            differences.add(new Extra(observed.get(i)));
        }
        return differences;
    }
}
