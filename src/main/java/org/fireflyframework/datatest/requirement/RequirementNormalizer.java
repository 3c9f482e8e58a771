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

import org.fireflyframework.datatest.difference.ValueFormat;
import org.fireflyframework.datatest.match.NumericValues;
import org.fireflyframework.datatest.match.PredicateMatchers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.BaseStream;

/**
 * Converts raw requirements into typed {@link Requirement} trees.
 *
 * <p>Raw requirements are dispatched on their shape:</p>
 * <ul>
 *   <li>a {@link Requirement} is returned unchanged</li>
 *   <li>an {@link Approx} annotation becomes an {@link ApproximateRequirement}</li>
 *   <li>a {@link Map} becomes a {@link MappingRequirement}, normalizing each value</li>
 *   <li>a {@link Set} becomes a {@link SetRequirement} of element requirements</li>
 *   <li>a {@link List}, any other {@link Collection} or an {@code Object[]} becomes a
 *       {@link SequenceRequirement} of element requirements</li>
 *   <li>a {@link Function} becomes a {@link FunctionRequirement}</li>
 *   <li>anything else becomes an element requirement per {@link PredicateMatchers#of(Object)}</li>
 * </ul>
 *
 * <p>Set members and sequence items are normalized as single elements: a nested
 * collection there is a literal row compared by equality. Strings and primitive
 * arrays are always single elements.</p>
 *
 * <p>When a default tolerance greater than zero is configured, finite numeric
 * literals are normalized into {@link ApproximateRequirement}s with that tolerance.</p>
 *
 * <p>Normalization either returns a complete tree or throws
 * {@link MalformedRequirementException}; it never returns a partial tree.</p>
 */
public class RequirementNormalizer {

    private final BigDecimal defaultTolerance;

    /**
     * Creates a normalizer that keeps numeric literals as exact equality requirements.
     */
    public RequirementNormalizer() {
        this(BigDecimal.ZERO);
    }

    /**
     * Creates a normalizer with the given default tolerance for numeric literals.
     *
     * @param defaultTolerance the tolerance, {@code 0} for exact comparison
     * @throws MalformedRequirementException if the tolerance is negative or not finite
     */
    public RequirementNormalizer(Number defaultTolerance) {
        if (defaultTolerance == null || !NumericValues.isFinite(defaultTolerance)) {
            throw new MalformedRequirementException(
                    "Default tolerance must be a finite number, got " + ValueFormat.format(defaultTolerance));
        }
        BigDecimal tolerance = NumericValues.toBigDecimal(defaultTolerance);
        if (tolerance.signum() < 0) {
            throw new MalformedRequirementException(
                    "Default tolerance must not be negative, got " + ValueFormat.format(tolerance));
        }
        this.defaultTolerance = tolerance;
    }

    public BigDecimal getDefaultTolerance() {
        return defaultTolerance;
    }

    /**
     * Returns a normalizer with a different default tolerance.
     *
     * @param tolerance the default tolerance
     * @return this normalizer if the tolerance is unchanged, otherwise a new one
     */
    public RequirementNormalizer withDefaultTolerance(Number tolerance) {
        RequirementNormalizer other = new RequirementNormalizer(tolerance);
        return other.defaultTolerance.compareTo(defaultTolerance) == 0 ? this : other;
    }

    /**
     * Normalizes a raw requirement.
     *
     * @param raw the raw requirement, may be {@code null} (requires absence)
     * @return the requirement tree
     * @throws MalformedRequirementException if the requirement cannot be normalized
     */
    public Requirement normalize(Object raw) {
        if (raw instanceof Requirement requirement) {
            return requirement;
        }
        if (raw instanceof Map<?, ?> map) {
            return normalizeMapping(map);
        }
        if (raw instanceof Set<?> set) {
            return new SetRequirement(normalizeElements(set));
        }
        if (raw instanceof Collection<?> collection) {
            return new SequenceRequirement(normalizeElements(collection));
        }
        if (raw instanceof Object[] array) {
            return new SequenceRequirement(normalizeElements(Arrays.asList(array)));
        }
        return normalizeElement(raw);
    }

    /**
     * Normalizes a raw atom into a requirement on a single value.
     *
     * @param raw the raw atom
     * @return the element requirement
     * @throws MalformedRequirementException if the atom cannot be used as an element requirement
     */
    public ElementRequirement normalizeElement(Object raw) {
        if (raw instanceof ElementRequirement element) {
            return element;
        }
        if (raw instanceof Requirement requirement) {
            throw new MalformedRequirementException(
                    requirement.getClass().getSimpleName() + " cannot be used as a single element requirement");
        }
        if (raw instanceof Approx approx) {
            return approx.toRequirement();
        }
        if (raw instanceof BaseStream<?, ?> || raw instanceof Iterator<?>) {
            throw new MalformedRequirementException(
                    "Single-use " + raw.getClass().getSimpleName()
                            + " cannot be a requirement; materialize it into a collection first");
        }
        if (raw instanceof Number number && defaultTolerance.signum() > 0 && NumericValues.isFinite(number)) {
            return ApproximateRequirement.of(number, defaultTolerance);
        }
        if (raw instanceof Function<?, ?>) {
            @SuppressWarnings("unchecked")
            Function<Object, ?> function = (Function<Object, ?>) raw;
            return new FunctionRequirement(function, "function");
        }
        if (PredicateMatchers.isLiteral(raw)) {
            return new EqualityRequirement(raw);
        }
        return new PredicateRequirement(PredicateMatchers.of(raw));
    }

    private List<ElementRequirement> normalizeElements(Collection<?> raw) {
        List<ElementRequirement> elements = new ArrayList<>(raw.size());
        for (Object item : raw) {
            elements.add(normalizeElement(item));
        }
        return elements;
    }

    private MappingRequirement normalizeMapping(Map<?, ?> raw) {
        Map<Object, Requirement> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            entries.put(entry.getKey(), normalizeGroup(entry.getKey(), entry.getValue()));
        }
        return new MappingRequirement(entries);
    }

    private Requirement normalizeGroup(Object key, Object raw) {
        if (raw instanceof Map<?, ?> || raw instanceof MappingRequirement) {
            throw new MalformedRequirementException(
                    "Requirement for group " + ValueFormat.format(key) + " must not be a nested mapping");
        }
        try {
            return normalize(raw);
        } catch (MalformedRequirementException e) {
            throw new MalformedRequirementException(
                    "Requirement for group " + ValueFormat.format(key) + " cannot be normalized: " + e.getMessage(), e);
        }
    }
}
