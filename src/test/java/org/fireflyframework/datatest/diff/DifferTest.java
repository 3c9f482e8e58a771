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

import org.fireflyframework.datatest.difference.Deviation;
import org.fireflyframework.datatest.difference.Difference;
import org.fireflyframework.datatest.difference.DifferenceKind;
import org.fireflyframework.datatest.difference.Extra;
import org.fireflyframework.datatest.difference.Invalid;
import org.fireflyframework.datatest.difference.Missing;
import org.fireflyframework.datatest.match.matchers.EqualsMatcher;
import org.fireflyframework.datatest.requirement.Approx;
import org.fireflyframework.datatest.requirement.ElementRequirement;
import org.fireflyframework.datatest.requirement.EqualityRequirement;
import org.fireflyframework.datatest.requirement.FunctionRequirement;
import org.fireflyframework.datatest.requirement.MalformedRequirementException;
import org.fireflyframework.datatest.requirement.PredicateRequirement;
import org.fireflyframework.datatest.requirement.Requirement;
import org.fireflyframework.datatest.requirement.RequirementNormalizer;
import org.fireflyframework.datatest.requirement.SetRelation;
import org.fireflyframework.datatest.requirement.SetRequirement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Differ}.
 */
class DifferTest {

    private final RequirementNormalizer normalizer = new RequirementNormalizer();
    private final Differ differ = new Differ();

    private List<Difference> diff(Object rawRequirement, Object observed) {
        return differ.diff(normalizer.normalize(rawRequirement), observed);
    }

    private static Set<Object> orderedSet(Object... members) {
        return new LinkedHashSet<>(Arrays.asList(members));
    }

    // ---- single elements ----

    @Test
    void diff_equalScalar_shouldReportNothing() {
        assertThat(diff("a", "a")).isEmpty();
        assertThat(diff(1, 1.0)).isEmpty();
        assertThat(diff(null, null)).isEmpty();
    }

    @Test
    void diff_unequalScalar_shouldReportInvalid() {
        // When
        List<Difference> differences = diff("a", "b");

        // Then
        assertThat(differences).containsExactly(new Invalid("b", "a"));
    }

    @Test
    void diff_predicateScalar_shouldReportInvalidWithMatcher() {
        // When
        List<Difference> differences = diff(Pattern.compile("\\d+"), "12x");

        // Then
        assertThat(differences).hasSize(1);
        Invalid invalid = (Invalid) differences.get(0);
        assertThat(invalid.observed()).isEqualTo("12x");
        assertThat(invalid).hasToString("Invalid('12x', expected=/\\d+/)");
    }

    @Test
    void diff_absenceRequirement_shouldNotAcceptZero() {
        // When
        List<Difference> differences = diff(null, 0);

        // Then
        assertThat(differences).hasSize(1);
        assertThat(differences.get(0).kind()).isEqualTo(DifferenceKind.INVALID);
    }

    // ---- approximate ----

    @Test
    void diff_approximateOnBoundary_shouldPass() {
        assertThat(diff(Approx.of(10, 1), 11)).isEmpty();
        assertThat(diff(Approx.of(10, 1), 9)).isEmpty();
        assertThat(diff(Approx.of(0.3, 0.0), 0.3)).isEmpty();
    }

    @Test
    void diff_approximateBeyondTolerance_shouldReportDeviation() {
        // When
        List<Difference> differences = diff(Approx.of(10, 1), 11.01);

        // Then
        assertThat(differences).hasSize(1);
        Deviation deviation = (Deviation) differences.get(0);
        assertThat(deviation.delta().doubleValue()).isCloseTo(1.01, within(1e-9));
        assertThat(deviation.expected().doubleValue()).isEqualTo(10.0);
        assertThat(deviation.observed()).isEqualTo(11.01);
        assertThat(deviation).hasToString("Deviation(+1.01, 10)");
    }

    @Test
    void diff_approximateAgainstNonNumber_shouldReportInvalid() {
        // When
        List<Difference> text = diff(Approx.of(10, 1), "abc");
        List<Difference> nan = diff(Approx.of(10, 1), Double.NaN);

        // Then
        assertThat(text).extracting(Difference::kind).containsExactly(DifferenceKind.INVALID);
        assertThat(nan).extracting(Difference::kind).containsExactly(DifferenceKind.INVALID);
    }

    @Test
    void diff_percentTolerance_shouldScaleWithExpected() {
        assertThat(diff(Approx.percent(200, 0.05), 209)).isEmpty();

        List<Difference> differences = diff(Approx.percent(200, 0.05), 211);
        assertThat(differences).hasSize(1);
        assertThat(((Deviation) differences.get(0)).delta().intValue()).isEqualTo(11);
    }

    @Test
    void diff_defaultTolerance_shouldApplyToNumericLiterals() {
        // Given
        Requirement requirement = new RequirementNormalizer(0.5).normalize(List.of(10, 20));

        // When
        List<Difference> differences = differ.diff(requirement, List.of(10.4, 20.6));

        // Then
        assertThat(differences).hasSize(1);
        assertThat(differences.get(0).kind()).isEqualTo(DifferenceKind.DEVIATION);
        assertThat(((Deviation) differences.get(0)).delta().doubleValue()).isCloseTo(0.6, within(1e-9));
    }

    // ---- sets ----

    @Test
    void diff_setWithExtraElement_shouldReportOnlyExtra() {
        // When
        List<Difference> differences = diff(orderedSet("a", "b", "c"), List.of("a", "b", "c", "d"));

        // Then
        assertThat(differences).containsExactly(new Extra("d"));
    }

    @Test
    void diff_setWithMissingElement_shouldReportOnlyMissing() {
        // When
        List<Difference> differences = diff(orderedSet("a", "b", "c"), List.of("a", "b"));

        // Then
        assertThat(differences).containsExactly(new Missing("c"));
    }

    @Test
    void diff_setIgnoresObservedOrder() {
        assertThat(diff(orderedSet("a", "b", "c"), List.of("c", "a", "b"))).isEmpty();
        assertThat(diff(Set.of("a", "b"), Set.of("b", "a"))).isEmpty();
        assertThat(diff(orderedSet("a", "b"), new Object[]{"b", "a"})).isEmpty();
    }

    @Test
    void diff_set_shouldReportExtrasBeforeMissingInEncounterOrder() {
        // When
        List<Difference> differences = diff(orderedSet("a", "b", "c"), List.of("x", "a", "y"));

        // Then
        assertThat(differences).containsExactly(
                new Extra("x"), new Extra("y"), new Missing("b"), new Missing("c"));
    }

    @Test
    void diff_setWithDuplicateObserved_shouldReportSurplusAsExtra() {
        // When
        List<Difference> differences = diff(Set.of("a"), List.of("a", "a"));

        // Then
        assertThat(differences).containsExactly(new Extra("a"));
    }

    @Test
    void diff_setMembers_shouldConsumeInDeclaredOrder() {
        // Given
        Set<Object> requirement = orderedSet(Pattern.compile("a.*"), Pattern.compile("ab"));

        // When
        List<Difference> differences = diff(requirement, List.of("ab"));

        // Then
        assertThat(differences).hasSize(1);
        assertThat(differences.get(0)).hasToString("Missing(/ab/)");
    }

    @Test
    void diff_setWithNumbersAndAbsence_shouldMatchByValue() {
        // When
        List<Difference> differences = diff(orderedSet(1, 2.0, "x", null), Arrays.asList(2, 1.0, "y", null));

        // Then
        assertThat(differences).containsExactly(new Extra("y"), new Missing("x"));
    }

    @Test
    void diff_literalSet_shouldAgreeWithPredicateScan() {
        // Given
        List<Object> members = Arrays.asList(1, 2.0, "x", null, "x");
        List<Object> observed = Arrays.asList("x", 2, 1.0, "y", null, 3);
        SetRequirement literal = new SetRequirement(members.stream()
                .map(member -> (ElementRequirement) new EqualityRequirement(member))
                .toList());
        SetRequirement scanned = new SetRequirement(members.stream()
                .map(member -> (ElementRequirement) new PredicateRequirement(new EqualsMatcher(member)))
                .toList());

        // When
        List<Difference> byHash = differ.diff(literal, observed);
        List<Difference> byScan = differ.diff(scanned, observed);

        // Then
        assertThat(byHash).hasToString(byScan.toString());
        assertThat(byHash).hasToString("[Extra('y'), Extra(3), Missing('x')]");
    }

    @Test
    void diff_setWithNaN_shouldNeverMatch() {
        // When
        List<Difference> differences = diff(orderedSet(Double.NaN), List.of(Double.NaN));

        // Then
        assertThat(differences).extracting(Difference::kind)
                .containsExactly(DifferenceKind.EXTRA, DifferenceKind.MISSING);
    }

    @Test
    void diff_subset_shouldReportOnlyExtras() {
        // Given
        SetRequirement requirement = ((SetRequirement) normalizer.normalize(orderedSet("a", "b", "c")))
                .withRelation(SetRelation.SUBSET);

        // When & Then
        assertThat(differ.diff(requirement, List.of("a", "d"))).containsExactly(new Extra("d"));
        assertThat(differ.diff(requirement, List.of("a"))).isEmpty();
    }

    @Test
    void diff_superset_shouldReportOnlyMissing() {
        // Given
        SetRequirement requirement = ((SetRequirement) normalizer.normalize(orderedSet("a", "b", "c")))
                .withRelation(SetRelation.SUPERSET);

        // When & Then
        assertThat(differ.diff(requirement, List.of("a", "b", "c", "d"))).isEmpty();
        assertThat(differ.diff(requirement, List.of("a"))).containsExactly(new Missing("b"), new Missing("c"));
    }

    @Test
    void diff_setOfRows_shouldCompareRowsAsAtoms() {
        // Given
        Set<Object> requirement = orderedSet(List.of("a", 1), List.of("b", 2));

        // When
        List<Difference> differences = diff(requirement, List.of(List.of("b", 2), List.of("a", 3)));

        // Then
        assertThat(differences).containsExactly(new Extra(List.of("a", 3)), new Missing(List.of("a", 1)));
    }

    // ---- sequences ----

    @Test
    void diff_sequenceOutOfOrder_shouldReportPositionalInvalids() {
        // When
        List<Difference> differences = diff(List.of("a", "b", "c"), List.of("a", "c", "b"));

        // Then
        assertThat(differences).containsExactly(new Invalid("c", "b"), new Invalid("b", "c"));
    }

    @Test
    void diff_sequenceLengthMismatch_shouldReportTail() {
        assertThat(diff(List.of("a", "b", "c"), List.of("a")))
                .containsExactly(new Missing("b"), new Missing("c"));
        assertThat(diff(List.of("a"), List.of("a", "x", "y")))
                .containsExactly(new Extra("x"), new Extra("y"));
    }

    @Test
    void diff_sequenceOfApproximates_shouldReportDeviationAtPosition() {
        // When
        List<Difference> differences = diff(List.of(Approx.of(1, 0.1), Approx.of(2, 0.1)), List.of(1.05, 2.5));

        // Then
        assertThat(differences).hasSize(1);
        Deviation deviation = (Deviation) differences.get(0);
        assertThat(deviation.observed()).isEqualTo(2.5);
        assertThat(deviation.delta().doubleValue()).isCloseTo(0.5, within(1e-9));
    }

    // ---- functions ----

    private static final FunctionRequirement AT_MOST_TEN = FunctionRequirement.<Integer>of("at most 10",
            value -> value <= 10 ? Boolean.TRUE : new Deviation(value, 10, value - 10));

    @Test
    void diff_functionReturningDifference_shouldReportItAsIs() {
        // When
        List<Difference> differences = diff(AT_MOST_TEN, 12);

        // Then
        assertThat(differences).containsExactly(new Deviation(12, 10, 2));
        assertThat(diff(AT_MOST_TEN, 7)).isEmpty();
    }

    @Test
    void diff_functionReturningFalseOrThrowing_shouldReportInvalid() {
        // Given
        FunctionRequirement even = FunctionRequirement.<Integer>of("even", value -> value % 2 == 0);

        // When & Then
        assertThat(diff(even, 3)).containsExactly(new Invalid(3, even));
        assertThat(diff(even, "x")).containsExactly(new Invalid("x", even));
        assertThat(diff(AT_MOST_TEN, "x").get(0).toString()).isEqualTo("Invalid('x', expected=at most 10)");
    }

    @Test
    void diff_functionReturningOtherValue_shouldBeMalformed() {
        // Given
        FunctionRequirement broken = FunctionRequirement.of("broken", value -> "yes");

        // When & Then
        assertThatThrownBy(() -> diff(broken, 1))
                .isInstanceOf(MalformedRequirementException.class)
                .hasMessageContaining("'broken' returned 'yes'");
    }

    @Test
    void diff_functionInSequenceAndGroups_shouldKeepPositionAndKey() {
        // When & Then
        assertThat(diff(List.of(AT_MOST_TEN, AT_MOST_TEN), List.of(5, 12)))
                .containsExactly(new Deviation(12, 10, 2));
        assertThat(diff(Map.of("a", AT_MOST_TEN), Map.of("a", 12)))
                .containsExactly(new Deviation(12, 10, 2, "a"));
    }

    // ---- shape mismatches ----

    @Test
    void diff_elementAgainstCollection_shouldFailWithShapeMismatch() {
        assertThatThrownBy(() -> diff("abc", List.of("abc")))
                .isInstanceOfSatisfying(ShapeMismatchException.class,
                        e -> assertThat(e.getObservedShape()).isEqualTo(ObservedShape.ORDERED));
    }

    @Test
    void diff_collectionAgainstScalar_shouldFailWithShapeMismatch() {
        assertThatThrownBy(() -> diff(Set.of("a"), "a"))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessage("SetRequirement cannot be compared against scalar data");
        assertThatThrownBy(() -> diff(List.of("a"), "a"))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void diff_sequenceAgainstUnorderedData_shouldFailWithShapeMismatch() {
        assertThatThrownBy(() -> diff(List.of("a", "b"), Set.of("a", "b")))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("unordered");
    }

    @Test
    void diff_mappingAgainstUngroupedData_shouldFailWithShapeMismatch() {
        assertThatThrownBy(() -> diff(Map.of("x", 1), List.of(1)))
                .isInstanceOf(ShapeMismatchException.class);
    }
}
