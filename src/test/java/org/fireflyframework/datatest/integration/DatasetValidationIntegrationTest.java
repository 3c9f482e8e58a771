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

package org.fireflyframework.datatest.integration;

import org.fireflyframework.datatest.difference.Deviation;
import org.fireflyframework.datatest.difference.DifferenceKind;
import org.fireflyframework.datatest.difference.Extra;
import org.fireflyframework.datatest.difference.Missing;
import org.fireflyframework.datatest.match.PredicateMatchers;
import org.fireflyframework.datatest.requirement.Approx;
import org.fireflyframework.datatest.validation.DataValidationFailedException;
import org.fireflyframework.datatest.validation.ValidationEngine;
import org.fireflyframework.datatest.validation.ValidationResult;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Integration tests that validate a small in-memory sales dataset the way a
 * loader would hand it over: rows materialized into collections and grouped
 * into maps by a key column.
 */
class DatasetValidationIntegrationTest {

    record SaleRecord(String region, String category, String sku, BigDecimal amount) {}

    private static final List<SaleRecord> SALES = List.of(
            new SaleRecord("east", "hardware", "HW-0001", new BigDecimal("120.00")),
            new SaleRecord("east", "software", "SW-0002", new BigDecimal("80.50")),
            new SaleRecord("west", "hardware", "HW-0003", new BigDecimal("99.99")),
            new SaleRecord("west", "services", "SV-0004", new BigDecimal("300.00")),
            new SaleRecord("north", "software", "SW-0005", new BigDecimal("45.25")));

    private final ValidationEngine engine = new ValidationEngine();

    private static Map<String, List<String>> categoriesByRegion() {
        return SALES.stream().collect(Collectors.groupingBy(SaleRecord::region, TreeMap::new,
                Collectors.mapping(SaleRecord::category, Collectors.toList())));
    }

    private static Map<String, BigDecimal> totalsByRegion() {
        return SALES.stream().collect(Collectors.groupingBy(SaleRecord::region, TreeMap::new,
                Collectors.reducing(BigDecimal.ZERO, SaleRecord::amount, BigDecimal::add)));
    }

    @Test
    void categories_allowedSet_shouldPass() {
        // Given
        List<String> categories = SALES.stream().map(SaleRecord::category).distinct().toList();

        // When
        ValidationResult result = engine.validate(categories, Set.of("hardware", "software", "services"));

        // Then
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void skus_formatPredicate_shouldApplyToEveryRow() {
        // Given
        Map<String, String> skus = SALES.stream()
                .collect(Collectors.toMap(SaleRecord::sku, SaleRecord::sku));

        // When
        ValidationResult result = engine.validate(skus, Pattern.compile("[A-Z]{2}-\\d{4}"));

        // Then
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void categoriesPerRegion_unexpectedAndMissingGroups_shouldBeReportedWithKeys() {
        // Given
        Map<String, Object> requirement = Map.of(
                "east", Set.of("hardware", "software"),
                "west", Set.of("hardware"),
                "south", Set.of("services"));

        // When
        ValidationResult result = engine.validate(categoriesByRegion(), requirement);

        // Then
        assertThat(result.isFailure()).isTrue();
        assertThat(result.getDifferences()).containsExactly(
                new Extra("software", "north"),
                new Missing("services", "south"),
                new Extra("services", "west"));
        assertThat(result.getFailure().orElseThrow().count(DifferenceKind.EXTRA)).isEqualTo(2);
    }

    @Test
    void totalsPerRegion_withinTolerance_shouldPass() {
        // Given
        Map<String, Object> requirement = Map.of(
                "east", Approx.of(200, 1),
                "west", Approx.of(400, 1),
                "north", Approx.percent(45, 0.01));

        // When & Then
        StepVerifier.create(engine.evaluate(totalsByRegion(), requirement))
                .assertNext(result -> assertThat(result.isSuccess()).isTrue())
                .verifyComplete();
    }

    @Test
    void totalsPerRegion_outsideTolerance_shouldReportDeviation() {
        // Given
        Map<String, Object> requirement = Map.of("east", 200, "west", 400, "north", 45);

        // When
        ValidationResult result = engine.validate(totalsByRegion(), requirement, 0.25);

        // Then
        assertThat(result.getDifferences()).hasSize(1);
        Deviation deviation = (Deviation) result.getDifferences().get(0);
        assertThat(deviation.key()).isEqualTo("east");
        assertThat(deviation.delta().doubleValue()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void amounts_customPredicate_shouldFailFastThroughOrElseThrow() {
        // Given
        List<BigDecimal> amounts = SALES.stream().map(SaleRecord::amount).toList();
        Object positiveUnder250 = PredicateMatchers.<BigDecimal>named("amount in (0, 250)",
                amount -> amount.signum() > 0 && amount.compareTo(new BigDecimal("250")) < 0);
        List<Object> requirement = List.of(positiveUnder250, positiveUnder250, positiveUnder250,
                positiveUnder250, positiveUnder250);

        // When & Then
        assertThatThrownBy(() -> engine.validate(amounts, requirement).orElseThrow())
                .isInstanceOf(DataValidationFailedException.class)
                .hasMessageContaining("data does not match sequence order (1 difference:")
                .hasMessageContaining("Invalid(300, expected=amount in (0, 250))");
    }
}
