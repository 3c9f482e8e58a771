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

package org.fireflyframework.datatest.difference;

import org.fireflyframework.datatest.Absent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link Difference} value types and their rendering.
 */
class DifferenceTest {

    @Test
    void toString_shouldRenderEachKindStably() {
        assertThat(new Missing("c")).hasToString("Missing('c')");
        assertThat(new Extra(9, "z")).hasToString("Extra(9, key='z')");
        assertThat(new Invalid("aaa", "bbb")).hasToString("Invalid('aaa', expected='bbb')");
        assertThat(new Deviation(11.01, new BigDecimal("10"), new BigDecimal("1.01")))
                .hasToString("Deviation(+1.01, 10)");
        assertThat(new Deviation(8, 10, new BigDecimal("-2.00"), "k"))
                .hasToString("Deviation(-2, 10, key='k')");
    }

    @Test
    void withKey_shouldKeepKindAndPayload() {
        // Given
        Difference missing = new Missing(3);

        // When
        Difference keyed = missing.withKey("y");

        // Then
        assertThat(keyed).isEqualTo(new Missing(3, "y"));
        assertThat(keyed.kind()).isEqualTo(DifferenceKind.MISSING);
        assertThat(missing.key()).isNull();
    }

    @Test
    void equals_shouldCompareByValue() {
        assertThat(new Extra("d")).isEqualTo(new Extra("d")).hasSameHashCodeAs(new Extra("d"));
        assertThat(new Extra("d")).isNotEqualTo(new Extra("d", "k"));
        assertThat(new Extra("d")).isNotEqualTo(new Missing("d"));
    }

    @Test
    void format_shouldRenderContainersAndMarkers() {
        assertThat(ValueFormat.format(List.of("a", 1))).isEqualTo("['a', 1]");
        assertThat(ValueFormat.format(Map.of("k", 'v'))).isEqualTo("{'k': 'v'}");
        assertThat(ValueFormat.format(new int[]{1, 2})).isEqualTo("[1, 2]");
        assertThat(ValueFormat.format(null)).isEqualTo("null");
        assertThat(ValueFormat.format(Absent.VALUE)).isEqualTo("Absent");
        assertThat(ValueFormat.format(new BigDecimal("2.500"))).isEqualTo("2.5");
        assertThat(ValueFormat.formatSigned(new BigDecimal("0"))).isEqualTo("+0");
    }
}
