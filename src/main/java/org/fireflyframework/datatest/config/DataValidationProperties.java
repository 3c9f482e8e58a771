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

package org.fireflyframework.datatest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Configuration properties for the data validation engine.
 *
 * <pre>{@code
 * firefly:
 *   data:
 *     validation:
 *       enabled: true
 *       default-tolerance: 0.01
 *       publish-events: true
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.data.validation")
public class DataValidationProperties {

    /**
     * Whether the validation engine is configured.
     */
    private boolean enabled = true;

    /**
     * Tolerance applied to numeric literals in requirements; 0 compares exactly.
     */
    private BigDecimal defaultTolerance = BigDecimal.ZERO;

    /**
     * Whether reactive evaluations publish a DataValidationEvent.
     */
    private boolean publishEvents = true;
}
