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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.datatest.requirement.RequirementNormalizer;
import org.fireflyframework.datatest.validation.ValidationEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the data validation engine.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link RequirementNormalizer} with the configured default tolerance</li>
 *   <li>{@link ValidationEngine} wired to the normalizer</li>
 *   <li>Event publishing for validation results (when enabled and an
 *       {@link ApplicationEventPublisher} is available)</li>
 * </ul>
 *
 * <p>The configuration is activated when the property
 * {@code firefly.data.validation.enabled} is true or not set.</p>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DataValidationProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.data.validation",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class DataValidationAutoConfiguration {

    /**
     * Creates the requirement normalizer bean.
     *
     * @param properties the validation properties
     * @return the normalizer
     */
    @Bean
    @ConditionalOnMissingBean
    public RequirementNormalizer requirementNormalizer(DataValidationProperties properties) {
        log.info("Configuring requirement normalizer with default tolerance {}", properties.getDefaultTolerance());
        return new RequirementNormalizer(properties.getDefaultTolerance());
    }

    /**
     * Creates the validation engine bean.
     *
     * <p>The {@link ApplicationEventPublisher} is only handed to the engine when
     * {@code firefly.data.validation.publish-events} is true.</p>
     *
     * @param normalizer     the requirement normalizer
     * @param properties     the validation properties
     * @param eventPublisher the event publisher, or {@code null} if unavailable
     * @return the configured validation engine
     */
    @Bean
    @ConditionalOnMissingBean
    public ValidationEngine validationEngine(
            RequirementNormalizer normalizer,
            DataValidationProperties properties,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        ApplicationEventPublisher publisher = properties.isPublishEvents() ? eventPublisher : null;
        log.info("Configuring Data Validation Engine (event publishing {})",
                publisher != null ? "enabled" : "disabled");
        return new ValidationEngine(normalizer, publisher);
    }
}
