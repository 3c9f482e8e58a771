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

import org.fireflyframework.datatest.event.DataValidationEvent;
import org.fireflyframework.datatest.requirement.RequirementNormalizer;
import org.fireflyframework.datatest.validation.ValidationEngine;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DataValidationAutoConfiguration}.
 */
class DataValidationAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DataValidationAutoConfiguration.class));

    @Test
    void autoConfiguration_defaults_shouldCreateExactEngine() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ValidationEngine.class);
            assertThat(context).hasSingleBean(RequirementNormalizer.class);
            assertThat(context.getBean(RequirementNormalizer.class).getDefaultTolerance()).isZero();
            assertThat(context.getBean(ValidationEngine.class).validate(10.4, 10).isFailure()).isTrue();
        });
    }

    @Test
    void autoConfiguration_defaultTolerance_shouldApplyToEngine() {
        contextRunner
                .withPropertyValues("firefly.data.validation.default-tolerance=0.5")
                .run(context -> {
                    ValidationEngine engine = context.getBean(ValidationEngine.class);
                    assertThat(engine.getNormalizer().getDefaultTolerance()).isEqualByComparingTo("0.5");
                    assertThat(engine.validate(10.4, 10).isSuccess()).isTrue();
                });
    }

    @Test
    void autoConfiguration_disabled_shouldNotCreateBeans() {
        contextRunner
                .withPropertyValues("firefly.data.validation.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ValidationEngine.class);
                    assertThat(context).doesNotHaveBean(DataValidationProperties.class);
                });
    }

    @Test
    void autoConfiguration_negativeTolerance_shouldFailStartup() {
        contextRunner
                .withPropertyValues("firefly.data.validation.default-tolerance=-1")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void autoConfiguration_userEngine_shouldBackOff() {
        contextRunner
                .withUserConfiguration(CustomEngineConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(ValidationEngine.class);
                    assertThat(context.getBean(ValidationEngine.class))
                            .isSameAs(context.getBean(CustomEngineConfiguration.class).engine);
                });
    }

    @Test
    void autoConfiguration_publishEvents_shouldReachListeners() {
        contextRunner
                .withUserConfiguration(ListenerConfiguration.class)
                .run(context -> {
                    context.getBean(ValidationEngine.class).evaluate(Map.of("a", 1), Map.of("a", 2)).block();
                    assertThat(context.getBean(RecordingListener.class).events).hasSize(1);
                });
    }

    @Test
    void autoConfiguration_publishEventsDisabled_shouldStayQuiet() {
        contextRunner
                .withUserConfiguration(ListenerConfiguration.class)
                .withPropertyValues("firefly.data.validation.publish-events=false")
                .run(context -> {
                    context.getBean(ValidationEngine.class).evaluate(Map.of("a", 1), Map.of("a", 2)).block();
                    assertThat(context.getBean(RecordingListener.class).events).isEmpty();
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomEngineConfiguration {

        final ValidationEngine engine = new ValidationEngine();

        @Bean
        ValidationEngine customValidationEngine() {
            return engine;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ListenerConfiguration {

        @Bean
        RecordingListener recordingListener() {
            return new RecordingListener();
        }
    }

    static class RecordingListener {

        final List<DataValidationEvent> events = new ArrayList<>();

        @EventListener
        public void onValidation(DataValidationEvent event) {
            events.add(event);
        }
    }
}
