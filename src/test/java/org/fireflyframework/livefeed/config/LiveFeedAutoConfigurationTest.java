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

package org.fireflyframework.livefeed.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.livefeed.aggregation.AggregationEngine;
import org.fireflyframework.livefeed.core.AggregateRefreshService;
import org.fireflyframework.livefeed.core.LiveAggregationService;
import org.fireflyframework.livefeed.fallback.FallbackPlanner;
import org.fireflyframework.livefeed.health.LiveFeedHealthIndicator;
import org.fireflyframework.livefeed.metrics.LiveFeedMetrics;
import org.fireflyframework.livefeed.observer.ObserverRegistry;
import org.fireflyframework.livefeed.properties.LiveFeedProperties;
import org.fireflyframework.livefeed.registry.SubscriptionRegistry;
import org.fireflyframework.livefeed.retry.RetryScheduler;
import org.fireflyframework.livefeed.store.InMemoryRemoteStore;
import org.fireflyframework.livefeed.store.RemoteStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for LiveFeedAutoConfiguration.
 */
class LiveFeedAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LiveFeedAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class StoreConfiguration {

        @Bean
        RemoteStore remoteStore() {
            return new InMemoryRemoteStore();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfiguration {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Test
    void shouldCreateAllBeansWithRemoteStore() {
        contextRunner
                .withUserConfiguration(StoreConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(FallbackPlanner.class);
                    assertThat(context).hasSingleBean(RetryScheduler.class);
                    assertThat(context).hasSingleBean(SubscriptionRegistry.class);
                    assertThat(context).hasSingleBean(AggregationEngine.class);
                    assertThat(context).hasSingleBean(ObserverRegistry.class);
                    assertThat(context).hasSingleBean(LiveAggregationService.class);
                    assertThat(context).hasSingleBean(AggregateRefreshService.class);
                    assertThat(context).hasSingleBean(LiveFeedHealthIndicator.class);
                    assertThat(context).doesNotHaveBean(LiveFeedMetrics.class);
                });
    }

    @Test
    void shouldSkipStoreDependentBeansWithoutRemoteStore() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(FallbackPlanner.class);
            assertThat(context).hasSingleBean(AggregationEngine.class);
            assertThat(context).doesNotHaveBean(SubscriptionRegistry.class);
            assertThat(context).doesNotHaveBean(LiveAggregationService.class);
            assertThat(context).doesNotHaveBean(AggregateRefreshService.class);
            assertThat(context).doesNotHaveBean(LiveFeedHealthIndicator.class);
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withUserConfiguration(StoreConfiguration.class)
                .withPropertyValues("firefly.livefeed.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(LiveFeedProperties.class);
                    assertThat(context).doesNotHaveBean(SubscriptionRegistry.class);
                    assertThat(context).doesNotHaveBean(LiveAggregationService.class);
                });
    }

    @Test
    void shouldBindProperties() {
        contextRunner
                .withUserConfiguration(StoreConfiguration.class)
                .withPropertyValues(
                        "firefly.livefeed.subscribe-timeout=3s",
                        "firefly.livefeed.refresh-interval=0s",
                        "firefly.livefeed.retry.max-attempts=7",
                        "firefly.livefeed.observer.queue-capacity=8")
                .run(context -> {
                    LiveFeedProperties properties = context.getBean(LiveFeedProperties.class);
                    assertThat(properties.getSubscribeTimeout()).isEqualTo(Duration.ofSeconds(3));
                    assertThat(properties.getRefreshInterval()).isEqualTo(Duration.ZERO);
                    assertThat(properties.getRetry().getMaxAttempts()).isEqualTo(7);
                    assertThat(properties.getObserver().getQueueCapacity()).isEqualTo(8);
                });
    }

    @Test
    void shouldDisableHealthIndicator() {
        contextRunner
                .withUserConfiguration(StoreConfiguration.class)
                .withPropertyValues("firefly.livefeed.health-enabled=false")
                .run(context -> {
                    assertThat(context).hasSingleBean(SubscriptionRegistry.class);
                    assertThat(context).doesNotHaveBean(LiveFeedHealthIndicator.class);
                });
    }

    @Test
    void shouldRegisterMetricsWithMeterRegistry() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfiguration.class, StoreConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(LiveFeedMetrics.class);
                    MeterRegistry meterRegistry = context.getBean(MeterRegistry.class);
                    assertThat(meterRegistry.find("firefly.livefeed.feeds.delivering").gauge()).isNotNull();
                });
    }

    @Test
    void shouldNotRegisterMetricsWhenDisabled() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfiguration.class, StoreConfiguration.class)
                .withPropertyValues("firefly.livefeed.metrics-enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(LiveFeedMetrics.class));
    }
}
