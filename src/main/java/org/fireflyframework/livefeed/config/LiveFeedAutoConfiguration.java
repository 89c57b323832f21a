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
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.aggregation.AggregationEngine;
import org.fireflyframework.livefeed.core.AggregateRefreshService;
import org.fireflyframework.livefeed.core.LiveAggregationService;
import org.fireflyframework.livefeed.fallback.FallbackPlanner;
import org.fireflyframework.livefeed.health.LiveFeedHealthIndicator;
import org.fireflyframework.livefeed.metrics.LiveFeedMetrics;
import org.fireflyframework.livefeed.observer.ObserverRegistry;
import org.fireflyframework.livefeed.properties.LiveFeedProperties;
import org.fireflyframework.livefeed.registry.SubscriptionRegistry;
import org.fireflyframework.livefeed.retry.BackoffPolicy;
import org.fireflyframework.livefeed.retry.RetryScheduler;
import org.fireflyframework.livefeed.store.RemoteStore;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;
import reactor.core.scheduler.Schedulers;

/**
 * Auto-configuration for the Firefly live feed aggregation layer.
 * <p>
 * This configuration provides:
 * <ul>
 *   <li>FallbackPlanner - classifies subscription errors</li>
 *   <li>RetryScheduler - exponential backoff resubscription</li>
 *   <li>SubscriptionRegistry - owns the live subscriptions</li>
 *   <li>AggregationEngine - recomputes aggregates</li>
 *   <li>ObserverRegistry - bounded per-observer delivery</li>
 *   <li>LiveAggregationService - declares and observes aggregates</li>
 *   <li>AggregateRefreshService - periodic recomputation</li>
 *   <li>LiveFeedMetrics - Micrometer metrics, when a MeterRegistry is present</li>
 *   <li>LiveFeedHealthIndicator - health monitoring, when Actuator is present</li>
 * </ul>
 * <p>
 * Requires a {@link RemoteStore} bean.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(LiveFeedProperties.class)
@ConditionalOnProperty(prefix = "firefly.livefeed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LiveFeedAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.livefeed", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public LiveFeedMetrics liveFeedMetrics(MeterRegistry meterRegistry) {
        log.info("Configuring LiveFeedMetrics with Micrometer MeterRegistry");
        return new LiveFeedMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public FallbackPlanner fallbackPlanner(LiveFeedProperties properties) {
        log.info("Creating FallbackPlanner with missingCapabilityPatterns={}, permanentPatterns={}",
                properties.getFallback().getMissingCapabilityPatterns(),
                properties.getFallback().getPermanentPatterns());
        return new FallbackPlanner(properties.getFallback());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryScheduler retryScheduler(LiveFeedProperties properties) {
        LiveFeedProperties.RetryConfig retry = properties.getRetry();
        log.info("Creating RetryScheduler with baseDelay={}, maxExponent={}, jitterFactor={}, maxAttempts={}",
                retry.getBaseDelay(), retry.getMaxExponent(), retry.getJitterFactor(), retry.getMaxAttempts());
        return new RetryScheduler(BackoffPolicy.from(retry), Schedulers.parallel());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(RemoteStore.class)
    public SubscriptionRegistry subscriptionRegistry(
            RemoteStore remoteStore,
            FallbackPlanner fallbackPlanner,
            RetryScheduler retryScheduler,
            LiveFeedProperties properties,
            @Nullable LiveFeedMetrics metrics) {
        SubscriptionRegistry registry = new SubscriptionRegistry(
                remoteStore, fallbackPlanner, retryScheduler, properties.getSubscribeTimeout());
        if (metrics != null) {
            registry.addListener(metrics);
            metrics.bindTo(registry);
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public AggregationEngine aggregationEngine() {
        log.info("Creating AggregationEngine");
        return new AggregationEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObserverRegistry observerRegistry(LiveFeedProperties properties, @Nullable LiveFeedMetrics metrics) {
        log.info("Creating ObserverRegistry with queueCapacity={}", properties.getObserver().getQueueCapacity());
        return new ObserverRegistry(properties.getObserver().getQueueCapacity(), Schedulers.boundedElastic(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SubscriptionRegistry.class)
    public LiveAggregationService liveAggregationService(
            SubscriptionRegistry subscriptionRegistry,
            AggregationEngine aggregationEngine,
            ObserverRegistry observerRegistry,
            @Nullable LiveFeedMetrics metrics) {
        log.info("Creating LiveAggregationService (metrics: {})", metrics != null);
        return new LiveAggregationService(subscriptionRegistry, aggregationEngine, observerRegistry, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(LiveAggregationService.class)
    public AggregateRefreshService aggregateRefreshService(
            LiveAggregationService liveAggregationService,
            LiveFeedProperties properties) {
        AggregateRefreshService refreshService = new AggregateRefreshService(
                liveAggregationService, properties.getRefreshInterval(), Schedulers.parallel());
        refreshService.start();
        log.info("Created AggregateRefreshService with refreshInterval={}", properties.getRefreshInterval());
        return refreshService;
    }

    /**
     * Health indicator for live feed monitoring, registered only when Actuator is present.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(ReactiveHealthIndicator.class)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(SubscriptionRegistry.class)
        @ConditionalOnProperty(prefix = "firefly.livefeed", name = "health-enabled", havingValue = "true", matchIfMissing = true)
        public LiveFeedHealthIndicator liveFeedHealthIndicator(SubscriptionRegistry subscriptionRegistry) {
            log.info("Creating LiveFeedHealthIndicator");
            return new LiveFeedHealthIndicator(subscriptionRegistry);
        }
    }
}
