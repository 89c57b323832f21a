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

package org.fireflyframework.livefeed.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the live feed aggregation library.
 */
@ConfigurationProperties(prefix = "firefly.livefeed")
@Validated
@Data
public class LiveFeedProperties {

    /**
     * Whether the live feed engine is enabled.
     */
    private boolean enabled = true;

    /**
     * How long a subscribe attempt may take to deliver its first batch before it
     * is treated as a transient failure.
     */
    @NotNull
    private Duration subscribeTimeout = Duration.ofSeconds(10);

    /**
     * Interval of the periodic full recomputation of observed aggregates.
     * Zero disables it.
     */
    @NotNull
    private Duration refreshInterval = Duration.ofMinutes(5);

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to enable the health indicator.
     */
    private boolean healthEnabled = true;

    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    @Valid
    @NotNull
    private FallbackConfig fallback = new FallbackConfig();

    @Valid
    @NotNull
    private ObserverConfig observer = new ObserverConfig();

    /**
     * Resubscription backoff configuration.
     */
    @Data
    public static class RetryConfig {

        /**
         * Delay before the first retry of a failure streak.
         */
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        /**
         * Cap on the backoff exponent; delays never exceed {@code baseDelay * 2^maxExponent}.
         */
        @Min(0)
        @Max(20)
        private int maxExponent = 5;

        /**
         * Bounded random factor applied to each delay.
         */
        @DecimalMin("0.0")
        @DecimalMax("0.99")
        private double jitterFactor = 0.2;

        /**
         * Retries allowed per unbroken failure streak before the feed fails.
         */
        @Min(0)
        private int maxAttempts = 3;
    }

    /**
     * Error classification configuration.
     */
    @Data
    public static class FallbackConfig {

        /**
         * Case-insensitive fragments identifying a missing server-side capability.
         */
        @NotNull
        private List<String> missingCapabilityPatterns = new ArrayList<>(List.of(
                "requires an index",
                "failed_precondition",
                "missing index"));

        /**
         * Case-insensitive fragments identifying errors that must not be retried.
         */
        @NotNull
        private List<String> permanentPatterns = new ArrayList<>(List.of(
                "permission_denied",
                "permission denied",
                "unauthenticated",
                "invalid_argument"));
    }

    /**
     * Observer delivery configuration.
     */
    @Data
    public static class ObserverConfig {

        /**
         * Pending updates buffered per observer; the oldest is dropped when full.
         */
        @Min(1)
        private int queueCapacity = 16;
    }
}
