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

package org.fireflyframework.livefeed.retry;

import io.github.resilience4j.core.IntervalFunction;
import org.fireflyframework.livefeed.properties.LiveFeedProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff with bounded jitter for feed resubscription.
 * <p>
 * The n-th consecutive failure of a streak waits {@code base * 2^min(n-1, maxExponent)},
 * randomized by the jitter factor. The jittered value is clamped to
 * {@code [previousDelay, base * 2^maxExponent]}, so delays within one streak never
 * decrease and never exceed the cap.
 */
public class BackoffPolicy {

    private static final double MULTIPLIER = 2.0;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final IntervalFunction intervalFunction;

    public BackoffPolicy(Duration baseDelay, int maxExponent, double jitterFactor, int maxAttempts) {
        Objects.requireNonNull(baseDelay, "baseDelay cannot be null");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxExponent < 0) {
            throw new IllegalArgumentException("maxExponent cannot be negative");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts cannot be negative");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = baseDelay.multipliedBy(1L << maxExponent);
        this.maxAttempts = maxAttempts;
        this.intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                baseDelay.toMillis(), MULTIPLIER, jitterFactor, maxDelay.toMillis());
    }

    public static BackoffPolicy from(LiveFeedProperties.RetryConfig config) {
        return new BackoffPolicy(config.getBaseDelay(), config.getMaxExponent(),
                config.getJitterFactor(), config.getMaxAttempts());
    }

    /**
     * Computes the delay before the given retry.
     *
     * @param attempt       1-based position of the failure in the current streak
     * @param previousDelay delay used for the previous retry of the streak, or null
     * @return the delay, at least one millisecond
     */
    public Duration delayFor(int attempt, Duration previousDelay) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
        long millis = Math.min(intervalFunction.apply(attempt), maxDelay.toMillis());
        if (previousDelay != null) {
            millis = Math.max(millis, previousDelay.toMillis());
        }
        return Duration.ofMillis(Math.max(1L, millis));
    }

    /**
     * Checks whether another retry is allowed.
     *
     * @param attempt number of consecutive transient failures so far
     * @return true while the streak has not exhausted the attempt budget
     */
    public boolean allowsRetry(int attempt) {
        return attempt <= maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
