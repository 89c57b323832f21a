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

package org.fireflyframework.livefeed.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.model.ErrorKind;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.registry.FeedListener;
import org.fireflyframework.livefeed.registry.SubscriptionRegistry;
import org.fireflyframework.livefeed.retry.ScheduledRetry;

import java.util.Locale;

/**
 * Provides Micrometer metrics for live feeds and aggregates.
 * <p>
 * This class tracks the following metrics:
 * <ul>
 *   <li><b>feed.transitions</b> - Counter of feed state transitions (tags: feed, from, to)</li>
 *   <li><b>feed.failures</b> - Counter of feeds reaching FAILED (tags: feed, kind)</li>
 *   <li><b>feed.degraded</b> - Counter of switches to the degraded query (tags: feed)</li>
 *   <li><b>feed.retries</b> - Counter of scheduled resubscriptions (tags: feed)</li>
 *   <li><b>feeds.delivering</b> - Gauge of feeds in ACTIVE or DEGRADED</li>
 *   <li><b>aggregate.published</b> - Counter of published snapshots (tags: aggregate)</li>
 *   <li><b>aggregate.suppressed</b> - Counter of snapshots suppressed by the change gate (tags: aggregate)</li>
 *   <li><b>aggregate.errors</b> - Counter of aggregator failures (tags: aggregate)</li>
 *   <li><b>observer.dropped</b> - Counter of updates dropped for slow observers (tags: aggregate)</li>
 * </ul>
 * <p>
 * All metrics are prefixed with "firefly.livefeed.".
 */
@Slf4j
public class LiveFeedMetrics implements FeedListener {

    private static final String METRIC_PREFIX = "firefly.livefeed.";

    private static final String TAG_FEED = "feed";
    private static final String TAG_AGGREGATE = "aggregate";

    private final MeterRegistry meterRegistry;

    public LiveFeedMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("LiveFeedMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    /**
     * Registers the gauge of delivering feeds for the given registry.
     */
    public void bindTo(SubscriptionRegistry registry) {
        Gauge.builder(METRIC_PREFIX + "feeds.delivering", registry,
                        r -> r.handles().stream().filter(handle -> handle.state().isDelivering()).count())
                .description("Number of feeds currently delivering records")
                .register(meterRegistry);
    }

    // ==================== Feed Metrics ====================

    @Override
    public void onStateChanged(String feedKey, FeedState previous, FeedState current, ErrorKind cause) {
        Counter.builder(METRIC_PREFIX + "feed.transitions")
                .description("Number of feed state transitions")
                .tag(TAG_FEED, feedKey)
                .tag("from", normalizeTag(previous))
                .tag("to", normalizeTag(current))
                .register(meterRegistry)
                .increment();

        if (current == FeedState.DEGRADED) {
            Counter.builder(METRIC_PREFIX + "feed.degraded")
                    .description("Number of switches to a degraded query")
                    .tag(TAG_FEED, feedKey)
                    .register(meterRegistry)
                    .increment();
        }
        if (current == FeedState.FAILED) {
            Counter.builder(METRIC_PREFIX + "feed.failures")
                    .description("Number of feeds that exhausted recovery")
                    .tag(TAG_FEED, feedKey)
                    .tag("kind", normalizeTag(cause))
                    .register(meterRegistry)
                    .increment();
        }

        log.debug("METRIC: feed.transitions feed={}, from={}, to={}", feedKey, previous, current);
    }

    @Override
    public void onRetryScheduled(ScheduledRetry retry) {
        Counter.builder(METRIC_PREFIX + "feed.retries")
                .description("Number of scheduled feed resubscriptions")
                .tag(TAG_FEED, retry.feedKey())
                .register(meterRegistry)
                .increment();
    }

    // ==================== Aggregate Metrics ====================

    public void recordPublished(String aggregateName) {
        aggregateCounter("aggregate.published", "Number of aggregate snapshots published", aggregateName);
    }

    public void recordSuppressed(String aggregateName) {
        aggregateCounter("aggregate.suppressed", "Number of unchanged aggregate snapshots suppressed", aggregateName);
    }

    public void recordAggregationError(String aggregateName) {
        aggregateCounter("aggregate.errors", "Number of failed aggregate recomputations", aggregateName);
    }

    public void recordDropped(String aggregateName) {
        aggregateCounter("observer.dropped", "Number of updates dropped for slow observers", aggregateName);
    }

    private void aggregateCounter(String name, String description, String aggregateName) {
        Counter.builder(METRIC_PREFIX + name)
                .description(description)
                .tag(TAG_AGGREGATE, aggregateName)
                .register(meterRegistry)
                .increment();
    }

    private String normalizeTag(Enum<?> value) {
        return value == null ? "none" : value.name().toLowerCase(Locale.ROOT);
    }
}
