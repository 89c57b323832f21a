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

package org.fireflyframework.livefeed.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.registry.FeedHandle;
import org.fireflyframework.livefeed.registry.SubscriptionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for live feeds.
 * <p>
 * Reports UP with the number of feeds per state, and DOWN when feeds are running and every
 * one of them has failed. Individual failed feeds only degrade aggregates, so they do not
 * turn the indicator DOWN on their own.
 */
@Slf4j
@RequiredArgsConstructor
public class LiveFeedHealthIndicator implements ReactiveHealthIndicator {

    private final SubscriptionRegistry registry;

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::check)
                .onErrorResume(e -> {
                    log.warn("Live feed health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Health check() {
        Collection<FeedHandle> handles = registry.handles();
        Map<FeedState, Integer> counts = new EnumMap<>(FeedState.class);
        Map<String, String> failed = new TreeMap<>();
        for (FeedHandle handle : handles) {
            FeedState state = handle.state();
            counts.merge(state, 1, Integer::sum);
            if (state == FeedState.FAILED) {
                failed.put(handle.key(), String.valueOf(handle.retryState().lastError()));
            }
        }

        boolean allFailed = !handles.isEmpty() && counts.getOrDefault(FeedState.FAILED, 0) == handles.size();
        Health.Builder builder = allFailed ? Health.down() : Health.up();
        builder.withDetail("feeds", handles.size());
        counts.forEach((state, count) -> builder.withDetail(state.name().toLowerCase(Locale.ROOT), count));
        if (!failed.isEmpty()) {
            builder.withDetail("failedFeeds", failed);
        }
        return builder.build();
    }
}
