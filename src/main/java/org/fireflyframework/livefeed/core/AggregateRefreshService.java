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

package org.fireflyframework.livefeed.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Periodically recomputes every observed aggregate.
 * <p>
 * Feed changes already trigger recomputation; this loop exists for values that depend on
 * the clock, such as "revenue today", which change when the day rolls over even if no
 * record changes. It runs {@link LiveAggregationService#refreshAll()} on a
 * {@link Flux#interval(Duration, Scheduler)} tick. Errors in one cycle are logged and do
 * not terminate the loop.
 * <p>
 * <b>Configuration:</b>
 * <ul>
 *   <li>{@code refreshInterval} -- time between refreshes (default: PT5M, PT0S disables)</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class AggregateRefreshService implements DisposableBean {

    private final LiveAggregationService aggregationService;
    private final Duration refreshInterval;
    private final Scheduler scheduler;

    private volatile Disposable refreshSubscription;

    /**
     * Starts the periodic refresh loop. Does nothing when the interval is zero.
     */
    public synchronized void start() {
        if (refreshInterval.isZero() || refreshInterval.isNegative()) {
            log.info("Aggregate refresh disabled");
            return;
        }
        if (isRunning()) {
            log.warn("Aggregate refresh is already running");
            return;
        }

        log.info("Starting aggregate refresh with refreshInterval={}", refreshInterval);

        refreshSubscription = Flux.interval(refreshInterval, scheduler)
                .concatMap(tick -> refresh()
                        .onErrorResume(error -> {
                            log.error("Error during aggregate refresh cycle", error);
                            return Mono.empty();
                        }))
                .subscribe();
    }

    /**
     * Stops the refresh loop. Safe to call multiple times or before {@link #start()}.
     */
    public synchronized void stop() {
        if (isRunning()) {
            log.info("Stopping aggregate refresh");
            refreshSubscription.dispose();
            refreshSubscription = null;
        }
    }

    public boolean isRunning() {
        Disposable subscription = refreshSubscription;
        return subscription != null && !subscription.isDisposed();
    }

    /**
     * Runs one refresh cycle.
     *
     * @return a Mono emitting the number of aggregates recomputed
     */
    public Mono<Integer> refresh() {
        return Mono.fromCallable(aggregationService::refreshAll);
    }

    @Override
    public void destroy() {
        stop();
    }
}
