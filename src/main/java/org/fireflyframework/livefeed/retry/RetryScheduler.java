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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.model.RetryState;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Schedules feed resubscriptions with exponential backoff.
 * <p>
 * Each feed keeps its own {@link RetryState}; the scheduler is stateless apart from the
 * policy and the Reactor {@link Scheduler} timers run on, so feeds retry independently.
 * Callers own the returned {@link ScheduledRetry} and cancel it when the feed stops or
 * reconnects through another path.
 */
@Slf4j
public class RetryScheduler {

    private final BackoffPolicy policy;
    private final Scheduler scheduler;

    public RetryScheduler(BackoffPolicy policy, Scheduler scheduler) {
        this.policy = policy;
        this.scheduler = scheduler;
    }

    /**
     * Checks whether the streak recorded in the given state may be retried.
     */
    public boolean canRetry(RetryState state) {
        return policy.allowsRetry(state.attempts());
    }

    /**
     * Schedules the retry for the failure streak recorded in the given state.
     *
     * @param feedKey the feed to resubscribe
     * @param state   the feed's retry state after the failure was counted
     * @param action  what to run when the timer fires
     * @return the pending retry
     */
    public ScheduledRetry scheduleRetry(String feedKey, RetryState state, Runnable action) {
        int attempt = Math.max(1, state.attempts());
        Duration delay = policy.delayFor(attempt, state.lastDelay());
        Instant fireAt = now().plus(delay);

        log.debug("Scheduling retry feed={} attempt={} delayMs={}", feedKey, attempt, delay.toMillis());

        var task = Mono.delay(delay, scheduler)
                .subscribe(
                        tick -> action.run(),
                        error -> log.error("Retry timer failed for feed={}", feedKey, error));
        return new ScheduledRetry(feedKey, attempt, delay, fireAt, task);
    }

    /**
     * Current time as seen by the scheduler, so virtual time applies in tests.
     */
    public Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }
}
