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

import reactor.core.Disposable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A pending resubscription of one feed.
 *
 * @param feedKey the feed to resubscribe
 * @param attempt 1-based position of the retry in the failure streak
 * @param delay   backoff delay that was applied
 * @param fireAt  when the retry fires
 * @param task    the timer; disposing it cancels the retry
 */
public record ScheduledRetry(
        String feedKey,
        int attempt,
        Duration delay,
        Instant fireAt,
        Disposable task
) implements Disposable {

    public ScheduledRetry {
        Objects.requireNonNull(feedKey, "feedKey cannot be null");
        Objects.requireNonNull(delay, "delay cannot be null");
        Objects.requireNonNull(fireAt, "fireAt cannot be null");
        Objects.requireNonNull(task, "task cannot be null");
    }

    @Override
    public void dispose() {
        task.dispose();
    }

    @Override
    public boolean isDisposed() {
        return task.isDisposed();
    }
}
