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

package org.fireflyframework.livefeed.registry;

import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.FeedSnapshot;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.model.RetryState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Handle to a feed started through the {@link SubscriptionRegistry}.
 * <p>
 * The registry holds the only strong reference to the feed's store subscription. The
 * handle exposes read access and the awaitable state stream.
 */
public final class FeedHandle {

    private final FeedRuntime runtime;

    FeedHandle(FeedRuntime runtime) {
        this.runtime = runtime;
    }

    public String key() {
        return runtime.key();
    }

    public FeedDefinition definition() {
        return runtime.definition();
    }

    public FeedState state() {
        return runtime.state();
    }

    public FeedSnapshot snapshot() {
        return runtime.snapshot();
    }

    public RetryState retryState() {
        return runtime.retryState();
    }

    /**
     * Streams the feed's state transitions, starting with the current state.
     * Completes when the feed is stopped.
     */
    public Flux<FeedState> states() {
        return runtime.states();
    }

    /**
     * Completes with the first settled state: ACTIVE, DEGRADED, FAILED or STOPPED.
     * If the feed is already settled, completes immediately.
     */
    public Mono<FeedState> awaitSettled() {
        return runtime.states()
                .filter(FeedState::isSettled)
                .next();
    }

    public boolean isStopped() {
        return runtime.state() == FeedState.STOPPED;
    }

    FeedRuntime runtime() {
        return runtime;
    }

    @Override
    public String toString() {
        return "FeedHandle[" + key() + ", " + state() + "]";
    }
}
