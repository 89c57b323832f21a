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

import org.fireflyframework.livefeed.model.ErrorKind;
import org.fireflyframework.livefeed.model.FeedSnapshot;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.retry.ScheduledRetry;

/**
 * Callback interface for feed lifecycle events emitted by the {@link SubscriptionRegistry}.
 * <p>
 * Callbacks run on the thread that delivered the triggering store signal or timer, after
 * the feed's own lock has been released. Implementations must not block.
 */
public interface FeedListener {

    /**
     * Called when a feed's working set changed.
     *
     * @param snapshot the feed's new snapshot
     */
    default void onSnapshot(FeedSnapshot snapshot) {
    }

    /**
     * Called when a feed changed state.
     *
     * @param feedKey  the feed key
     * @param previous the state before the transition
     * @param current  the state after the transition
     * @param cause    classification of the error that caused the transition, or null
     */
    default void onStateChanged(String feedKey, FeedState previous, FeedState current, ErrorKind cause) {
    }

    /**
     * Called when a resubscription was scheduled.
     *
     * @param retry the pending retry
     */
    default void onRetryScheduled(ScheduledRetry retry) {
    }
}
