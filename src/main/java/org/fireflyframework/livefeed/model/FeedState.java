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

package org.fireflyframework.livefeed.model;

/**
 * Runtime status of a live feed subscription.
 */
public enum FeedState {

    /**
     * Feed has been created but no subscription was attempted yet.
     */
    IDLE,

    /**
     * A subscribe attempt is in flight or a retry is pending.
     */
    SUBSCRIBING,

    /**
     * The primary query is confirmed and delivering records.
     */
    ACTIVE,

    /**
     * The declared fallback query is confirmed and delivering records.
     * Results may be incomplete or unordered until re-filtered client-side.
     */
    DEGRADED,

    /**
     * Recovery is exhausted. The feed stays here until it is explicitly re-activated.
     */
    FAILED,

    /**
     * Feed was stopped by its owner. No further transition happens.
     */
    STOPPED;

    /**
     * Checks if the feed is delivering records.
     *
     * @return true for {@link #ACTIVE} and {@link #DEGRADED}
     */
    public boolean isDelivering() {
        return this == ACTIVE || this == DEGRADED;
    }

    /**
     * Checks if the feed has settled, i.e. it is no longer waiting on a subscribe attempt.
     *
     * @return true if delivering, failed or stopped
     */
    public boolean isSettled() {
        return isDelivering() || this == FAILED || this == STOPPED;
    }
}
