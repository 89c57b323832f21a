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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-feed retry bookkeeping for the current failure streak.
 * <p>
 * Instances are immutable; the owning feed replaces its state on every transition.
 * The attempt counter and delays reset on each successful activation, while the query
 * variant survives so a feed that learned its primary query is unsupported keeps using
 * the degraded one for the rest of the session.
 *
 * @param attempts    consecutive transient failures in the current streak
 * @param lastError   classification of the most recent failure, or null
 * @param nextRetryAt when the pending retry fires, or null if none is pending
 * @param lastDelay   delay of the most recently scheduled retry, or null
 * @param variant     query variant the next attempt uses
 */
public record RetryState(
        int attempts,
        ErrorKind lastError,
        Instant nextRetryAt,
        Duration lastDelay,
        QueryVariant variant
) {

    public static final RetryState INITIAL = new RetryState(0, null, null, null, QueryVariant.PRIMARY);

    public RetryState {
        Objects.requireNonNull(variant, "variant cannot be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative");
        }
    }

    public RetryState afterFailure(ErrorKind kind) {
        int next = kind == ErrorKind.TRANSIENT ? attempts + 1 : attempts;
        return new RetryState(next, kind, null, lastDelay, variant);
    }

    public RetryState scheduled(Instant fireAt, Duration delay) {
        return new RetryState(attempts, lastError, fireAt, delay, variant);
    }

    public RetryState withVariant(QueryVariant variant) {
        return new RetryState(attempts, lastError, nextRetryAt, lastDelay, variant);
    }

    /**
     * State after a successful activation: the streak is over.
     */
    public RetryState afterActivation() {
        return new RetryState(0, null, null, null, variant);
    }

    public boolean hasPendingRetry() {
        return nextRetryAt != null;
    }
}
