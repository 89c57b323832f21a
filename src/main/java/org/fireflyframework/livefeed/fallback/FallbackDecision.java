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

package org.fireflyframework.livefeed.fallback;

import org.fireflyframework.livefeed.model.ErrorKind;

/**
 * Outcome of planning the recovery of a failed subscribe attempt.
 *
 * @param action what the feed does next
 * @param kind   classification of the failure that was planned for
 * @param reason human-readable explanation for logs
 */
public record FallbackDecision(
        Action action,
        ErrorKind kind,
        String reason
) {

    public enum Action {
        /**
         * Resubscribe with the same query after a backoff delay.
         */
        RETRY,

        /**
         * Resubscribe immediately with the declared degraded query.
         */
        DEGRADE,

        /**
         * Stop recovering; the feed fails and observers are told.
         */
        FAIL
    }

    public static FallbackDecision retry(ErrorKind kind) {
        return new FallbackDecision(Action.RETRY, kind, "retrying same query");
    }

    public static FallbackDecision degrade() {
        return new FallbackDecision(Action.DEGRADE, ErrorKind.MISSING_CAPABILITY, "switching to degraded query");
    }

    public static FallbackDecision fail(ErrorKind kind, String reason) {
        return new FallbackDecision(Action.FAIL, kind, reason);
    }
}
