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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.model.ErrorKind;
import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.QueryVariant;
import org.fireflyframework.livefeed.model.RetryState;
import org.fireflyframework.livefeed.properties.LiveFeedProperties;
import org.fireflyframework.livefeed.store.RemoteStoreException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Classifies subscription failures and decides how a feed recovers.
 * <p>
 * Classification matches the store's classification string and error message against
 * configured fragments, because remote stores report a missing composite index only as
 * text. Permanent fragments are checked first, then missing-capability fragments, then
 * well-known Java exception types. Anything unrecognised is treated as transient.
 * <p>
 * Planning:
 * <ul>
 *   <li>{@link ErrorKind#TRANSIENT} -- retry the same query</li>
 *   <li>{@link ErrorKind#MISSING_CAPABILITY} -- activate the feed's declared degraded query,
 *       or fail if there is none or it is already in use</li>
 *   <li>{@link ErrorKind#PERMANENT} -- fail without retrying</li>
 * </ul>
 * Whether a retry is still allowed is decided by the retry scheduler, not here.
 */
@Slf4j
public class FallbackPlanner {

    private final List<String> missingCapabilityPatterns;
    private final List<String> permanentPatterns;
    private final Set<String> degradedFeedsLogged = ConcurrentHashMap.newKeySet();

    public FallbackPlanner(LiveFeedProperties.FallbackConfig config) {
        this.missingCapabilityPatterns = normalize(config.getMissingCapabilityPatterns());
        this.permanentPatterns = normalize(config.getPermanentPatterns());
    }

    /**
     * Classifies a subscription error.
     *
     * @param error the error signalled by the store or the attempt timeout
     * @return the error kind
     */
    public ErrorKind classify(Throwable error) {
        String text = describe(error);
        if (containsAny(text, permanentPatterns)) {
            return ErrorKind.PERMANENT;
        }
        if (containsAny(text, missingCapabilityPatterns)) {
            return ErrorKind.MISSING_CAPABILITY;
        }
        if (error instanceof TimeoutException || error instanceof IOException) {
            return ErrorKind.TRANSIENT;
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorKind.PERMANENT;
        }
        return ErrorKind.TRANSIENT;
    }

    /**
     * Decides the next step for a feed whose attempt failed.
     *
     * @param definition the feed definition
     * @param retryState the feed's retry state, including the variant that failed
     * @param kind       classification of the failure
     * @return the decision
     */
    public FallbackDecision plan(FeedDefinition definition, RetryState retryState, ErrorKind kind) {
        return switch (kind) {
            case TRANSIENT -> FallbackDecision.retry(kind);
            case PERMANENT -> FallbackDecision.fail(kind, "permanent error");
            case MISSING_CAPABILITY -> planMissingCapability(definition, retryState);
        };
    }

    private FallbackDecision planMissingCapability(FeedDefinition definition, RetryState retryState) {
        if (retryState.variant() == QueryVariant.DEGRADED) {
            return FallbackDecision.fail(ErrorKind.MISSING_CAPABILITY, "degraded query also needs a missing capability");
        }
        if (!definition.hasDegradedQuery()) {
            return FallbackDecision.fail(ErrorKind.MISSING_CAPABILITY, "no degraded query declared");
        }
        if (degradedFeedsLogged.add(definition.key())) {
            log.warn("Feed {} needs a capability the store lacks (index {}); using degraded query {}",
                    definition.key(),
                    definition.primaryQuery().indexSignature(),
                    definition.degradedQuery().indexSignature());
        }
        return FallbackDecision.degrade();
    }

    private static String describe(Throwable error) {
        StringBuilder text = new StringBuilder();
        if (error instanceof RemoteStoreException storeError && storeError.getClassification() != null) {
            text.append(storeError.getClassification()).append(' ');
        }
        if (error.getMessage() != null) {
            text.append(error.getMessage());
        }
        return text.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> patterns) {
        return patterns.stream().anyMatch(text::contains);
    }

    private static List<String> normalize(List<String> patterns) {
        return patterns.stream()
                .filter(pattern -> pattern != null && !pattern.isBlank())
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .toList();
    }
}
