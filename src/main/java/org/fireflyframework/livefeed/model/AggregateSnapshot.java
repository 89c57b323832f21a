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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derived, cross-feed output of one recomputation.
 * <p>
 * A new instance is produced on every recomputation and never mutated. The provenance
 * map records the state of every feed the value was computed from, which is how
 * partial feed failure and degraded mode are surfaced instead of being thrown.
 *
 * @param aggregateName name of the declared aggregate
 * @param value         domain value
 * @param provenance    feed key to feed state at computation time
 * @param computedAt    instant the recomputation was evaluated at
 * @param <T>           domain value type
 */
public record AggregateSnapshot<T>(
        String aggregateName,
        T value,
        Map<String, FeedState> provenance,
        Instant computedAt
) {

    public AggregateSnapshot {
        Objects.requireNonNull(aggregateName, "aggregateName cannot be null");
        Objects.requireNonNull(computedAt, "computedAt cannot be null");
        provenance = provenance == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
    }

    /**
     * True if any contributing feed is not {@link FeedState#ACTIVE}; the value may be
     * incomplete and observers can treat it as provisional.
     */
    public boolean isProvisional() {
        return provenance.values().stream().anyMatch(state -> state != FeedState.ACTIVE);
    }

    public boolean allFailed() {
        return !provenance.isEmpty()
                && provenance.values().stream().allMatch(state -> state == FeedState.FAILED);
    }

    public Set<String> feedsIn(FeedState state) {
        return provenance.entrySet().stream()
                .filter(entry -> entry.getValue() == state)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }
}
