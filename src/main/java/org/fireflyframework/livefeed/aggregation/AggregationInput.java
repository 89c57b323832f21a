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

package org.fireflyframework.livefeed.aggregation;

import org.fireflyframework.livefeed.model.FeedSnapshot;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.model.RawRecord;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Consistent set of feed snapshots an aggregate is computed from.
 *
 * @param snapshots snapshot per feed key
 * @param asOf      the instant the aggregate is evaluated at
 */
public record AggregationInput(
        Map<String, FeedSnapshot> snapshots,
        Instant asOf
) {

    public AggregationInput {
        Objects.requireNonNull(asOf, "asOf cannot be null");
        snapshots = snapshots == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(snapshots));
    }

    public FeedSnapshot snapshot(String feedKey) {
        FeedSnapshot snapshot = snapshots.get(feedKey);
        if (snapshot == null) {
            throw new IllegalArgumentException("Feed '" + feedKey + "' is not part of this aggregate");
        }
        return snapshot;
    }

    /**
     * Records of a feed as its primary query defines them: degraded feeds are re-filtered,
     * every feed is sorted by the primary order.
     */
    public List<RawRecord> records(String feedKey) {
        return snapshot(feedKey).records();
    }

    public FeedState state(String feedKey) {
        return snapshot(feedKey).state();
    }

    /**
     * Checks whether a feed can be trusted to contribute data: it has delivered at least one
     * batch and has neither failed nor stopped.
     */
    public boolean hasData(String feedKey) {
        FeedSnapshot snapshot = snapshot(feedKey);
        return snapshot.version() > 0
                && snapshot.state() != FeedState.FAILED
                && snapshot.state() != FeedState.STOPPED;
    }

    public Map<String, FeedState> provenance() {
        Map<String, FeedState> provenance = new LinkedHashMap<>();
        snapshots.forEach((key, snapshot) -> provenance.put(key, snapshot.state()));
        return provenance;
    }
}
