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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.exception.AggregationException;
import org.fireflyframework.livefeed.model.AggregateSnapshot;
import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.FeedSnapshot;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.model.QueryVariant;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recomputes aggregate snapshots from feed snapshots.
 * <p>
 * Every recomputation evaluates the whole aggregate from the given snapshots; no state is
 * kept between calls. Feeds without a snapshot yet are treated as idle and empty.
 */
@Slf4j
public class AggregationEngine {

    private final Clock clock;

    public AggregationEngine() {
        this(Clock.systemUTC());
    }

    public AggregationEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Computes the aggregate from the given feed snapshots.
     *
     * @param definition    the aggregate
     * @param feedSnapshots current snapshots, keyed by feed key
     * @param <T>           the aggregate value type
     * @return the new snapshot
     * @throws AggregationException if the aggregator fails
     */
    public <T> AggregateSnapshot<T> recompute(AggregateDefinition<T> definition,
                                              Map<String, FeedSnapshot> feedSnapshots) {
        Map<String, FeedSnapshot> inputs = new LinkedHashMap<>();
        for (FeedDefinition feed : definition.feeds()) {
            FeedSnapshot snapshot = feedSnapshots.get(feed.key());
            inputs.put(feed.key(), snapshot != null
                    ? snapshot
                    : FeedSnapshot.empty(feed, QueryVariant.PRIMARY, FeedState.IDLE));
        }

        Instant asOf = clock.instant();
        AggregationInput input = new AggregationInput(inputs, asOf);

        T value;
        try {
            value = definition.aggregator().aggregate(input);
        } catch (RuntimeException e) {
            throw new AggregationException(definition.name(), e.getMessage(), e);
        }

        log.debug("Recomputed aggregate={} provenance={}", definition.name(), input.provenance());
        return new AggregateSnapshot<>(definition.name(), value, input.provenance(), asOf);
    }
}
