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
import org.fireflyframework.livefeed.model.RawRecord;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Correlation of two feeds through their declared join key fields.
 * <p>
 * Missing or partial data is excluded rather than guessed: records without the join key,
 * records outside the window and feeds that cannot contribute data (see
 * {@link AggregationInput#hasData(String)}) add nothing. Degraded feeds contribute their
 * re-filtered records, so the result does not depend on which query variant served them.
 */
public final class JoinAggregations {

    private JoinAggregations() {
    }

    /**
     * Collects the join key values of one feed.
     *
     * @param input   the aggregation input
     * @param feedKey the feed, which must declare a join key field
     * @return sorted, unmodifiable key values
     */
    public static Set<String> joinKeys(AggregationInput input, String feedKey) {
        return joinKeys(input, feedKey, null, TimeWindow.unbounded());
    }

    /**
     * Collects the join key values of the records of one feed whose time field lies in the
     * window.
     *
     * @param timeField record field holding the record's instant; ignored for an unbounded window
     */
    public static Set<String> joinKeys(AggregationInput input, String feedKey, String timeField, TimeWindow window) {
        return joinKeys(input, feedKey, within(timeField, window));
    }

    /**
     * Collects the join key values of the records of one feed accepted by a filter.
     *
     * @param include records to take the join key from
     */
    public static Set<String> joinKeys(AggregationInput input, String feedKey, Predicate<RawRecord> include) {
        FeedSnapshot snapshot = input.snapshot(feedKey);
        String joinField = snapshot.definition().joinKey()
                .orElseThrow(() -> new IllegalArgumentException("Feed '" + feedKey + "' declares no join key"));
        if (!input.hasData(feedKey)) {
            return Collections.emptySortedSet();
        }

        Set<String> keys = new TreeSet<>();
        for (RawRecord record : snapshot.records()) {
            if (!include.test(record)) {
                continue;
            }
            record.string(joinField)
                    .filter(value -> !value.isBlank())
                    .ifPresent(keys::add);
        }
        return Collections.unmodifiableSet(keys);
    }

    /**
     * Accepts records whose time field lies in the window; an unbounded window accepts every record.
     */
    public static Predicate<RawRecord> within(String timeField, TimeWindow window) {
        if (window.isUnbounded()) {
            return record -> true;
        }
        return record -> window.contains(record.instant(timeField).orElse(null));
    }

    /**
     * Join key values present in both feeds.
     */
    public static Set<String> intersectJoinKeys(AggregationInput input, String leftFeed, String rightFeed) {
        return intersect(joinKeys(input, leftFeed), joinKeys(input, rightFeed));
    }

    /**
     * Join key values present in both feeds within the same window.
     */
    public static Set<String> intersectJoinKeys(AggregationInput input,
                                                String leftFeed, String leftTimeField,
                                                String rightFeed, String rightTimeField,
                                                TimeWindow window) {
        return intersect(
                joinKeys(input, leftFeed, leftTimeField, window),
                joinKeys(input, rightFeed, rightTimeField, window));
    }

    /**
     * Join key values present in both feeds, taking only the records each filter accepts.
     */
    public static Set<String> intersectJoinKeys(AggregationInput input,
                                                String leftFeed, Predicate<RawRecord> leftFilter,
                                                String rightFeed, Predicate<RawRecord> rightFilter) {
        return intersect(joinKeys(input, leftFeed, leftFilter), joinKeys(input, rightFeed, rightFilter));
    }

    private static Set<String> intersect(Set<String> left, Set<String> right) {
        Set<String> result = new TreeSet<>(left);
        result.retainAll(right);
        return Collections.unmodifiableSet(result);
    }
}
