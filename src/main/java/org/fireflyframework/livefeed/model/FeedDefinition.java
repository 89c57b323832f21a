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

import java.util.Objects;
import java.util.Optional;

/**
 * Declares a feed: a stable key, the primary query, at most one degraded fallback
 * query, and optionally the field used to join its records with another feed.
 * <p>
 * Feed definitions form a declarative table consumed generically by the fallback
 * planner and the aggregation engine. The planner never invents a fallback; it only
 * activates {@link #degradedQuery()} when present.
 *
 * @param key           stable logical feed key
 * @param primaryQuery  query used while the store supports it
 * @param degradedQuery simpler query used when the primary one needs a missing capability
 * @param joinKeyField  field correlating this feed's records with another feed, or null
 */
public record FeedDefinition(
        String key,
        QuerySpec primaryQuery,
        QuerySpec degradedQuery,
        String joinKeyField
) {

    public FeedDefinition {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(primaryQuery, "primaryQuery cannot be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key cannot be blank");
        }
        if (primaryQuery.equals(degradedQuery)) {
            throw new IllegalArgumentException("degradedQuery of feed '" + key + "' must differ from its primary query");
        }
    }

    public static FeedDefinition of(String key, QuerySpec primaryQuery) {
        return new FeedDefinition(key, primaryQuery, null, null);
    }

    public boolean hasDegradedQuery() {
        return degradedQuery != null;
    }

    public Optional<String> joinKey() {
        return Optional.ofNullable(joinKeyField);
    }

    /**
     * Returns the query for the given variant.
     *
     * @throws IllegalStateException if the degraded variant is requested but not declared
     */
    public QuerySpec queryFor(QueryVariant variant) {
        if (variant == QueryVariant.DEGRADED) {
            if (degradedQuery == null) {
                throw new IllegalStateException("Feed '" + key + "' declares no degraded query");
            }
            return degradedQuery;
        }
        return primaryQuery;
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public static class Builder {
        private final String key;
        private QuerySpec primaryQuery;
        private QuerySpec degradedQuery;
        private String joinKeyField;

        private Builder(String key) {
            this.key = key;
        }

        public Builder primary(QuerySpec primaryQuery) {
            this.primaryQuery = primaryQuery;
            return this;
        }

        public Builder degraded(QuerySpec degradedQuery) {
            this.degradedQuery = degradedQuery;
            return this;
        }

        public Builder joinKey(String joinKeyField) {
            this.joinKeyField = joinKeyField;
            return this;
        }

        public FeedDefinition build() {
            return new FeedDefinition(key, primaryQuery, degradedQuery, joinKeyField);
        }
    }
}
