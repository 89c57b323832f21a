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

import org.fireflyframework.livefeed.gate.ChangeGate;
import org.fireflyframework.livefeed.gate.ChangeGates;
import org.fireflyframework.livefeed.model.FeedDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named aggregate: the feeds it depends on, how its value is computed, and when a new
 * value is worth publishing.
 *
 * @param name       unique aggregate name observers register against
 * @param feeds      the feeds the aggregate depends on
 * @param aggregator computes the value
 * @param gate       suppresses unchanged values
 * @param <T>        the aggregate value type
 */
public record AggregateDefinition<T>(
        String name,
        List<FeedDefinition> feeds,
        Aggregator<T> aggregator,
        ChangeGate<T> gate
) {

    public AggregateDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(aggregator, "aggregator cannot be null");
        Objects.requireNonNull(gate, "gate cannot be null");
        if (feeds == null || feeds.isEmpty()) {
            throw new IllegalArgumentException("Aggregate '" + name + "' must depend on at least one feed");
        }
        feeds = List.copyOf(feeds);
        Set<String> keys = new HashSet<>();
        for (FeedDefinition feed : feeds) {
            if (!keys.add(feed.key())) {
                throw new IllegalArgumentException("Aggregate '" + name + "' declares feed '" + feed.key() + "' twice");
            }
        }
    }

    public List<String> feedKeys() {
        return feeds.stream().map(FeedDefinition::key).toList();
    }

    public boolean dependsOn(String feedKey) {
        return feeds.stream().anyMatch(feed -> feed.key().equals(feedKey));
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public static class Builder<T> {
        private final String name;
        private final List<FeedDefinition> feeds = new ArrayList<>();
        private Aggregator<T> aggregator;
        private ChangeGate<T> gate = ChangeGates.valueEquality();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> feed(FeedDefinition feed) {
            feeds.add(feed);
            return this;
        }

        public Builder<T> feeds(List<FeedDefinition> feeds) {
            this.feeds.addAll(feeds);
            return this;
        }

        public Builder<T> aggregator(Aggregator<T> aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder<T> gate(ChangeGate<T> gate) {
            this.gate = gate;
            return this;
        }

        public AggregateDefinition<T> build() {
            return new AggregateDefinition<>(name, feeds, aggregator, gate);
        }
    }
}
