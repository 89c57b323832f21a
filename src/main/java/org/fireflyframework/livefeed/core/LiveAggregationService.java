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

package org.fireflyframework.livefeed.core;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.aggregation.AggregateDefinition;
import org.fireflyframework.livefeed.aggregation.AggregationEngine;
import org.fireflyframework.livefeed.exception.AggregationException;
import org.fireflyframework.livefeed.exception.UnknownAggregateException;
import org.fireflyframework.livefeed.metrics.LiveFeedMetrics;
import org.fireflyframework.livefeed.model.AggregateSnapshot;
import org.fireflyframework.livefeed.model.ErrorKind;
import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.FeedSnapshot;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.observer.AggregateObserver;
import org.fireflyframework.livefeed.observer.ObserverRegistration;
import org.fireflyframework.livefeed.observer.ObserverRegistry;
import org.fireflyframework.livefeed.registry.FeedHandle;
import org.fireflyframework.livefeed.registry.FeedListener;
import org.fireflyframework.livefeed.registry.SubscriptionRegistry;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the live aggregation layer.
 * <p>
 * Applications declare named aggregates and observe them. The first observer of an
 * aggregate starts the feeds it depends on; when the last observer of every aggregate using
 * a feed has closed its registration, the feed is stopped. Observing an aggregate whose
 * feed has failed re-activates that feed.
 * <p>
 * Whenever a feed's snapshot or state changes, every observed aggregate depending on it is
 * recomputed from a consistent set of feed snapshots and published if its change gate
 * lets it through. Nothing is published while none of the feeds has delivered data, or
 * when every feed of the aggregate has failed.
 */
@Slf4j
public class LiveAggregationService implements FeedListener, DisposableBean {

    private final SubscriptionRegistry registry;
    private final AggregationEngine engine;
    private final ObserverRegistry observers;
    private final LiveFeedMetrics metrics;

    private final Map<String, Binding<?>> bindings = new ConcurrentHashMap<>();
    private final Map<String, Integer> feedReferences = new HashMap<>();
    private final Object lifecycleLock = new Object();

    public LiveAggregationService(SubscriptionRegistry registry,
                                  AggregationEngine engine,
                                  ObserverRegistry observers,
                                  @Nullable LiveFeedMetrics metrics) {
        this.registry = registry;
        this.engine = engine;
        this.observers = observers;
        this.metrics = metrics;
        registry.addListener(this);
        log.info("LiveAggregationService initialized, metrics: {}", metrics != null);
    }

    // ==================== Declaration ====================

    /**
     * Declares a named aggregate. Declaring the same definition again is a no-op.
     *
     * @throws IllegalArgumentException if the name is taken by a different definition, or a
     *                                  feed key is already declared with a different query
     */
    public <T> void declare(AggregateDefinition<T> definition) {
        synchronized (lifecycleLock) {
            Binding<?> existing = bindings.get(definition.name());
            if (existing != null) {
                if (!existing.definition.equals(definition)) {
                    throw new IllegalArgumentException("Aggregate '" + definition.name() + "' is already declared");
                }
                return;
            }
            for (FeedDefinition feed : definition.feeds()) {
                for (Binding<?> other : bindings.values()) {
                    for (FeedDefinition otherFeed : other.definition.feeds()) {
                        if (otherFeed.key().equals(feed.key()) && !otherFeed.equals(feed)) {
                            throw new IllegalArgumentException("Feed '" + feed.key() + "' of aggregate '"
                                    + definition.name() + "' conflicts with aggregate '" + other.definition.name() + "'");
                        }
                    }
                }
            }
            bindings.put(definition.name(), new Binding<>(definition));
        }
        log.info("Declared aggregate={} feeds={}", definition.name(), definition.feedKeys());
    }

    public Set<String> declaredAggregates() {
        return Set.copyOf(bindings.keySet());
    }

    // ==================== Observation ====================

    /**
     * Declares the aggregate if needed and registers an observer for it.
     */
    public <T> ObserverRegistration observe(AggregateDefinition<T> definition, AggregateObserver<T> observer) {
        declare(definition);
        return observe(definition.name(), observer);
    }

    /**
     * Registers an observer for a declared aggregate. The observer first receives the
     * aggregate's current published snapshot, if there is one.
     *
     * @throws UnknownAggregateException if no aggregate with that name was declared
     */
    public <T> ObserverRegistration observe(String aggregateName, AggregateObserver<T> observer) {
        Binding<?> binding = binding(aggregateName);

        ObserverRegistration registration;
        synchronized (lifecycleLock) {
            binding.observerCount++;
            // registered before the feeds start so it sees failures of their first attempt
            synchronized (binding) {
                registration = observers.register(aggregateName, observer, binding.lastPublished,
                        () -> release(binding));
            }
            for (FeedDefinition feed : binding.definition.feeds()) {
                acquire(feed);
            }
        }
        log.info("Observer registered for aggregate={} observers={}", aggregateName, observers.count(aggregateName));

        recompute(binding);
        return registration;
    }

    /**
     * Returns the last snapshot published for an aggregate.
     */
    public Optional<AggregateSnapshot<?>> latest(String aggregateName) {
        Binding<?> binding = binding(aggregateName);
        synchronized (binding) {
            return Optional.ofNullable(binding.lastPublished);
        }
    }

    /**
     * Recomputes every observed aggregate, so time-window values follow the clock.
     *
     * @return the number of aggregates recomputed
     */
    public int refreshAll() {
        int refreshed = 0;
        for (Binding<?> binding : bindings.values()) {
            if (recompute(binding)) {
                refreshed++;
            }
        }
        log.debug("Refreshed {} aggregate(s)", refreshed);
        return refreshed;
    }

    /**
     * Ends the session: closes every registration, stops every feed and detaches from
     * the registry.
     */
    public void shutdown() {
        log.info("Shutting down live aggregation service");
        observers.closeAll();
        registry.stopAll();
        registry.removeListener(this);
    }

    @Override
    public void destroy() {
        shutdown();
    }

    // ==================== Feed events ====================

    @Override
    public void onSnapshot(FeedSnapshot snapshot) {
        if (snapshot.state() == FeedState.STOPPED) {
            return;
        }
        for (Binding<?> binding : bindings.values()) {
            if (binding.definition.dependsOn(snapshot.feedKey())) {
                recompute(binding);
            }
        }
    }

    @Override
    public void onStateChanged(String feedKey, FeedState previous, FeedState current, ErrorKind cause) {
        if (current != FeedState.FAILED) {
            return;
        }
        ErrorKind kind = cause != null ? cause : ErrorKind.TRANSIENT;
        for (Binding<?> binding : bindings.values()) {
            if (binding.definition.dependsOn(feedKey)) {
                synchronized (binding) {
                    if (binding.observerCount > 0) {
                        log.warn("Feed={} of aggregate={} failed kind={}", feedKey, binding.definition.name(), kind);
                        observers.publishFeedError(binding.definition.name(), feedKey, kind);
                    }
                }
            }
        }
    }

    // ==================== Internals ====================

    private <T> boolean recompute(Binding<T> binding) {
        AggregateDefinition<T> definition = binding.definition;
        synchronized (binding) {
            if (binding.observerCount == 0) {
                return false;
            }
            Map<String, FeedSnapshot> snapshots = registry.snapshots(definition.feedKeys());
            if (snapshots.values().stream().noneMatch(snapshot -> snapshot.version() > 0)) {
                return false;
            }

            AggregateSnapshot<T> next;
            try {
                next = engine.recompute(definition, snapshots);
            } catch (AggregationException e) {
                log.error("Recomputation of aggregate={} failed", definition.name(), e);
                if (metrics != null) {
                    metrics.recordAggregationError(definition.name());
                }
                return false;
            }

            if (next.allFailed()) {
                log.debug("Not publishing aggregate={}: every feed failed", definition.name());
                return true;
            }
            if (!definition.gate().shouldPublish(binding.lastPublished, next)) {
                log.debug("Suppressed unchanged aggregate={}", definition.name());
                if (metrics != null) {
                    metrics.recordSuppressed(definition.name());
                }
                return true;
            }

            binding.lastPublished = next;
            int delivered = observers.publish(next);
            log.debug("Published aggregate={} provisional={} observers={}",
                    definition.name(), next.isProvisional(), delivered);
            if (metrics != null) {
                metrics.recordPublished(definition.name());
            }
            return true;
        }
    }

    private void acquire(FeedDefinition feed) {
        int references = feedReferences.merge(feed.key(), 1, Integer::sum);
        FeedHandle handle = registry.start(feed);
        if (references > 1 && handle.state() == FeedState.FAILED) {
            registry.reactivate(feed.key());
        }
    }

    private void release(Binding<?> binding) {
        List<FeedDefinition> feeds = binding.definition.feeds();
        synchronized (lifecycleLock) {
            binding.observerCount--;
            if (binding.observerCount == 0) {
                synchronized (binding) {
                    binding.lastPublished = null;
                }
            }
            for (FeedDefinition feed : feeds) {
                Integer remaining = feedReferences.computeIfPresent(feed.key(), (key, count) -> count > 1 ? count - 1 : null);
                if (remaining == null) {
                    registry.stop(feed.key());
                }
            }
        }
        log.info("Observer released for aggregate={} observers={}", binding.definition.name(), binding.observerCount);
    }

    private Binding<?> binding(String aggregateName) {
        Binding<?> binding = bindings.get(aggregateName);
        if (binding == null) {
            throw new UnknownAggregateException(aggregateName);
        }
        return binding;
    }

    private static final class Binding<T> {
        private final AggregateDefinition<T> definition;
        private AggregateSnapshot<T> lastPublished;
        private volatile int observerCount;

        private Binding(AggregateDefinition<T> definition) {
            this.definition = definition;
        }
    }
}
