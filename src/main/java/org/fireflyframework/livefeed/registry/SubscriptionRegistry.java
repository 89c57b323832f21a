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

package org.fireflyframework.livefeed.registry;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.fallback.FallbackPlanner;
import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.FeedSnapshot;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.retry.RetryScheduler;
import org.fireflyframework.livefeed.store.RemoteStore;
import org.springframework.beans.factory.DisposableBean;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the live subscriptions of all feeds, keyed by feed key.
 * <p>
 * {@link #start(FeedDefinition)} is idempotent: starting a running feed with an identical
 * definition returns the existing handle, and starting it with a different definition
 * replaces the subscription once the replacement has delivered its first batch.
 * {@link #stop(FeedHandle)} releases the feed synchronously; the store subscription is
 * disposed right after the feed reached {@link FeedState#STOPPED}.
 * <p>
 * Failed subscribe attempts are classified by the {@link FallbackPlanner} and resubscribed
 * through the {@link RetryScheduler}. Each feed serializes its own mutations; different
 * feeds never share a lock.
 */
@Slf4j
public class SubscriptionRegistry implements DisposableBean {

    private final RemoteStore store;
    private final FallbackPlanner planner;
    private final RetryScheduler retryScheduler;
    private final Duration subscribeTimeout;
    private final Map<String, FeedRuntime> feeds = new ConcurrentHashMap<>();
    private final List<FeedListener> listeners = new CopyOnWriteArrayList<>();

    public SubscriptionRegistry(RemoteStore store,
                                FallbackPlanner planner,
                                RetryScheduler retryScheduler,
                                Duration subscribeTimeout) {
        this.store = store;
        this.planner = planner;
        this.retryScheduler = retryScheduler;
        this.subscribeTimeout = subscribeTimeout;
        log.info("SubscriptionRegistry initialized with store={}, subscribeTimeout={}",
                store.getClass().getSimpleName(), subscribeTimeout);
    }

    public void addListener(FeedListener listener) {
        listeners.add(listener);
    }

    public void removeListener(FeedListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts a feed, or returns the running one.
     *
     * @param definition the feed definition
     * @return the feed's handle
     */
    public FeedHandle start(FeedDefinition definition) {
        FeedRuntime runtime;
        boolean created = false;
        synchronized (feeds) {
            runtime = feeds.get(definition.key());
            if (runtime == null || runtime.state() == FeedState.STOPPED) {
                runtime = new FeedRuntime(definition, store, planner, retryScheduler, subscribeTimeout, listeners);
                feeds.put(definition.key(), runtime);
                created = true;
            }
        }

        if (created) {
            runtime.open();
        } else if (!runtime.definition().equals(definition)) {
            runtime.replace(definition);
        } else {
            log.debug("Feed={} already started", definition.key());
        }
        return runtime.handle();
    }

    /**
     * Stops a feed and removes it from the registry. Stopping an already stopped handle
     * is a no-op.
     *
     * @param handle the handle returned by {@link #start(FeedDefinition)}
     */
    public void stop(FeedHandle handle) {
        FeedRuntime runtime = handle.runtime();
        synchronized (feeds) {
            feeds.remove(runtime.key(), runtime);
        }
        runtime.stop();
    }

    /**
     * Stops the feed with the given key, if it is running.
     *
     * @return true if a feed was stopped
     */
    public boolean stop(String feedKey) {
        FeedRuntime runtime;
        synchronized (feeds) {
            runtime = feeds.remove(feedKey);
        }
        return runtime != null && runtime.stop();
    }

    /**
     * Re-activates a failed feed with a fresh retry budget.
     *
     * @return true if the feed was failed and is subscribing again
     */
    public boolean reactivate(String feedKey) {
        FeedRuntime runtime = feeds.get(feedKey);
        return runtime != null && runtime.reactivate();
    }

    public Optional<FeedHandle> find(String feedKey) {
        return Optional.ofNullable(feeds.get(feedKey)).map(FeedRuntime::handle);
    }

    /**
     * Reads the current snapshots of the given feeds. Each snapshot is immutable, so the
     * result is a consistent view even while feeds keep updating.
     *
     * @param feedKeys the feeds to read; unknown feeds are omitted
     * @return snapshots keyed by feed key, in the order requested
     */
    public Map<String, FeedSnapshot> snapshots(Collection<String> feedKeys) {
        Map<String, FeedSnapshot> result = new LinkedHashMap<>();
        for (String feedKey : feedKeys) {
            FeedRuntime runtime = feeds.get(feedKey);
            if (runtime != null) {
                result.put(feedKey, runtime.snapshot());
            }
        }
        return result;
    }

    public Collection<FeedHandle> handles() {
        return feeds.values().stream().map(FeedRuntime::handle).toList();
    }

    /**
     * Stops every feed.
     */
    public void stopAll() {
        List<FeedRuntime> running;
        synchronized (feeds) {
            running = List.copyOf(feeds.values());
            feeds.clear();
        }
        if (!running.isEmpty()) {
            log.info("Stopping {} feed(s)", running.size());
        }
        running.forEach(FeedRuntime::stop);
    }

    @Override
    public void destroy() {
        stopAll();
    }
}
