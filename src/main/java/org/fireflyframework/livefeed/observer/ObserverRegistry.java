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

package org.fireflyframework.livefeed.observer;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.metrics.LiveFeedMetrics;
import org.fireflyframework.livefeed.model.AggregateSnapshot;
import org.fireflyframework.livefeed.model.ErrorKind;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of aggregate observers with per-observer bounded delivery.
 * <p>
 * Each registration owns a pipeline that buffers at most {@code queueCapacity} pending
 * updates, dropping the oldest when full, and delivers them one at a time on the delivery
 * scheduler. Publishing never blocks on an observer.
 * <p>
 * A publish reaches exactly the registrations present when it started. A registration
 * closed while a publish is in flight receives nothing after {@link ObserverRegistration#close()}
 * returns.
 */
@Slf4j
public class ObserverRegistry {

    private final int queueCapacity;
    private final Scheduler deliveryScheduler;
    private final LiveFeedMetrics metrics;
    private final Map<String, List<Pipeline<?>>> registrations = new HashMap<>();

    public ObserverRegistry(int queueCapacity, Scheduler deliveryScheduler, @Nullable LiveFeedMetrics metrics) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1");
        }
        this.queueCapacity = queueCapacity;
        this.deliveryScheduler = deliveryScheduler;
        this.metrics = metrics;
    }

    /**
     * Registers an observer.
     *
     * @param aggregateName the aggregate observed
     * @param observer      the observer
     * @param current       snapshot delivered first, or null
     * @param onClose       run once after the registration is closed, or null
     * @return the registration
     */
    public <T> ObserverRegistration register(String aggregateName,
                                             AggregateObserver<T> observer,
                                             @Nullable AggregateSnapshot<?> current,
                                             @Nullable Runnable onClose) {
        Pipeline<T> pipeline = new Pipeline<>(aggregateName, observer, onClose);
        synchronized (registrations) {
            registrations.computeIfAbsent(aggregateName, name -> new ArrayList<>()).add(pipeline);
        }
        if (current != null) {
            pipeline.offer(Delivery.update(current));
        }
        log.debug("Registered observer for aggregate={}", aggregateName);
        return pipeline;
    }

    /**
     * Publishes a snapshot to the observers of its aggregate.
     *
     * @return the number of registrations the snapshot was handed to
     */
    public int publish(AggregateSnapshot<?> snapshot) {
        List<Pipeline<?>> targets = targets(snapshot.aggregateName());
        Delivery delivery = Delivery.update(snapshot);
        targets.forEach(pipeline -> pipeline.offer(delivery));
        return targets.size();
    }

    /**
     * Tells the observers of an aggregate that one of its feeds failed.
     */
    public void publishFeedError(String aggregateName, String feedKey, ErrorKind kind) {
        Delivery delivery = Delivery.feedError(feedKey, kind);
        targets(aggregateName).forEach(pipeline -> pipeline.offer(delivery));
    }

    public int count(String aggregateName) {
        synchronized (registrations) {
            List<Pipeline<?>> pipelines = registrations.get(aggregateName);
            return pipelines == null ? 0 : pipelines.size();
        }
    }

    /**
     * Closes every registration.
     */
    public void closeAll() {
        List<Pipeline<?>> all = new ArrayList<>();
        synchronized (registrations) {
            registrations.values().forEach(all::addAll);
        }
        all.forEach(Pipeline::close);
    }

    private List<Pipeline<?>> targets(String aggregateName) {
        synchronized (registrations) {
            List<Pipeline<?>> pipelines = registrations.get(aggregateName);
            return pipelines == null ? List.of() : List.copyOf(pipelines);
        }
    }

    private boolean remove(Pipeline<?> pipeline) {
        synchronized (registrations) {
            List<Pipeline<?>> pipelines = registrations.get(pipeline.aggregateName);
            if (pipelines == null || !pipelines.remove(pipeline)) {
                return false;
            }
            if (pipelines.isEmpty()) {
                registrations.remove(pipeline.aggregateName);
            }
            return true;
        }
    }

    private record Delivery(AggregateSnapshot<?> snapshot, String feedKey, ErrorKind kind) {

        static Delivery update(AggregateSnapshot<?> snapshot) {
            return new Delivery(snapshot, null, null);
        }

        static Delivery feedError(String feedKey, ErrorKind kind) {
            return new Delivery(null, feedKey, kind);
        }
    }

    private final class Pipeline<T> implements ObserverRegistration {

        private final String aggregateName;
        private final AggregateObserver<T> observer;
        private final Runnable onClose;
        private final ReentrantLock deliveryLock = new ReentrantLock();
        private final AtomicBoolean closed = new AtomicBoolean();
        private final AtomicLong dropped = new AtomicLong();
        private final Disposable subscription;
        private volatile boolean active = true;
        private FluxSink<Delivery> sink;

        private Pipeline(String aggregateName, AggregateObserver<T> observer, Runnable onClose) {
            this.aggregateName = aggregateName;
            this.observer = observer;
            this.onClose = onClose;
            this.subscription = Flux.<Delivery>create(emitter -> this.sink = emitter)
                    .onBackpressureBuffer(queueCapacity, this::onDropped, BufferOverflowStrategy.DROP_OLDEST)
                    .publishOn(deliveryScheduler, 1)
                    .subscribe(this::deliver,
                            error -> log.error("Delivery pipeline failed for aggregate={}", aggregateName, error));
        }

        private void offer(Delivery delivery) {
            if (active) {
                sink.next(delivery);
            }
        }

        private void deliver(Delivery delivery) {
            deliveryLock.lock();
            try {
                if (!active) {
                    return;
                }
                if (delivery.snapshot() != null) {
                    observer.onAggregateUpdated(aggregateName, narrow(delivery.snapshot()));
                } else {
                    observer.onFeedError(delivery.feedKey(), delivery.kind());
                }
            } catch (RuntimeException e) {
                log.warn("Observer of aggregate={} failed: {}", aggregateName, e.getMessage(), e);
            } finally {
                deliveryLock.unlock();
            }
        }

        /**
         * Snapshots are routed by aggregate name, and every snapshot published under a name
         * comes from the one definition its observers were registered against.
         */
        @SuppressWarnings("unchecked")
        private AggregateSnapshot<T> narrow(AggregateSnapshot<?> snapshot) {
            return (AggregateSnapshot<T>) snapshot;
        }

        private void onDropped(Delivery delivery) {
            dropped.incrementAndGet();
            log.debug("Dropped oldest pending update for slow observer of aggregate={}", aggregateName);
            if (metrics != null) {
                metrics.recordDropped(aggregateName);
            }
        }

        @Override
        public String aggregateName() {
            return aggregateName;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public long droppedCount() {
            return dropped.get();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            remove(this);
            deliveryLock.lock();
            try {
                active = false;
            } finally {
                deliveryLock.unlock();
            }
            subscription.dispose();
            log.debug("Closed observer registration for aggregate={}", aggregateName);
            if (onClose != null) {
                onClose.run();
            }
        }
    }
}
