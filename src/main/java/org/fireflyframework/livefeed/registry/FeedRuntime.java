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
import org.fireflyframework.livefeed.fallback.FallbackDecision;
import org.fireflyframework.livefeed.fallback.FallbackPlanner;
import org.fireflyframework.livefeed.model.ChangeBatch;
import org.fireflyframework.livefeed.model.ErrorKind;
import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.FeedSnapshot;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.model.QueryVariant;
import org.fireflyframework.livefeed.model.RetryState;
import org.fireflyframework.livefeed.retry.RetryScheduler;
import org.fireflyframework.livefeed.retry.ScheduledRetry;
import org.fireflyframework.livefeed.store.RemoteStore;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime state of one feed.
 * <p>
 * Every mutation of state, retry state and snapshot happens inside this object's monitor.
 * Store subscriptions are opened and disposed outside the monitor, and listeners are
 * notified after it is released, so store callbacks can re-enter without deadlocking.
 * <p>
 * Each subscribe is an {@link Attempt}. The pending attempt becomes the serving one when
 * its first batch arrives; the previously serving subscription is then disposed. Signals
 * from any other attempt are ignored.
 */
@Slf4j
final class FeedRuntime {

    private final String key;
    private final RemoteStore store;
    private final FallbackPlanner planner;
    private final RetryScheduler retryScheduler;
    private final Duration subscribeTimeout;
    private final List<FeedListener> listeners;
    private final FeedHandle handle;
    private final Sinks.Many<FeedState> stateSink = Sinks.many().replay().latest();

    private FeedDefinition definition;
    private FeedState state = FeedState.IDLE;
    private RetryState retryState = RetryState.INITIAL;
    private volatile FeedSnapshot snapshot;

    private Attempt serving;
    private Attempt pending;
    private ScheduledRetry pendingRetry;
    private long retryTicket;
    private long attemptSequence;

    FeedRuntime(FeedDefinition definition,
                RemoteStore store,
                FallbackPlanner planner,
                RetryScheduler retryScheduler,
                Duration subscribeTimeout,
                List<FeedListener> listeners) {
        this.key = definition.key();
        this.definition = definition;
        this.store = store;
        this.planner = planner;
        this.retryScheduler = retryScheduler;
        this.subscribeTimeout = subscribeTimeout;
        this.listeners = listeners;
        this.snapshot = FeedSnapshot.empty(definition, QueryVariant.PRIMARY, FeedState.IDLE);
        this.handle = new FeedHandle(this);
        stateSink.tryEmitNext(FeedState.IDLE);
    }

    // ==================== Accessors ====================

    String key() {
        return key;
    }

    FeedHandle handle() {
        return handle;
    }

    synchronized FeedDefinition definition() {
        return definition;
    }

    synchronized FeedState state() {
        return state;
    }

    synchronized RetryState retryState() {
        return retryState;
    }

    FeedSnapshot snapshot() {
        return snapshot;
    }

    Flux<FeedState> states() {
        return stateSink.asFlux();
    }

    // ==================== Lifecycle ====================

    /**
     * Opens the first subscription. Does nothing once the feed has been stopped.
     */
    void open() {
        Attempt attempt;
        List<Event> events = new ArrayList<>();
        synchronized (this) {
            if (state != FeedState.IDLE) {
                return;
            }
            log.info("Starting feed={} query={}", key, definition.primaryQuery().indexSignature());
            attempt = newAttempt(events);
        }
        dispatch(events);
        subscribe(attempt);
    }

    /**
     * Replaces the feed's definition. The current subscription keeps serving until the
     * replacement delivers its first batch.
     */
    void replace(FeedDefinition replacement) {
        Attempt attempt;
        Attempt superseded;
        List<Event> events = new ArrayList<>();
        synchronized (this) {
            if (state == FeedState.STOPPED || replacement.equals(definition)) {
                return;
            }
            log.info("Replacing feed={} query={} with {}", key,
                    definition.primaryQuery().indexSignature(), replacement.primaryQuery().indexSignature());
            definition = replacement;
            cancelRetry();
            retryState = RetryState.INITIAL;
            superseded = pending;
            pending = null;
            attempt = newAttempt(events);
        }
        if (superseded != null) {
            superseded.dispose();
        }
        dispatch(events);
        subscribe(attempt);
    }

    /**
     * Resubscribes a failed feed with a fresh retry budget, keeping the learned query variant.
     *
     * @return true if the feed was failed and a new attempt was opened
     */
    boolean reactivate() {
        Attempt attempt;
        List<Event> events = new ArrayList<>();
        synchronized (this) {
            if (state != FeedState.FAILED) {
                return false;
            }
            log.info("Reactivating feed={} variant={}", key, retryState.variant());
            retryState = retryState.afterActivation();
            attempt = newAttempt(events);
        }
        dispatch(events);
        subscribe(attempt);
        return true;
    }

    /**
     * Stops the feed. Once this returns, no state transition happens anymore and no retry
     * fires; the store subscriptions are released right after.
     *
     * @return true if this call stopped the feed
     */
    boolean stop() {
        List<Disposable> toDispose = new ArrayList<>();
        List<Event> events = new ArrayList<>();
        synchronized (this) {
            if (state == FeedState.STOPPED) {
                return false;
            }
            cancelRetry();
            collect(toDispose, serving);
            collect(toDispose, pending);
            serving = null;
            pending = null;
            transition(FeedState.STOPPED, null, events);
            stateSink.tryEmitComplete();
            log.info("Stopped feed={}", key);
        }
        toDispose.forEach(Disposable::dispose);
        dispatch(events);
        return true;
    }

    // ==================== Store signals ====================

    private void subscribe(Attempt attempt) {
        Flux<ChangeBatch> source = Flux.defer(() -> store.listen(attempt.definition.queryFor(attempt.variant)))
                .timeout(Mono.delay(subscribeTimeout, retryScheduler.getScheduler()), batch -> Mono.never());
        Disposable subscription = source.subscribe(
                batch -> onBatch(attempt, batch),
                error -> onError(attempt, error),
                () -> onComplete(attempt));
        attempt.subscription.update(subscription);
    }

    private void onBatch(Attempt attempt, ChangeBatch batch) {
        Attempt previous = null;
        List<Event> events = new ArrayList<>();
        synchronized (this) {
            if (state == FeedState.STOPPED) {
                return;
            }
            if (attempt == pending) {
                previous = serving;
                serving = attempt;
                pending = null;
                cancelRetry();
                retryState = retryState.withVariant(attempt.variant).afterActivation();
                FeedState target = attempt.variant == QueryVariant.PRIMARY ? FeedState.ACTIVE : FeedState.DEGRADED;
                FeedSnapshot base = new FeedSnapshot(attempt.definition, attempt.variant, target,
                        null, snapshot.version());
                snapshot = base.apply(batch, target);
                log.info("Feed={} confirmed variant={} documents={}", key, attempt.variant, snapshot.size());
                transition(target, null, events);
            } else if (attempt == serving) {
                snapshot = snapshot.apply(batch, state);
                log.debug("Feed={} applied batch changes={} reset={} documents={}",
                        key, batch.changes().size(), batch.reset(), snapshot.size());
            } else {
                log.debug("Ignoring batch from stale attempt {} of feed={}", attempt.id, key);
                return;
            }
            events.add(Event.snapshot(snapshot));
        }
        if (previous != null) {
            previous.dispose();
        }
        dispatch(events);
    }

    private void onComplete(Attempt attempt) {
        onError(attempt, new IllegalStateException("Live query of feed '" + key + "' completed unexpectedly"));
    }

    private void onError(Attempt attempt, Throwable error) {
        Attempt next = null;
        List<Disposable> toDispose = new ArrayList<>();
        List<Event> events = new ArrayList<>();
        synchronized (this) {
            if (state == FeedState.STOPPED || (attempt != pending && attempt != serving)) {
                return;
            }
            toDispose.add(attempt);
            if (attempt == serving && pending != null) {
                // the replacement in flight takes over recovery
                serving = null;
                log.warn("Feed={} lost its serving subscription while replacing: {}", key, error.getMessage());
                transition(FeedState.SUBSCRIBING, null, events);
            } else {
                if (attempt == serving) {
                    serving = null;
                } else {
                    pending = null;
                }
                next = recover(attempt, error, toDispose, events);
            }
        }
        toDispose.forEach(Disposable::dispose);
        dispatch(events);
        if (next != null) {
            subscribe(next);
        }
    }

    private Attempt recover(Attempt attempt, Throwable error, List<Disposable> toDispose, List<Event> events) {
        ErrorKind kind = planner.classify(error);
        retryState = retryState.withVariant(attempt.variant).afterFailure(kind);
        FallbackDecision decision = planner.plan(attempt.definition, retryState, kind);
        log.warn("Feed={} attempt={} failed kind={} action={}: {}",
                key, retryState.attempts(), kind, decision.action(), error.getMessage());

        switch (decision.action()) {
            case RETRY -> {
                if (retryScheduler.canRetry(retryState)) {
                    scheduleRetry(events);
                } else {
                    fail(kind, "retries exhausted after " + retryState.attempts() + " attempts", toDispose, events);
                }
            }
            case DEGRADE -> {
                retryState = retryState.withVariant(QueryVariant.DEGRADED);
                return newAttempt(events);
            }
            case FAIL -> fail(kind, decision.reason(), toDispose, events);
        }
        return null;
    }

    private void onRetryTimer(long ticket) {
        Attempt attempt;
        List<Event> events = new ArrayList<>();
        synchronized (this) {
            if (state == FeedState.STOPPED || ticket != retryTicket || pendingRetry == null) {
                return;
            }
            pendingRetry = null;
            retryState = retryState.scheduled(null, retryState.lastDelay());
            log.info("Retrying feed={} attempt={} variant={}", key, retryState.attempts(), retryState.variant());
            attempt = newAttempt(events);
        }
        dispatch(events);
        subscribe(attempt);
    }

    // ==================== Helpers (call with monitor held) ====================

    private Attempt newAttempt(List<Event> events) {
        QueryVariant variant = retryState.variant();
        if (variant == QueryVariant.DEGRADED && !definition.hasDegradedQuery()) {
            variant = QueryVariant.PRIMARY;
            retryState = retryState.withVariant(variant);
        }
        pending = new Attempt(++attemptSequence, definition, variant);
        if (serving == null) {
            transition(FeedState.SUBSCRIBING, null, events);
        }
        return pending;
    }

    private void scheduleRetry(List<Event> events) {
        long ticket = ++retryTicket;
        ScheduledRetry retry = retryScheduler.scheduleRetry(key, retryState, () -> onRetryTimer(ticket));
        pendingRetry = retry;
        retryState = retryState.scheduled(retry.fireAt(), retry.delay());
        if (serving == null) {
            transition(FeedState.SUBSCRIBING, retryState.lastError(), events);
        }
        events.add(Event.retry(retry));
    }

    private void fail(ErrorKind kind, String reason, List<Disposable> toDispose, List<Event> events) {
        cancelRetry();
        collect(toDispose, serving);
        collect(toDispose, pending);
        serving = null;
        pending = null;
        log.warn("Feed={} failed kind={}: {}", key, kind, reason);
        transition(FeedState.FAILED, kind, events);
    }

    private void cancelRetry() {
        retryTicket++;
        if (pendingRetry != null) {
            pendingRetry.dispose();
            pendingRetry = null;
        }
    }

    private void transition(FeedState target, ErrorKind cause, List<Event> events) {
        if (state == target) {
            return;
        }
        FeedState previous = state;
        state = target;
        snapshot = snapshot.withState(target);
        stateSink.tryEmitNext(target);
        log.debug("Feed={} {} -> {}", key, previous, target);
        events.add(Event.transition(key, previous, target, cause));
        events.add(Event.snapshot(snapshot));
    }

    private static void collect(List<Disposable> toDispose, Attempt attempt) {
        if (attempt != null) {
            toDispose.add(attempt);
        }
    }

    // ==================== Listener dispatch ====================

    private void dispatch(List<Event> events) {
        for (Event event : events) {
            for (FeedListener listener : listeners) {
                try {
                    event.deliver(listener);
                } catch (RuntimeException e) {
                    log.warn("Feed listener {} failed for feed={}", listener.getClass().getSimpleName(), key, e);
                }
            }
        }
    }

    /**
     * One subscribe attempt against the store.
     */
    private static final class Attempt implements Disposable {
        private final long id;
        private final FeedDefinition definition;
        private final QueryVariant variant;
        private final Disposable.Swap subscription = Disposables.swap();

        private Attempt(long id, FeedDefinition definition, QueryVariant variant) {
            this.id = id;
            this.definition = definition;
            this.variant = variant;
        }

        @Override
        public void dispose() {
            subscription.dispose();
        }

        @Override
        public boolean isDisposed() {
            return subscription.isDisposed();
        }
    }

    /**
     * A listener notification captured under the monitor and delivered after it.
     */
    private interface Event {

        void deliver(FeedListener listener);

        static Event snapshot(FeedSnapshot snapshot) {
            return listener -> listener.onSnapshot(snapshot);
        }

        static Event transition(String key, FeedState previous, FeedState current, ErrorKind cause) {
            return listener -> listener.onStateChanged(key, previous, current, cause);
        }

        static Event retry(ScheduledRetry retry) {
            return listener -> listener.onRetryScheduled(retry);
        }
    }
}
