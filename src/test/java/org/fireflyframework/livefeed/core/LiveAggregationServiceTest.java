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

import org.fireflyframework.livefeed.aggregation.AggregateDefinition;
import org.fireflyframework.livefeed.aggregation.AggregationEngine;
import org.fireflyframework.livefeed.analytics.HostAnalyticsFeeds;
import org.fireflyframework.livefeed.analytics.HostMetrics;
import org.fireflyframework.livefeed.exception.UnknownAggregateException;
import org.fireflyframework.livefeed.fallback.FallbackPlanner;
import org.fireflyframework.livefeed.model.AggregateSnapshot;
import org.fireflyframework.livefeed.model.ErrorKind;
import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.model.QuerySpec;
import org.fireflyframework.livefeed.observer.AggregateObserver;
import org.fireflyframework.livefeed.observer.ObserverRegistration;
import org.fireflyframework.livefeed.observer.ObserverRegistry;
import org.fireflyframework.livefeed.properties.LiveFeedProperties;
import org.fireflyframework.livefeed.registry.SubscriptionRegistry;
import org.fireflyframework.livefeed.retry.BackoffPolicy;
import org.fireflyframework.livefeed.retry.RetryScheduler;
import org.fireflyframework.livefeed.social.FriendGraph;
import org.fireflyframework.livefeed.social.FriendGraphFeeds;
import org.fireflyframework.livefeed.store.InMemoryRemoteStore;
import org.fireflyframework.livefeed.store.RemoteStore;
import org.fireflyframework.livefeed.store.RemoteStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for {@link LiveAggregationService} running real feeds against an
 * in-memory store.
 */
class LiveAggregationServiceTest {

    // a Wednesday
    private static final Instant NOW = Instant.parse("2026-03-18T12:00:00Z");
    private static final String HOST = "h1";
    private static final String USER = "u1";

    private VirtualTimeScheduler retryTimers;
    private Scheduler deliveryScheduler;
    private SubscriptionRegistry registry;
    private LiveAggregationService service;

    private LiveAggregationService createService(RemoteStore store) {
        retryTimers = VirtualTimeScheduler.create();
        deliveryScheduler = Schedulers.newBoundedElastic(4, 1000, "aggregate-test");
        registry = new SubscriptionRegistry(store,
                new FallbackPlanner(new LiveFeedProperties.FallbackConfig()),
                new RetryScheduler(new BackoffPolicy(Duration.ofSeconds(1), 4, 0.0, 3), retryTimers),
                Duration.ofSeconds(10));
        service = new LiveAggregationService(registry,
                new AggregationEngine(Clock.fixed(NOW, ZoneOffset.UTC)),
                new ObserverRegistry(16, deliveryScheduler, null),
                null);
        return service;
    }

    @AfterEach
    void tearDown() {
        shutdownService();
    }

    private void shutdownService() {
        if (service != null) {
            service.shutdown();
            deliveryScheduler.dispose();
            retryTimers.dispose();
            service = null;
        }
    }

    private static Map<String, Object> sale(String buyerId, String eventId, double price, Instant purchasedAt) {
        return Map.of(
                "hostId", HOST,
                "buyerId", buyerId,
                "eventId", eventId,
                "ticketPrice", price,
                "purchaseDate", purchasedAt);
    }

    private static Map<String, Object> rsvp(String userId, String status) {
        return Map.of(
                "hostId", HOST,
                "userId", userId,
                "status", status,
                "rsvpDate", NOW);
    }

    private static Map<String, Object> request(String from, String to, String status) {
        return Map.of(
                "fromUserId", from,
                "toUserId", to,
                "status", status,
                "createdAt", NOW);
    }

    private static <T> AggregateSnapshot<T> awaitValue(BlockingQueue<AggregateSnapshot<T>> updates,
                                                       Predicate<T> condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (true) {
            long remaining = deadline - System.nanoTime();
            assertThat(remaining).as("no matching update within 5 seconds").isPositive();
            AggregateSnapshot<T> snapshot = updates.poll(remaining, TimeUnit.NANOSECONDS);
            if (snapshot != null && condition.test(snapshot.value())) {
                return snapshot;
            }
        }
    }

    @Nested
    @DisplayName("host metrics")
    class HostMetricsTests {

        @Test
        @DisplayName("should sum revenue exactly and report zero conversion without views")
        void observe_shouldAggregateRevenue() throws InterruptedException {
            InMemoryRemoteStore store = new InMemoryRemoteStore();
            store.put("parties/p1/ticketSales", "s1", sale("b1", "e1", 10.00, NOW.minusSeconds(3600)));
            store.put("parties/p1/ticketSales", "s2", sale("b2", "e1", 25.50, Instant.parse("2026-03-16T09:00:00Z")));
            store.put("parties/p2/ticketSales", "s3", sale("b3", "e2", 4.50, Instant.parse("2026-03-02T09:00:00Z")));
            createService(store);
            BlockingQueue<AggregateSnapshot<HostMetrics>> updates = new LinkedBlockingQueue<>();

            service.observe(HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC), (name, snapshot) -> updates.add(snapshot));

            HostMetrics metrics = awaitValue(updates, value -> true).value();
            assertThat(metrics.totalRevenue()).isEqualTo(new BigDecimal("40.00"));
            assertThat(metrics.todayRevenue()).isEqualTo(new BigDecimal("10.00"));
            assertThat(metrics.weekRevenue()).isEqualTo(new BigDecimal("35.50"));
            assertThat(metrics.monthRevenue()).isEqualTo(new BigDecimal("40.00"));
            assertThat(metrics.ticketsSold()).isEqualTo(3);
            assertThat(metrics.revenueByEvent())
                    .containsEntry("e1", new BigDecimal("35.50"))
                    .containsEntry("e2", new BigDecimal("4.50"));
            assertThat(metrics.views()).isZero();
            assertThat(metrics.conversionRate()).isEqualByComparingTo(BigDecimal.ZERO);
        }

        @Test
        @DisplayName("should count sales with the same id under different events separately")
        void observe_shouldKeepSalesOfDifferentEventsApart() throws InterruptedException {
            InMemoryRemoteStore store = new InMemoryRemoteStore();
            store.put("parties/p1/ticketSales", "s1", sale("b1", "e1", 10.00, NOW));
            store.put("parties/p2/ticketSales", "s1", sale("b2", "e2", 5.00, NOW));
            createService(store);
            BlockingQueue<AggregateSnapshot<HostMetrics>> updates = new LinkedBlockingQueue<>();

            service.observe(HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC), (name, snapshot) -> updates.add(snapshot));

            HostMetrics metrics = awaitValue(updates, value -> value.ticketsSold() == 2).value();
            assertThat(metrics.totalRevenue()).isEqualTo(new BigDecimal("15.00"));
            assertThat(metrics.revenueByEvent())
                    .containsEntry("e1", new BigDecimal("10.00"))
                    .containsEntry("e2", new BigDecimal("5.00"));
        }

        @Test
        @DisplayName("should publish live changes of any feed")
        void observe_shouldFollowLiveChanges() throws InterruptedException {
            InMemoryRemoteStore store = new InMemoryRemoteStore();
            store.put("parties/p1/ticketSales", "s1", sale("b1", "e1", 10.00, NOW.minusSeconds(3600)));
            createService(store);
            BlockingQueue<AggregateSnapshot<HostMetrics>> updates = new LinkedBlockingQueue<>();
            AggregateDefinition<HostMetrics> definition = HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC);
            service.observe(definition, (name, snapshot) -> updates.add(snapshot));
            awaitValue(updates, value -> value.totalRevenue().compareTo(BigDecimal.TEN) == 0);

            store.put("parties/p1/ticketSales", "s2", sale("b2", "e1", 5.00, NOW));
            awaitValue(updates, value -> value.totalRevenue().compareTo(new BigDecimal("15")) == 0);

            store.put("parties/p1/rsvps", "r1", rsvp("b1", "confirmed"));
            store.put("parties/p1/rsvps", "r2", rsvp("b2", "pending"));
            HostMetrics metrics = awaitValue(updates, value -> value.totalRsvps() == 2).value();

            assertThat(metrics.confirmedRsvps()).isEqualTo(1);
            assertThat(metrics.pendingRsvps()).isEqualTo(1);
            assertThat(metrics.todayRsvps()).isEqualTo(2);
            assertThat(metrics.customers()).containsExactly("b1");
            assertThat(metrics.conversionRate()).isEqualByComparingTo("100");
            assertThat(service.latest(definition.name())).hasValueSatisfying(snapshot ->
                    assertThat(snapshot.value()).isEqualTo(metrics));

            store.put(HostAnalyticsFeeds.EVENTS_COLLECTION, "p1", Map.of(
                    "hostId", HOST, "status", "live", "startDate", NOW,
                    "capacity", 2L, "currentAttendees", 2L));
            HostMetrics withEvent = awaitValue(updates, value -> value.activeEvents() == 1).value();

            assertThat(withEvent.soldOutEvents()).isEqualTo(1);
            assertThat(withEvent.upcomingEvents()).isZero();
        }

        @Test
        @DisplayName("should find the same customers whichever feed changes first")
        void observe_shouldJoinCustomersInAnyOrder() throws InterruptedException {
            assertThat(customersAfter(true)).containsExactlyInAnyOrder("u2", "u3");
            shutdownService();
            assertThat(customersAfter(false)).containsExactlyInAnyOrder("u2", "u3");
        }

        private Set<String> customersAfter(boolean salesFirst) throws InterruptedException {
            InMemoryRemoteStore store = new InMemoryRemoteStore();
            createService(store);
            BlockingQueue<AggregateSnapshot<HostMetrics>> updates = new LinkedBlockingQueue<>();
            service.observe(HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC), (name, snapshot) -> updates.add(snapshot));

            if (salesFirst) {
                putSales(store);
                awaitValue(updates, value -> value.ticketsSold() == 3);
                putConfirmedRsvps(store);
            } else {
                putConfirmedRsvps(store);
                awaitValue(updates, value -> value.confirmedRsvps() == 3);
                putSales(store);
            }
            return awaitValue(updates, value -> value.ticketsSold() == 3 && value.confirmedRsvps() == 3)
                    .value().customers();
        }

        private void putSales(InMemoryRemoteStore store) {
            store.put("parties/p1/ticketSales", "s1", sale("u1", "e1", 10.00, NOW));
            store.put("parties/p1/ticketSales", "s2", sale("u2", "e1", 10.00, NOW));
            store.put("parties/p1/ticketSales", "s3", sale("u3", "e1", 10.00, NOW));
        }

        private void putConfirmedRsvps(InMemoryRemoteStore store) {
            store.put("parties/p1/rsvps", "r2", rsvp("u2", "confirmed"));
            store.put("parties/p1/rsvps", "r3", rsvp("u3", "confirmed"));
            store.put("parties/p1/rsvps", "r4", rsvp("u4", "confirmed"));
        }

        @Test
        @DisplayName("should tell observers about a failed feed and keep publishing the others")
        void observe_shouldReportFeedFailure() throws InterruptedException {
            InMemoryRemoteStore memory = new InMemoryRemoteStore();
            memory.put("parties/p1/ticketSales", "s1", sale("b1", "e1", 10.00, NOW));
            createService(query -> HostAnalyticsFeeds.RSVPS.equals(query.collectionPath())
                    ? Flux.error(RemoteStoreException.permissionDenied("Missing or insufficient permissions"))
                    : memory.listen(query));
            BlockingQueue<AggregateSnapshot<HostMetrics>> updates = new LinkedBlockingQueue<>();
            BlockingQueue<String> errors = new LinkedBlockingQueue<>();

            service.observe(HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC), new AggregateObserver<HostMetrics>() {
                @Override
                public void onAggregateUpdated(String aggregateName, AggregateSnapshot<HostMetrics> snapshot) {
                    updates.add(snapshot);
                }

                @Override
                public void onFeedError(String feedKey, ErrorKind kind) {
                    errors.add(feedKey + ":" + kind);
                }
            });

            assertThat(errors.poll(5, TimeUnit.SECONDS)).isEqualTo("host/h1/rsvps:PERMANENT");
            assertThat(awaitValue(updates, value -> true).value().totalRevenue()).isEqualTo(new BigDecimal("10.00"));
            assertThat(registry.find(HostAnalyticsFeeds.feedKey(HostAnalyticsFeeds.RSVPS, HOST)))
                    .hasValueSatisfying(handle -> assertThat(handle.state()).isEqualTo(FeedState.FAILED));
        }

        @Test
        @DisplayName("should publish nothing when every feed failed")
        void observe_shouldNotPublishWhenAllFeedsFailed() throws InterruptedException {
            createService(query -> Flux.error(RemoteStoreException.permissionDenied("denied")));
            BlockingQueue<AggregateSnapshot<HostMetrics>> updates = new LinkedBlockingQueue<>();
            BlockingQueue<String> errors = new LinkedBlockingQueue<>();

            service.observe(HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC), new AggregateObserver<HostMetrics>() {
                @Override
                public void onAggregateUpdated(String aggregateName, AggregateSnapshot<HostMetrics> snapshot) {
                    updates.add(snapshot);
                }

                @Override
                public void onFeedError(String feedKey, ErrorKind kind) {
                    errors.add(feedKey);
                }
            });

            for (int i = 0; i < 4; i++) {
                assertThat(errors.poll(5, TimeUnit.SECONDS)).isNotNull();
            }
            assertThat(updates.poll(200, TimeUnit.MILLISECONDS)).isNull();
            assertThat(service.latest(HostAnalyticsFeeds.aggregateName(HOST))).isEmpty();
        }
    }

    @Nested
    @DisplayName("friend graph")
    class FriendGraphTests {

        @Test
        @DisplayName("should serve degraded queries when indexes are missing and stay correct")
        void observe_shouldDegradeWithoutIndexes() throws InterruptedException {
            InMemoryRemoteStore store = new InMemoryRemoteStore(true);
            store.put(FriendGraphFeeds.FRIENDSHIPS_COLLECTION, "f1", Map.of("members", List.of(USER, "u2")));
            store.put(FriendGraphFeeds.REQUESTS_COLLECTION, "r1", request("u3", USER, "pending"));
            store.put(FriendGraphFeeds.REQUESTS_COLLECTION, "r2", request("u4", USER, "accepted"));
            store.put(FriendGraphFeeds.REQUESTS_COLLECTION, "r3", request(USER, "u5", "pending"));
            store.put(FriendGraphFeeds.REQUESTS_COLLECTION, "r4", request("u2", USER, "pending"));
            createService(store);
            BlockingQueue<AggregateSnapshot<FriendGraph>> updates = new LinkedBlockingQueue<>();

            service.observe(FriendGraphFeeds.friendGraph(USER), (name, snapshot) -> updates.add(snapshot));

            AggregateSnapshot<FriendGraph> snapshot = awaitValue(updates,
                    value -> !value.outgoingRecipients().isEmpty());
            assertThat(snapshot.value().friendIds()).containsExactly("u2");
            assertThat(snapshot.value().incomingRequesters()).containsExactly("u3");
            assertThat(snapshot.value().outgoingRecipients()).containsExactly("u5");
            assertThat(snapshot.isProvisional()).isTrue();
            assertThat(snapshot.feedsIn(FeedState.DEGRADED)).containsExactlyInAnyOrder(
                    FriendGraphFeeds.feedKey(FriendGraphFeeds.INCOMING_REQUESTS, USER),
                    FriendGraphFeeds.feedKey(FriendGraphFeeds.OUTGOING_REQUESTS, USER));

            store.put(FriendGraphFeeds.FRIENDSHIPS_COLLECTION, "f2", Map.of("members", List.of(USER, "u3")));

            FriendGraph accepted = awaitValue(updates, value -> value.friendIds().size() == 2).value();
            assertThat(accepted.friendIds()).containsExactly("u2", "u3");
            assertThat(accepted.incomingRequesters()).isEmpty();
            assertThat(accepted.isFriend("u3")).isTrue();
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should stop feeds when the last observer closes")
        void close_shouldStopFeedsWithLastObserver() throws InterruptedException {
            InMemoryRemoteStore store = new InMemoryRemoteStore();
            store.put("parties/p1/ticketSales", "s1", sale("b1", "e1", 10.00, NOW));
            createService(store);
            AggregateDefinition<HostMetrics> definition = HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC);
            BlockingQueue<AggregateSnapshot<HostMetrics>> first = new LinkedBlockingQueue<>();
            BlockingQueue<AggregateSnapshot<HostMetrics>> second = new LinkedBlockingQueue<>();

            ObserverRegistration one = service.observe(definition, (name, snapshot) -> first.add(snapshot));
            ObserverRegistration two = service.observe(definition.name(), (AggregateObserver<HostMetrics>) (name, snapshot) -> second.add(snapshot));

            awaitValue(first, value -> true);
            awaitValue(second, value -> true);
            assertThat(store.listenerCount()).isEqualTo(4);
            assertThat(service.refreshAll()).isEqualTo(1);

            one.close();
            assertThat(store.listenerCount()).isEqualTo(4);

            two.close();
            assertThat(store.listenerCount()).isZero();
            assertThat(registry.handles()).isEmpty();
            assertThat(service.latest(definition.name())).isEmpty();
            assertThat(service.refreshAll()).isZero();
        }

        @Test
        @DisplayName("should not deliver again when a refresh leaves the value unchanged")
        void refreshAll_shouldSuppressUnchangedValue() throws InterruptedException {
            InMemoryRemoteStore store = new InMemoryRemoteStore();
            store.put("parties/p1/ticketSales", "s1", sale("b1", "e1", 10.00, NOW));
            createService(store);
            AggregateDefinition<HostMetrics> definition = HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC);
            BlockingQueue<AggregateSnapshot<HostMetrics>> updates = new LinkedBlockingQueue<>();
            service.observe(definition, (name, snapshot) -> updates.add(snapshot));
            AggregateSnapshot<HostMetrics> published = awaitValue(updates,
                    value -> value.totalRevenue().compareTo(BigDecimal.TEN) == 0);

            assertThat(service.refreshAll()).isEqualTo(1);
            assertThat(service.refreshAll()).isEqualTo(1);

            assertThat(updates.poll(200, TimeUnit.MILLISECONDS)).isNull();
            assertThat(service.latest(definition.name())).containsSame(published);
        }

        @Test
        @DisplayName("should close every registration on shutdown")
        void shutdown_shouldCloseRegistrations() {
            InMemoryRemoteStore store = new InMemoryRemoteStore();
            createService(store);

            ObserverRegistration registration = service.observe(
                    HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC), (name, snapshot) -> { });
            service.shutdown();

            assertThat(registration.isActive()).isFalse();
            assertThat(store.listenerCount()).isZero();
        }

        @Test
        @DisplayName("should reject conflicting declarations and unknown aggregates")
        void declare_shouldRejectConflicts() {
            createService(new InMemoryRemoteStore());
            AggregateDefinition<HostMetrics> definition = HostAnalyticsFeeds.hostMetrics(HOST, ZoneOffset.UTC);
            service.declare(definition);
            service.declare(definition);

            AggregateDefinition<Integer> sameName = AggregateDefinition.<Integer>builder(definition.name())
                    .feed(HostAnalyticsFeeds.interactions(HOST))
                    .aggregator(input -> 0)
                    .build();
            AggregateDefinition<Integer> conflictingFeed = AggregateDefinition.<Integer>builder("views")
                    .feed(FeedDefinition.of(HostAnalyticsFeeds.feedKey(HostAnalyticsFeeds.INTERACTIONS, HOST),
                            QuerySpec.collection("otherInteractions")))
                    .aggregator(input -> 0)
                    .build();

            assertThatThrownBy(() -> service.declare(sameName)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.declare(conflictingFeed)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.observe("unknown", (AggregateObserver<Object>) (name, snapshot) -> { }))
                    .isInstanceOf(UnknownAggregateException.class);
            assertThat(service.declaredAggregates()).containsExactly(definition.name());
        }
    }
}
