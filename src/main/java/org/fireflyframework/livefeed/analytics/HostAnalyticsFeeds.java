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

package org.fireflyframework.livefeed.analytics;

import org.fireflyframework.livefeed.aggregation.AggregateDefinition;
import org.fireflyframework.livefeed.gate.ChangeGates;
import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.QuerySpec;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Feed table of the host analytics aggregate.
 * <p>
 * <table>
 *   <tr><th>Feed</th><th>Primary query</th><th>Degraded query</th><th>Join key</th></tr>
 *   <tr><td>ticketSales</td><td>group {@code ticketSales}, hostId ==, order by purchaseDate desc</td>
 *       <td>same filter, unordered</td><td>buyerId</td></tr>
 *   <tr><td>rsvps</td><td>group {@code rsvps}, hostId ==, order by rsvpDate desc</td>
 *       <td>same filter, unordered</td><td>userId</td></tr>
 *   <tr><td>events</td><td>{@code parties}, hostId ==</td><td>none</td><td>none</td></tr>
 *   <tr><td>interactions</td><td>{@code eventInteractions}, hostId ==</td><td>none</td><td>none</td></tr>
 * </table>
 * RSVPs of every status are delivered; the aggregator separates confirmed from pending ones.
 * Feed keys are scoped by host so several hosts can be observed side by side.
 */
public final class HostAnalyticsFeeds {

    public static final String TICKET_SALES = "ticketSales";
    public static final String RSVPS = "rsvps";
    public static final String INTERACTIONS = "interactions";
    public static final String EVENTS = "events";

    public static final String INTERACTIONS_COLLECTION = "eventInteractions";
    public static final String EVENTS_COLLECTION = "parties";

    public static final Duration DEFAULT_CUSTOMER_WINDOW = Duration.ofDays(30);

    private HostAnalyticsFeeds() {
    }

    public static String feedKey(String feed, String hostId) {
        return "host/" + hostId + "/" + feed;
    }

    public static String aggregateName(String hostId) {
        return "hostMetrics/" + hostId;
    }

    public static FeedDefinition ticketSales(String hostId) {
        QuerySpec primary = QuerySpec.collectionGroup(TICKET_SALES)
                .whereEqualTo("hostId", hostId)
                .orderBy("purchaseDate", true);
        return FeedDefinition.builder(feedKey(TICKET_SALES, hostId))
                .primary(primary)
                .degraded(primary.withoutOrdering())
                .joinKey("buyerId")
                .build();
    }

    public static FeedDefinition rsvps(String hostId) {
        QuerySpec primary = QuerySpec.collectionGroup(RSVPS)
                .whereEqualTo("hostId", hostId)
                .orderBy("rsvpDate", true);
        return FeedDefinition.builder(feedKey(RSVPS, hostId))
                .primary(primary)
                .degraded(primary.withoutOrdering())
                .joinKey("userId")
                .build();
    }

    public static FeedDefinition interactions(String hostId) {
        return FeedDefinition.of(feedKey(INTERACTIONS, hostId),
                QuerySpec.collection(INTERACTIONS_COLLECTION).whereEqualTo("hostId", hostId));
    }

    public static FeedDefinition events(String hostId) {
        return FeedDefinition.of(feedKey(EVENTS, hostId),
                QuerySpec.collection(EVENTS_COLLECTION).whereEqualTo("hostId", hostId));
    }

    public static AggregateDefinition<HostMetrics> hostMetrics(String hostId, ZoneId zone) {
        return hostMetrics(hostId, zone, DEFAULT_CUSTOMER_WINDOW);
    }

    /**
     * Builds the host metrics aggregate.
     *
     * @param hostId         the host
     * @param zone           zone the day, week and month boundaries are computed in
     * @param customerWindow trailing window in which a purchase and a confirmation make a
     *                       customer, or null for no limit
     */
    public static AggregateDefinition<HostMetrics> hostMetrics(String hostId, ZoneId zone, Duration customerWindow) {
        return AggregateDefinition.<HostMetrics>builder(aggregateName(hostId))
                .feed(ticketSales(hostId))
                .feed(rsvps(hostId))
                .feed(interactions(hostId))
                .feed(events(hostId))
                .aggregator(new HostMetricsAggregator(hostId, zone, customerWindow))
                .gate(ChangeGates.valueEquality())
                .build();
    }
}
