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

import org.fireflyframework.livefeed.aggregation.AggregationInput;
import org.fireflyframework.livefeed.aggregation.Aggregator;
import org.fireflyframework.livefeed.aggregation.FoldAggregations;
import org.fireflyframework.livefeed.aggregation.JoinAggregations;
import org.fireflyframework.livefeed.aggregation.TimeWindow;
import org.fireflyframework.livefeed.model.RawRecord;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Computes {@link HostMetrics} from the ticket sales, RSVP and interaction feeds.
 * <p>
 * A sale is worth {@code ticketPrice * quantity}; sales without a price are skipped and a
 * missing quantity counts as one ticket. Amounts are summed in cents.
 * <p>
 * RSVPs and events without a status or a date are not counted. An event is sold out once its
 * attendees reach its capacity, where a missing or zero capacity counts as one seat.
 */
public class HostMetricsAggregator implements Aggregator<HostMetrics> {

    static final String UNKNOWN_EVENT = "unknown";

    static final String RSVP_CONFIRMED = "confirmed";
    static final String RSVP_PENDING = "pending";

    private final String ticketSalesFeed;
    private final String rsvpsFeed;
    private final String interactionsFeed;
    private final String eventsFeed;
    private final ZoneId zone;
    private final Duration customerWindow;

    public HostMetricsAggregator(String hostId, ZoneId zone, Duration customerWindow) {
        Objects.requireNonNull(hostId, "hostId cannot be null");
        this.ticketSalesFeed = HostAnalyticsFeeds.feedKey(HostAnalyticsFeeds.TICKET_SALES, hostId);
        this.rsvpsFeed = HostAnalyticsFeeds.feedKey(HostAnalyticsFeeds.RSVPS, hostId);
        this.interactionsFeed = HostAnalyticsFeeds.feedKey(HostAnalyticsFeeds.INTERACTIONS, hostId);
        this.eventsFeed = HostAnalyticsFeeds.feedKey(HostAnalyticsFeeds.EVENTS, hostId);
        this.zone = Objects.requireNonNull(zone, "zone cannot be null");
        this.customerWindow = customerWindow;
    }

    @Override
    public HostMetrics aggregate(AggregationInput input) {
        Instant asOf = input.asOf();
        List<RawRecord> sales = input.records(ticketSalesFeed);

        TimeWindow today = TimeWindow.today(asOf, zone);
        TimeWindow week = TimeWindow.thisWeek(asOf, zone);
        TimeWindow month = TimeWindow.thisMonth(asOf, zone);

        long total = 0;
        long todayTotal = 0;
        long weekTotal = 0;
        long monthTotal = 0;
        long tickets = 0;
        Map<String, Long> byEvent = new HashMap<>();

        for (RawRecord sale : sales) {
            Optional<Long> cents = saleAmount(sale);
            if (cents.isEmpty()) {
                continue;
            }
            long amount = cents.get();
            total = Math.addExact(total, amount);
            tickets += sale.longValue("quantity").orElse(1L);
            byEvent.merge(sale.string("eventId").orElse(UNKNOWN_EVENT), amount, Math::addExact);

            Instant purchased = sale.instant("purchaseDate").orElse(null);
            if (purchased != null) {
                if (today.contains(purchased)) {
                    todayTotal = Math.addExact(todayTotal, amount);
                }
                if (week.contains(purchased)) {
                    weekTotal = Math.addExact(weekTotal, amount);
                }
                if (month.contains(purchased)) {
                    monthTotal = Math.addExact(monthTotal, amount);
                }
            }
        }

        long rsvpTotal = 0;
        long confirmed = 0;
        long pending = 0;
        long rsvpToday = 0;
        for (RawRecord rsvp : input.records(rsvpsFeed)) {
            Optional<String> status = rsvp.string("status");
            Optional<Instant> rsvpDate = rsvp.instant("rsvpDate");
            if (status.isEmpty() || rsvpDate.isEmpty()) {
                continue;
            }
            rsvpTotal++;
            if (RSVP_CONFIRMED.equals(status.get())) {
                confirmed++;
            } else if (RSVP_PENDING.equals(status.get())) {
                pending++;
            }
            if (today.contains(rsvpDate.get())) {
                rsvpToday++;
            }
        }

        long active = 0;
        long upcoming = 0;
        long completed = 0;
        long soldOut = 0;
        for (RawRecord event : input.records(eventsFeed)) {
            Optional<String> status = event.string("status");
            if (status.isEmpty() || event.instant("startDate").isEmpty()) {
                continue;
            }
            switch (status.get()) {
                case "live" -> active++;
                case "upcoming" -> upcoming++;
                case "ended", "completed" -> completed++;
                default -> {
                }
            }
            long capacity = Math.max(event.longValue("capacity").orElse(0L), 1L);
            if (event.longValue("currentAttendees").orElse(0L) >= capacity) {
                soldOut++;
            }
        }

        List<RawRecord> interactions = input.records(interactionsFeed);
        long views = FoldAggregations.count(interactions, record -> "view".equals(record.string("type").orElse(null)));
        long clicks = FoldAggregations.count(interactions, record -> "click".equals(record.string("type").orElse(null)));

        TimeWindow window = customerWindow == null ? TimeWindow.unbounded() : TimeWindow.last(customerWindow, asOf);
        Predicate<RawRecord> confirmedInWindow = JoinAggregations.within("rsvpDate", window)
                .and(HostMetricsAggregator::isConfirmed);
        Set<String> customers = JoinAggregations.intersectJoinKeys(input,
                ticketSalesFeed, JoinAggregations.within("purchaseDate", window),
                rsvpsFeed, confirmedInWindow);

        Map<String, BigDecimal> revenueByEvent = new HashMap<>();
        byEvent.forEach((eventId, cents) -> revenueByEvent.put(eventId, FoldAggregations.fromMinorUnits(cents)));

        return new HostMetrics(
                FoldAggregations.fromMinorUnits(total),
                FoldAggregations.fromMinorUnits(todayTotal),
                FoldAggregations.fromMinorUnits(weekTotal),
                FoldAggregations.fromMinorUnits(monthTotal),
                tickets,
                revenueByEvent,
                rsvpTotal,
                confirmed,
                pending,
                rsvpToday,
                active,
                upcoming,
                completed,
                soldOut,
                views,
                clicks,
                FoldAggregations.conversionRate(confirmed, views),
                customers);
    }

    private static boolean isConfirmed(RawRecord rsvp) {
        return RSVP_CONFIRMED.equals(rsvp.string("status").orElse(null));
    }

    private static Optional<Long> saleAmount(RawRecord sale) {
        return sale.decimal("ticketPrice")
                .map(price -> Math.multiplyExact(FoldAggregations.toMinorUnits(price),
                        sale.longValue("quantity").orElse(1L)));
    }
}
