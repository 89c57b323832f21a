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

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Live sales and engagement metrics of one host.
 *
 * @param totalRevenue    revenue of all ticket sales
 * @param todayRevenue    revenue since the start of the current day
 * @param weekRevenue     revenue since the start of the current ISO week
 * @param monthRevenue    revenue since the start of the current month
 * @param ticketsSold     tickets sold across all sales
 * @param revenueByEvent  revenue per event id
 * @param totalRsvps      RSVPs carrying a status and a date, whatever the status
 * @param confirmedRsvps  number of confirmed RSVPs
 * @param pendingRsvps    number of pending RSVPs
 * @param todayRsvps      RSVPs made since the start of the current day
 * @param activeEvents    events currently live
 * @param upcomingEvents  events not started yet
 * @param completedEvents events that ended
 * @param soldOutEvents   events whose attendees reached capacity, whatever their status
 * @param views           event views
 * @param clicks          event clicks
 * @param conversionRate  {@code confirmedRsvps / max(views, 1) * 100}
 * @param customers       ids of buyers who also confirmed attendance within the customer window
 */
public record HostMetrics(
        BigDecimal totalRevenue,
        BigDecimal todayRevenue,
        BigDecimal weekRevenue,
        BigDecimal monthRevenue,
        long ticketsSold,
        Map<String, BigDecimal> revenueByEvent,
        long totalRsvps,
        long confirmedRsvps,
        long pendingRsvps,
        long todayRsvps,
        long activeEvents,
        long upcomingEvents,
        long completedEvents,
        long soldOutEvents,
        long views,
        long clicks,
        BigDecimal conversionRate,
        Set<String> customers
) {

    public HostMetrics {
        Objects.requireNonNull(totalRevenue, "totalRevenue cannot be null");
        Objects.requireNonNull(todayRevenue, "todayRevenue cannot be null");
        Objects.requireNonNull(weekRevenue, "weekRevenue cannot be null");
        Objects.requireNonNull(monthRevenue, "monthRevenue cannot be null");
        Objects.requireNonNull(conversionRate, "conversionRate cannot be null");
        revenueByEvent = revenueByEvent == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(revenueByEvent));
        customers = customers == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(customers));
    }

    public int customerCount() {
        return customers.size();
    }
}
