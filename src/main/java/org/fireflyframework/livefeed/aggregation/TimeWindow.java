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

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;

/**
 * Half-open time interval {@code [from, to)}. A null bound is open.
 *
 * @param from inclusive lower bound, or null
 * @param to   exclusive upper bound, or null
 */
public record TimeWindow(Instant from, Instant to) {

    private static final TimeWindow UNBOUNDED = new TimeWindow(null, null);

    public TimeWindow {
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("to cannot be before from");
        }
    }

    public static TimeWindow unbounded() {
        return UNBOUNDED;
    }

    public static TimeWindow between(Instant from, Instant to) {
        return new TimeWindow(from, to);
    }

    public static TimeWindow since(Instant from) {
        return new TimeWindow(from, null);
    }

    /**
     * The trailing window of the given length ending at {@code asOf} (inclusive).
     */
    public static TimeWindow last(Duration length, Instant asOf) {
        return new TimeWindow(asOf.minus(length), asOf.plusNanos(1));
    }

    public static TimeWindow today(Instant asOf, ZoneId zone) {
        LocalDate date = LocalDate.ofInstant(asOf, zone);
        return since(date.atStartOfDay(zone).toInstant());
    }

    /**
     * From the start of the ISO week (Monday) containing {@code asOf}.
     */
    public static TimeWindow thisWeek(Instant asOf, ZoneId zone) {
        LocalDate monday = LocalDate.ofInstant(asOf, zone)
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return since(monday.atStartOfDay(zone).toInstant());
    }

    public static TimeWindow thisMonth(Instant asOf, ZoneId zone) {
        LocalDate first = LocalDate.ofInstant(asOf, zone).withDayOfMonth(1);
        return since(first.atStartOfDay(zone).toInstant());
    }

    public boolean isUnbounded() {
        return from == null && to == null;
    }

    /**
     * Checks whether an instant lies in the window. A missing instant only lies in the
     * unbounded window.
     */
    public boolean contains(Instant instant) {
        if (instant == null) {
            return isUnbounded();
        }
        return (from == null || !instant.isBefore(from)) && (to == null || instant.isBefore(to));
    }
}
