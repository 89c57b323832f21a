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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for TimeWindow.
 */
class TimeWindowTest {

    // a Wednesday
    private static final Instant AS_OF = Instant.parse("2026-03-18T12:00:00Z");

    @Test
    void shouldComputeCalendarWindows() {
        assertThat(TimeWindow.today(AS_OF, ZoneOffset.UTC).from()).isEqualTo(Instant.parse("2026-03-18T00:00:00Z"));
        assertThat(TimeWindow.thisWeek(AS_OF, ZoneOffset.UTC).from()).isEqualTo(Instant.parse("2026-03-16T00:00:00Z"));
        assertThat(TimeWindow.thisMonth(AS_OF, ZoneOffset.UTC).from()).isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
    }

    @Test
    void shouldRespectZone() {
        TimeWindow today = TimeWindow.today(AS_OF, ZoneId.of("Pacific/Auckland"));

        assertThat(today.from()).isEqualTo(Instant.parse("2026-03-18T11:00:00Z"));
    }

    @Test
    void shouldBeHalfOpen() {
        TimeWindow window = TimeWindow.between(AS_OF, AS_OF.plusSeconds(60));

        assertThat(window.contains(AS_OF)).isTrue();
        assertThat(window.contains(AS_OF.plusSeconds(60))).isFalse();
        assertThat(window.contains(null)).isFalse();
        assertThat(TimeWindow.unbounded().contains(null)).isTrue();
    }

    @Test
    void shouldIncludeAsOfInTrailingWindow() {
        TimeWindow window = TimeWindow.last(Duration.ofDays(30), AS_OF);

        assertThat(window.contains(AS_OF)).isTrue();
        assertThat(window.contains(AS_OF.minus(Duration.ofDays(30)))).isTrue();
        assertThat(window.contains(AS_OF.minus(Duration.ofDays(31)))).isFalse();
    }
}
