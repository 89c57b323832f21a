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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link AggregateRefreshService}.
 * <p>
 * Tests cover the periodic refresh loop, error handling within a cycle,
 * and lifecycle management (start/stop).
 */
@ExtendWith(MockitoExtension.class)
class AggregateRefreshServiceTest {

    private static final Duration REFRESH_INTERVAL = Duration.ofMinutes(5);

    @Mock
    private LiveAggregationService aggregationService;

    private VirtualTimeScheduler scheduler;
    private AggregateRefreshService refreshService;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        refreshService = new AggregateRefreshService(aggregationService, REFRESH_INTERVAL, scheduler);
    }

    @AfterEach
    void tearDown() {
        refreshService.stop();
        scheduler.dispose();
    }

    // ========================================================================
    // refresh Tests
    // ========================================================================

    @Nested
    @DisplayName("refresh")
    class RefreshTests {

        @Test
        @DisplayName("should emit the number of recomputed aggregates")
        void refresh_shouldEmitCount() {
            when(aggregationService.refreshAll()).thenReturn(2);

            StepVerifier.create(refreshService.refresh())
                    .expectNext(2)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refresh once per interval")
        void start_shouldRefreshPeriodically() {
            when(aggregationService.refreshAll()).thenReturn(1);

            refreshService.start();
            scheduler.advanceTimeBy(REFRESH_INTERVAL.minusSeconds(1));
            verify(aggregationService, never()).refreshAll();

            scheduler.advanceTimeBy(Duration.ofSeconds(1));
            verify(aggregationService, times(1)).refreshAll();

            scheduler.advanceTimeBy(REFRESH_INTERVAL.multipliedBy(2));
            verify(aggregationService, times(3)).refreshAll();
        }

        @Test
        @DisplayName("should keep running after a failed cycle")
        void start_shouldSurviveErrors() {
            when(aggregationService.refreshAll())
                    .thenThrow(new IllegalStateException("boom"))
                    .thenReturn(1);

            refreshService.start();
            scheduler.advanceTimeBy(REFRESH_INTERVAL.multipliedBy(2));

            verify(aggregationService, times(2)).refreshAll();
            assertThat(refreshService.isRunning()).isTrue();
        }
    }

    // ========================================================================
    // Lifecycle Tests
    // ========================================================================

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should stop refreshing after stop")
        void stop_shouldEndLoop() {
            refreshService.start();
            assertThat(refreshService.isRunning()).isTrue();

            refreshService.stop();
            scheduler.advanceTimeBy(REFRESH_INTERVAL.multipliedBy(3));

            assertThat(refreshService.isRunning()).isFalse();
            verifyNoInteractions(aggregationService);
        }

        @Test
        @DisplayName("should not start with a zero interval")
        void start_shouldBeDisabledByZeroInterval() {
            AggregateRefreshService disabled = new AggregateRefreshService(aggregationService, Duration.ZERO, scheduler);

            disabled.start();

            assertThat(disabled.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should be safe to stop before start and to start twice")
        void lifecycle_shouldBeIdempotent() {
            refreshService.stop();
            refreshService.start();
            refreshService.start();
            refreshService.destroy();

            assertThat(refreshService.isRunning()).isFalse();
        }
    }
}
