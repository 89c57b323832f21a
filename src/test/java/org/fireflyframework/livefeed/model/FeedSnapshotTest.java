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

package org.fireflyframework.livefeed.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FeedSnapshot.
 */
class FeedSnapshotTest {

    private static final FeedDefinition DEFINITION = FeedDefinition.of("sales",
            QuerySpec.collection("ticketSales").whereEqualTo("hostId", "h1"));

    private final FeedSnapshot empty = FeedSnapshot.empty(DEFINITION, QueryVariant.PRIMARY, FeedState.SUBSCRIBING);

    @Test
    void shouldReplaceWorkingSetOnFullBatch() {
        FeedSnapshot first = empty.apply(ChangeBatch.full(List.of(
                RecordChange.added("s1", Map.of("hostId", "h1", "ticketPrice", 10)),
                RecordChange.added("s2", Map.of("hostId", "h1", "ticketPrice", 20)))), FeedState.ACTIVE);

        FeedSnapshot second = first.apply(ChangeBatch.full(List.of(
                RecordChange.added("s3", Map.of("hostId", "h1", "ticketPrice", 30)))), FeedState.ACTIVE);

        assertThat(first.documents()).containsOnlyKeys("s1", "s2");
        assertThat(second.documents()).containsOnlyKeys("s3");
        assertThat(second.version()).isEqualTo(2);
        assertThat(second.state()).isEqualTo(FeedState.ACTIVE);
    }

    @Test
    void shouldConvergeToStoreStateAfterIncrementalChanges() {
        FeedSnapshot snapshot = empty
                .apply(ChangeBatch.full(List.of(RecordChange.added("s1", Map.of("ticketPrice", 10)))), FeedState.ACTIVE)
                .apply(ChangeBatch.incremental(RecordChange.added("s2", Map.of("ticketPrice", 20))), FeedState.ACTIVE)
                .apply(ChangeBatch.incremental(RecordChange.modified("s1", Map.of("ticketPrice", 15))), FeedState.ACTIVE)
                .apply(ChangeBatch.incremental(RecordChange.removed("s2")), FeedState.ACTIVE);

        assertThat(snapshot.documents()).containsOnlyKeys("s1");
        assertThat(snapshot.get("s1")).hasValueSatisfying(record ->
                assertThat(record.get("ticketPrice")).isEqualTo(15));
    }

    @Test
    void shouldBeIdempotentWhenBatchIsReplayed() {
        ChangeBatch batch = ChangeBatch.incremental(
                RecordChange.added("s2", Map.of("ticketPrice", 20)),
                RecordChange.removed("s1"),
                RecordChange.removed("unknown"));
        FeedSnapshot base = empty.apply(ChangeBatch.full(List.of(
                RecordChange.added("s1", Map.of("ticketPrice", 10)))), FeedState.ACTIVE);

        FeedSnapshot once = base.apply(batch, FeedState.ACTIVE);
        FeedSnapshot twice = once.apply(batch, FeedState.ACTIVE);

        assertThat(twice.documents()).isEqualTo(once.documents());
    }

    @Test
    void shouldNotBeAffectedByLaterBatches() {
        FeedSnapshot first = empty.apply(ChangeBatch.full(List.of(
                RecordChange.added("s1", Map.of("ticketPrice", 10)))), FeedState.ACTIVE);

        first.apply(ChangeBatch.incremental(RecordChange.removed("s1")), FeedState.ACTIVE);

        assertThat(first.documents()).containsOnlyKeys("s1");
        assertThat(first.version()).isEqualTo(1);
    }

    @Test
    void shouldRefilterRecordsOfDegradedSnapshot() {
        QuerySpec primary = QuerySpec.collection("rsvps")
                .whereEqualTo("hostId", "h1")
                .whereEqualTo("status", "confirmed");
        FeedDefinition definition = FeedDefinition.builder("rsvps")
                .primary(primary)
                .degraded(primary.retainFilters("hostId"))
                .build();
        FeedSnapshot degraded = FeedSnapshot.empty(definition, QueryVariant.DEGRADED, FeedState.SUBSCRIBING)
                .apply(ChangeBatch.full(List.of(
                        RecordChange.added("r1", Map.of("hostId", "h1", "status", "confirmed")),
                        RecordChange.added("r2", Map.of("hostId", "h1", "status", "declined")))), FeedState.DEGRADED);

        assertThat(degraded.size()).isEqualTo(2);
        assertThat(degraded.records()).extracting(RawRecord::documentId).containsExactly("r1");
    }
}
