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

package org.fireflyframework.livefeed.social;

import org.fireflyframework.livefeed.aggregation.AggregationInput;
import org.fireflyframework.livefeed.model.AggregateSnapshot;
import org.fireflyframework.livefeed.model.ChangeBatch;
import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.FeedSnapshot;
import org.fireflyframework.livefeed.model.FeedState;
import org.fireflyframework.livefeed.model.QueryVariant;
import org.fireflyframework.livefeed.model.RecordChange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FriendGraphAggregator.
 */
class FriendGraphAggregatorTest {

    private static final String USER = "u1";
    private static final Instant NOW = Instant.parse("2026-03-18T12:00:00Z");

    private final FriendGraphAggregator aggregator = new FriendGraphAggregator(USER);

    private static FeedSnapshot delivered(FeedDefinition definition, RecordChange... changes) {
        return FeedSnapshot.empty(definition, QueryVariant.PRIMARY, FeedState.SUBSCRIBING)
                .apply(ChangeBatch.full(Arrays.asList(changes)), FeedState.ACTIVE);
    }

    private static RecordChange request(String id, String from, String to, String status) {
        return RecordChange.added(id, Map.of("fromUserId", from, "toUserId", to, "status", status, "createdAt", NOW));
    }

    private static AggregationInput input(FeedSnapshot... snapshots) {
        Map<String, FeedSnapshot> byKey = new LinkedHashMap<>();
        for (FeedSnapshot snapshot : snapshots) {
            byKey.put(snapshot.feedKey(), snapshot);
        }
        return new AggregationInput(byKey, NOW);
    }

    @Test
    void shouldExcludeFriendsFromPendingRequests() {
        FriendGraph graph = aggregator.aggregate(input(
                delivered(FriendGraphFeeds.friendships(USER),
                        RecordChange.added("f1", Map.of("members", List.of(USER, "u2")))),
                delivered(FriendGraphFeeds.incomingRequests(USER),
                        request("r1", "u2", USER, "pending"),
                        request("r2", "u3", USER, "pending")),
                delivered(FriendGraphFeeds.outgoingRequests(USER),
                        request("r3", USER, "u4", "pending"),
                        request("r4", USER, "u5", "declined"),
                        request("r5", USER, "u2", "pending"))));

        assertThat(graph.friendIds()).containsExactly("u2");
        assertThat(graph.incomingRequesters()).containsExactly("u3");
        assertThat(graph.outgoingRecipients()).containsExactly("u4");
        assertThat(graph.hasPendingRequestFrom("u3")).isTrue();
        assertThat(graph.isFriend("u3")).isFalse();
    }

    @Test
    void shouldBeEmptyWithoutData() {
        FriendGraph graph = aggregator.aggregate(input(
                FeedSnapshot.empty(FriendGraphFeeds.friendships(USER), QueryVariant.PRIMARY, FeedState.IDLE),
                FeedSnapshot.empty(FriendGraphFeeds.incomingRequests(USER), QueryVariant.PRIMARY, FeedState.IDLE),
                FeedSnapshot.empty(FriendGraphFeeds.outgoingRequests(USER), QueryVariant.PRIMARY, FeedState.IDLE)));

        assertThat(graph).isEqualTo(FriendGraph.EMPTY);
    }

    @Test
    void shouldPublishOnlyWhenMembershipChanges() {
        FriendGraph first = new FriendGraph(Set.of("u2", "u3"), Set.of(), Set.of("u4"));
        FriendGraph reordered = new FriendGraph(Set.of("u3", "u2"), Set.of(), Set.of("u4"));
        FriendGraph changed = new FriendGraph(Set.of("u2"), Set.of(), Set.of("u4"));

        assertThat(FriendGraphFeeds.membershipGate().shouldPublish(snapshot(first), snapshot(reordered))).isFalse();
        assertThat(FriendGraphFeeds.membershipGate().shouldPublish(snapshot(first), snapshot(changed))).isTrue();
    }

    private static AggregateSnapshot<FriendGraph> snapshot(FriendGraph graph) {
        return new AggregateSnapshot<>(FriendGraphFeeds.aggregateName(USER), graph,
                Map.of(FriendGraphFeeds.feedKey(FriendGraphFeeds.FRIENDSHIPS, USER), FeedState.ACTIVE), NOW);
    }
}
