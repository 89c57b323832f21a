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

import org.fireflyframework.livefeed.aggregation.AggregateDefinition;
import org.fireflyframework.livefeed.gate.ChangeGate;
import org.fireflyframework.livefeed.gate.ChangeGates;
import org.fireflyframework.livefeed.model.FeedDefinition;
import org.fireflyframework.livefeed.model.FieldFilter;
import org.fireflyframework.livefeed.model.QuerySpec;

/**
 * Feed table of the friend graph aggregate of one user.
 * <ul>
 *   <li>friendships: {@code friendships} where members contains the user</li>
 *   <li>incomingRequests: {@code friendRequests} where toUserId == user and status == pending,
 *       newest first; degraded to toUserId == user</li>
 *   <li>outgoingRequests: {@code friendRequests} where fromUserId == user, newest first;
 *       degraded to unordered</li>
 * </ul>
 */
public final class FriendGraphFeeds {

    public static final String FRIENDSHIPS = "friendships";
    public static final String INCOMING_REQUESTS = "incomingRequests";
    public static final String OUTGOING_REQUESTS = "outgoingRequests";

    public static final String FRIENDSHIPS_COLLECTION = "friendships";
    public static final String REQUESTS_COLLECTION = "friendRequests";

    public static final String STATUS_PENDING = "pending";

    private FriendGraphFeeds() {
    }

    public static String feedKey(String feed, String userId) {
        return "user/" + userId + "/" + feed;
    }

    public static String aggregateName(String userId) {
        return "friendGraph/" + userId;
    }

    public static FeedDefinition friendships(String userId) {
        return FeedDefinition.of(feedKey(FRIENDSHIPS, userId),
                QuerySpec.collection(FRIENDSHIPS_COLLECTION)
                        .where("members", FieldFilter.Operator.ARRAY_CONTAINS, userId));
    }

    public static FeedDefinition incomingRequests(String userId) {
        QuerySpec primary = QuerySpec.collection(REQUESTS_COLLECTION)
                .whereEqualTo("toUserId", userId)
                .whereEqualTo("status", STATUS_PENDING)
                .orderBy("createdAt", true);
        return FeedDefinition.builder(feedKey(INCOMING_REQUESTS, userId))
                .primary(primary)
                .degraded(primary.retainFilters("toUserId").withoutOrdering())
                .joinKey("fromUserId")
                .build();
    }

    public static FeedDefinition outgoingRequests(String userId) {
        QuerySpec primary = QuerySpec.collection(REQUESTS_COLLECTION)
                .whereEqualTo("fromUserId", userId)
                .orderBy("createdAt", true);
        return FeedDefinition.builder(feedKey(OUTGOING_REQUESTS, userId))
                .primary(primary)
                .degraded(primary.withoutOrdering())
                .joinKey("toUserId")
                .build();
    }

    /**
     * Gate that publishes only when membership of one of the three id sets changes.
     * {@link java.util.Set#equals(Object)} ignores order.
     */
    public static ChangeGate<FriendGraph> membershipGate() {
        return ChangeGates.byEquality((a, b) ->
                a.friendIds().equals(b.friendIds())
                        && a.incomingRequesters().equals(b.incomingRequesters())
                        && a.outgoingRecipients().equals(b.outgoingRecipients()));
    }

    public static AggregateDefinition<FriendGraph> friendGraph(String userId) {
        return AggregateDefinition.<FriendGraph>builder(aggregateName(userId))
                .feed(friendships(userId))
                .feed(incomingRequests(userId))
                .feed(outgoingRequests(userId))
                .aggregator(new FriendGraphAggregator(userId))
                .gate(membershipGate())
                .build();
    }
}
