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
import org.fireflyframework.livefeed.aggregation.Aggregator;
import org.fireflyframework.livefeed.model.RawRecord;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the {@link FriendGraph} of one user.
 * <p>
 * A user with a friendship document is not also listed as a pending requester or
 * recipient, so a request that was accepted disappears from the pending sets as soon as the
 * friendship arrives, even if the request document has not been updated yet.
 */
public class FriendGraphAggregator implements Aggregator<FriendGraph> {

    private final String userId;
    private final String friendshipsFeed;
    private final String incomingFeed;
    private final String outgoingFeed;

    public FriendGraphAggregator(String userId) {
        this.userId = Objects.requireNonNull(userId, "userId cannot be null");
        this.friendshipsFeed = FriendGraphFeeds.feedKey(FriendGraphFeeds.FRIENDSHIPS, userId);
        this.incomingFeed = FriendGraphFeeds.feedKey(FriendGraphFeeds.INCOMING_REQUESTS, userId);
        this.outgoingFeed = FriendGraphFeeds.feedKey(FriendGraphFeeds.OUTGOING_REQUESTS, userId);
    }

    @Override
    public FriendGraph aggregate(AggregationInput input) {
        Set<String> friends = new HashSet<>();
        for (RawRecord friendship : input.records(friendshipsFeed)) {
            for (String member : friendship.stringList("members")) {
                if (!member.equals(userId)) {
                    friends.add(member);
                }
            }
        }

        Set<String> incoming = new HashSet<>();
        for (RawRecord request : input.records(incomingFeed)) {
            request.string("fromUserId")
                    .filter(id -> !friends.contains(id))
                    .ifPresent(incoming::add);
        }

        Set<String> outgoing = new HashSet<>();
        for (RawRecord request : input.records(outgoingFeed)) {
            if (!FriendGraphFeeds.STATUS_PENDING.equals(request.string("status").orElse(null))) {
                continue;
            }
            request.string("toUserId")
                    .filter(id -> !friends.contains(id))
                    .ifPresent(outgoing::add);
        }

        return new FriendGraph(friends, incoming, outgoing);
    }
}
