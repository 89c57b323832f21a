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

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Friends and pending friend requests of one user.
 *
 * @param friendIds         ids of the user's friends
 * @param incomingRequesters ids of users with a pending request to the user
 * @param outgoingRecipients ids of users the user has a pending request to
 */
public record FriendGraph(
        Set<String> friendIds,
        Set<String> incomingRequesters,
        Set<String> outgoingRecipients
) {

    public static final FriendGraph EMPTY = new FriendGraph(Set.of(), Set.of(), Set.of());

    public FriendGraph {
        friendIds = copy(friendIds);
        incomingRequesters = copy(incomingRequesters);
        outgoingRecipients = copy(outgoingRecipients);
    }

    public boolean isFriend(String userId) {
        return friendIds.contains(userId);
    }

    public boolean hasPendingRequestFrom(String userId) {
        return incomingRequesters.contains(userId);
    }

    private static Set<String> copy(Set<String> ids) {
        return ids == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(ids));
    }
}
