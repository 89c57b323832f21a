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

package org.fireflyframework.livefeed.observer;

import org.fireflyframework.livefeed.model.AggregateSnapshot;
import org.fireflyframework.livefeed.model.ErrorKind;

/**
 * Receives published snapshots of one named aggregate.
 * <p>
 * Callbacks for one registration never run concurrently. A slow observer only delays its
 * own updates; when its queue is full the oldest pending update is dropped.
 *
 * @param <T> the aggregate value type
 */
@FunctionalInterface
public interface AggregateObserver<T> {

    /**
     * Called with every published snapshot, starting with the current one if any.
     */
    void onAggregateUpdated(String aggregateName, AggregateSnapshot<T> snapshot);

    /**
     * Called when a feed the aggregate depends on exhausted recovery and failed.
     */
    default void onFeedError(String feedKey, ErrorKind kind) {
    }
}
