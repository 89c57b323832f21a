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

package org.fireflyframework.livefeed.store;

import org.fireflyframework.livefeed.model.ChangeBatch;
import org.fireflyframework.livefeed.model.QuerySpec;
import reactor.core.publisher.Flux;

/**
 * Adapter over a remote store's live query API.
 * <p>
 * Implementations translate the backend's snapshot listener into a {@link Flux}:
 * <ul>
 *   <li>each update callback becomes one {@link ChangeBatch}; the first batch of a
 *       subscription is a full result set ({@link ChangeBatch#reset()})</li>
 *   <li>listener errors become the Flux error signal, preferably a
 *       {@link RemoteStoreException} carrying the backend's classification string</li>
 *   <li>record ids are unique within the query's result set; collection group queries
 *       use the full document path</li>
 *   <li>disposing the subscription removes the backend listener</li>
 * </ul>
 * Delivery is assumed to be at-least-once. Implementations must not block the
 * subscribing thread.
 */
public interface RemoteStore {

    /**
     * Opens a live query.
     *
     * @param query the query to listen to
     * @return a cold Flux that registers a listener per subscription
     */
    Flux<ChangeBatch> listen(QuerySpec query);
}
