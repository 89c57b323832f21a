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

package org.fireflyframework.livefeed.gate;

import org.fireflyframework.livefeed.model.AggregateSnapshot;

/**
 * Decides whether a freshly computed aggregate differs meaningfully from the last
 * published one.
 *
 * @param <T> the aggregate value type
 * @see ChangeGates
 */
@FunctionalInterface
public interface ChangeGate<T> {

    /**
     * @param previous the last published snapshot, or null if nothing was published yet
     * @param next     the freshly computed snapshot
     * @return true if {@code next} must be published
     */
    boolean shouldPublish(AggregateSnapshot<T> previous, AggregateSnapshot<T> next);
}
