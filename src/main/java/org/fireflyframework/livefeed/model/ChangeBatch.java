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

import java.util.List;

/**
 * A batch of changes delivered by one update callback of a remote subscription.
 * <p>
 * A reset batch carries the complete result set and replaces the working set wholesale;
 * any other batch is applied incrementally. Delivery is at-least-once, so applying the
 * same batch twice must be harmless.
 *
 * @param reset   true if the batch is a full result set
 * @param changes the document changes
 */
public record ChangeBatch(
        boolean reset,
        List<RecordChange> changes
) {

    public ChangeBatch {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static ChangeBatch full(List<RecordChange> changes) {
        return new ChangeBatch(true, changes);
    }

    public static ChangeBatch incremental(List<RecordChange> changes) {
        return new ChangeBatch(false, changes);
    }

    public static ChangeBatch incremental(RecordChange... changes) {
        return new ChangeBatch(false, List.of(changes));
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }
}
