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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The local working set of one feed: document id to record.
 * <p>
 * Snapshots are immutable. Every update callback produces a new instance that replaces
 * the previous one atomically, so a reader never observes a partially applied batch.
 *
 * @param definition the feed definition the records were delivered for
 * @param variant    the query variant that delivered the records
 * @param state      feed state when the snapshot was produced
 * @param documents  records keyed by document id
 * @param version    number of batches applied since the working set was created
 */
public record FeedSnapshot(
        FeedDefinition definition,
        QueryVariant variant,
        FeedState state,
        Map<String, RawRecord> documents,
        long version
) {

    public FeedSnapshot {
        Objects.requireNonNull(definition, "definition cannot be null");
        Objects.requireNonNull(variant, "variant cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        documents = documents == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(documents));
    }

    public static FeedSnapshot empty(FeedDefinition definition, QueryVariant variant, FeedState state) {
        return new FeedSnapshot(definition, variant, state, Map.of(), 0);
    }

    public String feedKey() {
        return definition.key();
    }

    /**
     * Applies a change batch and returns the resulting snapshot.
     * <p>
     * Adds and modifications are upserts and removals of unknown ids are ignored, so
     * replaying a batch (at-least-once delivery) yields the same working set.
     *
     * @param batch the batch to apply
     * @param state feed state to record on the new snapshot
     * @return the new snapshot
     */
    public FeedSnapshot apply(ChangeBatch batch, FeedState state) {
        Map<String, RawRecord> next = batch.reset() ? new HashMap<>() : new HashMap<>(documents);
        String key = definition.key();
        for (RecordChange change : batch.changes()) {
            switch (change.type()) {
                case ADDED, MODIFIED -> next.put(change.documentId(),
                        RawRecord.of(key, change.documentId(), change.fields()));
                case REMOVED -> next.remove(change.documentId());
            }
        }
        return new FeedSnapshot(definition, variant, state, next, version + 1);
    }

    public FeedSnapshot withState(FeedState state) {
        if (this.state == state) {
            return this;
        }
        return new FeedSnapshot(definition, variant, state, documents, version);
    }

    /**
     * Returns the records as the primary query would have produced them.
     * Degraded snapshots are re-filtered; every snapshot is sorted by the primary order.
     */
    public List<RawRecord> records() {
        return definition.primaryQuery().refine(documents.values(), isDegraded());
    }

    public Optional<RawRecord> get(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    public int size() {
        return documents.size();
    }

    public boolean isDegraded() {
        return variant == QueryVariant.DEGRADED;
    }
}
