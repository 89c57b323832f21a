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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.livefeed.model.ChangeBatch;
import org.fireflyframework.livefeed.model.QuerySpec;
import org.fireflyframework.livefeed.model.RecordChange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process {@link RemoteStore} holding documents per collection path.
 * <p>
 * Listeners receive the full matching result set on subscribe, then incremental
 * changes. Each listener tracks which documents it has reported, so a document that
 * stops matching its query is reported as removed.
 * <p>
 * With index enforcement on, a query that {@link QuerySpec#requiresCompositeIndex()
 * requires a composite index} fails with {@code FAILED_PRECONDITION} until the index is
 * created through {@link #createIndex(QuerySpec)}, the way a hosted document store does.
 * <p>
 * All mutations and emissions happen under one lock, so every listener sees changes in
 * the order they were written.
 */
@Slf4j
public class InMemoryRemoteStore implements RemoteStore {

    private final Object lock = new Object();
    private final Map<String, Map<String, Map<String, Object>>> collections = new HashMap<>();
    private final Set<String> indexes = new HashSet<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final boolean enforceIndexes;

    public InMemoryRemoteStore() {
        this(false);
    }

    public InMemoryRemoteStore(boolean enforceIndexes) {
        this.enforceIndexes = enforceIndexes;
    }

    @Override
    public Flux<ChangeBatch> listen(QuerySpec query) {
        return Flux.create(sink -> {
            synchronized (lock) {
                if (enforceIndexes && query.requiresCompositeIndex() && !indexes.contains(query.indexSignature())) {
                    log.debug("Rejecting query without index: {}", query.indexSignature());
                    sink.error(RemoteStoreException.missingIndex(query.indexSignature()));
                    return;
                }

                Listener listener = new Listener(query, sink);
                List<RecordChange> initial = new ArrayList<>();
                collections.forEach((path, documents) -> {
                    if (listener.covers(path)) {
                        documents.forEach((id, fields) -> {
                            if (query.matches(fields)) {
                                listener.visible.add(path + "/" + id);
                                initial.add(RecordChange.added(listener.recordId(path, id), fields));
                            }
                        });
                    }
                });

                listeners.add(listener);
                sink.onDispose(() -> listeners.remove(listener));
                sink.next(ChangeBatch.full(initial));
            }
        });
    }

    /**
     * Creates or replaces a document and notifies matching listeners.
     *
     * @param collectionPath full collection path, e.g. {@code parties/p1/ticketSales}
     * @param documentId     document id within the collection
     * @param fields         document fields
     */
    public void put(String collectionPath, String documentId, Map<String, Object> fields) {
        synchronized (lock) {
            Map<String, Object> copy = new LinkedHashMap<>(fields);
            collections.computeIfAbsent(collectionPath, path -> new LinkedHashMap<>()).put(documentId, copy);
            for (Listener listener : listeners) {
                listener.onWrite(collectionPath, documentId, copy);
            }
        }
    }

    public void delete(String collectionPath, String documentId) {
        synchronized (lock) {
            Map<String, Map<String, Object>> documents = collections.get(collectionPath);
            if (documents == null || documents.remove(documentId) == null) {
                return;
            }
            for (Listener listener : listeners) {
                listener.onWrite(collectionPath, documentId, null);
            }
        }
    }

    public void createIndex(QuerySpec query) {
        synchronized (lock) {
            indexes.add(query.indexSignature());
        }
        log.info("Created composite index {}", query.indexSignature());
    }

    public int listenerCount() {
        return listeners.size();
    }

    private static final class Listener {
        private final QuerySpec query;
        private final FluxSink<ChangeBatch> sink;
        private final Set<String> visible = new HashSet<>();

        private Listener(QuerySpec query, FluxSink<ChangeBatch> sink) {
            this.query = query;
            this.sink = sink;
        }

        private boolean covers(String collectionPath) {
            if (!query.collectionGroup()) {
                return collectionPath.equals(query.collectionPath());
            }
            int slash = collectionPath.lastIndexOf('/');
            String collectionId = slash < 0 ? collectionPath : collectionPath.substring(slash + 1);
            return collectionId.equals(query.collectionPath());
        }

        /**
         * Ids are only unique within one collection, so group queries identify records by
         * their full document path.
         */
        private String recordId(String collectionPath, String documentId) {
            return query.collectionGroup() ? collectionPath + "/" + documentId : documentId;
        }

        private void onWrite(String collectionPath, String documentId, Map<String, Object> fields) {
            if (!covers(collectionPath)) {
                return;
            }
            String path = collectionPath + "/" + documentId;
            String recordId = recordId(collectionPath, documentId);
            RecordChange change;
            if (fields != null && query.matches(fields)) {
                change = visible.add(path)
                        ? RecordChange.added(recordId, fields)
                        : RecordChange.modified(recordId, fields);
            } else if (visible.remove(path)) {
                change = RecordChange.removed(recordId);
            } else {
                return;
            }
            sink.next(ChangeBatch.incremental(change));
        }
    }
}
