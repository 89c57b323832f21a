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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Describes a live query against a remote collection.
 * <p>
 * Query specs are immutable; the fluent methods return new instances:
 * <pre>{@code
 * QuerySpec.collectionGroup("ticketSales")
 *         .whereEqualTo("hostId", hostId)
 *         .orderBy("purchaseDate", true);
 * }</pre>
 *
 * @param collectionPath  collection path, or collection id for a collection-group query
 * @param collectionGroup true to query every collection with this id
 * @param filters         field predicates, all of which must hold
 * @param orderBy         field to sort by, or null
 * @param descending      sort direction for {@code orderBy}
 * @param limit           maximum number of results, or null
 */
public record QuerySpec(
        String collectionPath,
        boolean collectionGroup,
        List<FieldFilter> filters,
        String orderBy,
        boolean descending,
        Integer limit
) {

    public QuerySpec {
        Objects.requireNonNull(collectionPath, "collectionPath cannot be null");
        if (collectionPath.isBlank()) {
            throw new IllegalArgumentException("collectionPath cannot be blank");
        }
        filters = filters == null ? List.of() : List.copyOf(filters);
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
    }

    public static QuerySpec collection(String collectionPath) {
        return new QuerySpec(collectionPath, false, List.of(), null, false, null);
    }

    public static QuerySpec collectionGroup(String collectionId) {
        return new QuerySpec(collectionId, true, List.of(), null, false, null);
    }

    public QuerySpec where(String field, FieldFilter.Operator operator, Object value) {
        List<FieldFilter> next = new ArrayList<>(filters);
        next.add(new FieldFilter(field, operator, value));
        return new QuerySpec(collectionPath, collectionGroup, next, orderBy, descending, limit);
    }

    public QuerySpec whereEqualTo(String field, Object value) {
        return where(field, FieldFilter.Operator.EQ, value);
    }

    public QuerySpec orderBy(String field, boolean descending) {
        return new QuerySpec(collectionPath, collectionGroup, filters, field, descending, limit);
    }

    public QuerySpec limit(int limit) {
        return new QuerySpec(collectionPath, collectionGroup, filters, orderBy, descending, limit);
    }

    /**
     * Drops ordering and limit, the usual shape of a degraded query.
     */
    public QuerySpec withoutOrdering() {
        return new QuerySpec(collectionPath, collectionGroup, filters, null, false, null);
    }

    /**
     * Keeps only the filters on the given fields.
     */
    public QuerySpec retainFilters(String... fields) {
        List<String> keep = List.of(fields);
        List<FieldFilter> next = filters.stream()
                .filter(filter -> keep.contains(filter.field()))
                .toList();
        return new QuerySpec(collectionPath, collectionGroup, next, orderBy, descending, limit);
    }

    public boolean matches(RawRecord record) {
        return matches(record.fields());
    }

    public boolean matches(Map<String, Object> fields) {
        return filters.stream().allMatch(filter -> filter.test(fields));
    }

    /**
     * Whether a store needs a composite index to serve this query: ordering on one field
     * while filtering on another, or range filters on more than one field.
     */
    public boolean requiresCompositeIndex() {
        boolean orderedOnOtherField = orderBy != null && filters.stream()
                .anyMatch(filter -> !filter.field().equals(orderBy));
        long rangeFields = filters.stream()
                .filter(filter -> !filter.operator().isEquality())
                .map(FieldFilter::field)
                .distinct()
                .count();
        return orderedOnOtherField || rangeFields > 1;
    }

    /**
     * Stable description of the index this query needs, e.g.
     * {@code ticketSales[group]:hostId,purchaseDate:desc}.
     */
    public String indexSignature() {
        String fields = Stream.concat(
                        filters.stream().map(FieldFilter::field).distinct().sorted(),
                        orderBy == null ? Stream.empty() : Stream.of(orderBy + (descending ? ":desc" : ":asc")))
                .collect(Collectors.joining(","));
        return collectionPath + (collectionGroup ? "[group]" : "") + ":" + fields;
    }

    /**
     * Applies this query client-side to a delivered result set.
     * <p>
     * Records are always sorted by {@link #orderBy} (document id breaks ties, and decides
     * the order when no sort field is declared) so downstream folds see a deterministic
     * order. When {@code refilter} is set, records that do not satisfy the filters or lack
     * the sort field are dropped and the limit is applied, which is what a degraded feed
     * needs to approximate its primary query.
     *
     * @param records  delivered records
     * @param refilter whether to re-apply filters and limit
     * @return refined records
     */
    public List<RawRecord> refine(Collection<RawRecord> records, boolean refilter) {
        Stream<RawRecord> stream = records.stream();
        if (refilter) {
            stream = stream.filter(this::matches);
            if (orderBy != null) {
                stream = stream.filter(record -> record.has(orderBy));
            }
        }
        stream = stream.sorted(comparator());
        if (refilter && limit != null) {
            stream = stream.limit(limit);
        }
        return stream.toList();
    }

    private Comparator<RawRecord> comparator() {
        Comparator<RawRecord> byId = Comparator.comparing(RawRecord::documentId);
        if (orderBy == null) {
            return byId;
        }
        Comparator<RawRecord> byField = (left, right) ->
                FieldFilter.compare(left.get(orderBy), right.get(orderBy));
        if (descending) {
            byField = byField.reversed();
        }
        return byField.thenComparing(byId);
    }
}
