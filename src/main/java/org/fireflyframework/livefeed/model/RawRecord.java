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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable value decoded from a remote document.
 * <p>
 * The document identifier is unique within a feed and is the key used to reconcile
 * updates and deletes in the feed's working set. Typed accessors never throw on a
 * missing or mistyped field; they return an empty {@link Optional} so aggregators can
 * exclude the record instead of guessing a value.
 *
 * @param feedKey    key of the feed that delivered the record
 * @param documentId identifier of the source document
 * @param fields     document fields; null values are allowed
 */
public record RawRecord(
        String feedKey,
        String documentId,
        Map<String, Object> fields
) {

    public RawRecord {
        Objects.requireNonNull(feedKey, "feedKey cannot be null");
        Objects.requireNonNull(documentId, "documentId cannot be null");
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawRecord of(String feedKey, String documentId, Map<String, Object> fields) {
        return new RawRecord(feedKey, documentId, fields);
    }

    /**
     * Returns the raw value of a field.
     *
     * @param field the field name
     * @return the value, or null if absent
     */
    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    public Optional<String> string(String field) {
        Object value = fields.get(field);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    /**
     * Reads a numeric field as an exact decimal.
     * <p>
     * Doubles are converted through their canonical string form so that {@code 25.5}
     * becomes {@code 25.5} and not its binary expansion.
     */
    public Optional<BigDecimal> decimal(String field) {
        Object value = fields.get(field);
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(BigDecimal.valueOf(number.longValue()));
        }
        if (value instanceof String text) {
            try {
                return Optional.of(new BigDecimal(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Long> longValue(String field) {
        Object value = fields.get(field);
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a timestamp field. Accepts {@link Instant}, {@link Date}, epoch milliseconds
     * and ISO-8601 strings.
     */
    public Optional<Instant> instant(String field) {
        Object value = fields.get(field);
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Number number) {
            return Optional.of(Instant.ofEpochMilli(number.longValue()));
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Instant.parse(text.trim()));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public List<String> stringList(String field) {
        Object value = fields.get(field);
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
        }
        return List.of();
    }
}
