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
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.Objects;

/**
 * A single field predicate of a {@link QuerySpec}.
 * <p>
 * The same filter is evaluated server-side by the store and client-side when a feed
 * runs its degraded query and has to re-filter the returned page.
 *
 * @param field    the document field
 * @param operator comparison operator
 * @param value    operand; a collection for {@link Operator#IN}
 */
public record FieldFilter(
        String field,
        Operator operator,
        Object value
) {

    public enum Operator {
        EQ, NE, LT, LTE, GT, GTE, IN, ARRAY_CONTAINS;

        public boolean isEquality() {
            return this == EQ || this == IN || this == ARRAY_CONTAINS;
        }
    }

    public FieldFilter {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");
        if (operator == Operator.IN && !(value instanceof Collection<?>)) {
            throw new IllegalArgumentException("IN filter on '" + field + "' requires a collection operand");
        }
    }

    public boolean test(RawRecord record) {
        return test(record.fields());
    }

    /**
     * Evaluates the filter against raw document fields. A missing field never matches,
     * except for {@link Operator#NE}.
     */
    public boolean test(Map<String, Object> fields) {
        Object actual = fields.get(field);
        return switch (operator) {
            case EQ -> actual != null && compare(actual, value) == 0;
            case NE -> actual == null || compare(actual, value) != 0;
            case LT -> actual != null && compare(actual, value) < 0;
            case LTE -> actual != null && compare(actual, value) <= 0;
            case GT -> actual != null && compare(actual, value) > 0;
            case GTE -> actual != null && compare(actual, value) >= 0;
            case IN -> actual != null && ((Collection<?>) value).stream()
                    .anyMatch(candidate -> compare(actual, candidate) == 0);
            case ARRAY_CONTAINS -> actual instanceof Collection<?> values && values.stream()
                    .anyMatch(element -> element != null && compare(element, value) == 0);
        };
    }

    /**
     * Orders two field values. Numbers compare by exact decimal value, timestamps by
     * instant, everything else by string form. NaN and infinities compare as doubles.
     */
    static int compare(Object left, Object right) {
        if (left == null || right == null) {
            return left == right ? 0 : (left == null ? -1 : 1);
        }
        if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
            if (!isFinite(leftNumber) || !isFinite(rightNumber)) {
                return Double.compare(leftNumber.doubleValue(), rightNumber.doubleValue());
            }
            return toDecimal(leftNumber).compareTo(toDecimal(rightNumber));
        }
        Instant leftInstant = toInstant(left);
        Instant rightInstant = toInstant(right);
        if (leftInstant != null && rightInstant != null) {
            return leftInstant.compareTo(rightInstant);
        }
        return left.toString().compareTo(right.toString());
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return null;
    }
}
