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

package org.fireflyframework.livefeed.aggregation;

import org.fireflyframework.livefeed.model.RawRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Scalar reductions over the records of one feed.
 * <p>
 * Monetary amounts are summed as whole minor units (cents) in a {@code long}, so adding
 * many fractional amounts never drifts. Convert back with {@link #fromMinorUnits(long)}.
 */
public final class FoldAggregations {

    /**
     * Decimal places of a minor unit.
     */
    public static final int MONEY_SCALE = 2;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private FoldAggregations() {
    }

    /**
     * Converts an amount to minor units, rounding half-even to two decimals.
     *
     * @throws ArithmeticException if the amount does not fit in a long
     */
    public static long toMinorUnits(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_EVEN)
                .movePointRight(MONEY_SCALE)
                .longValueExact();
    }

    public static BigDecimal fromMinorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, MONEY_SCALE);
    }

    /**
     * Sums the amounts of the given records in minor units. Records without an amount are
     * skipped.
     *
     * @param records the records to fold
     * @param amount  extracts the amount of one record
     * @return the sum in minor units
     */
    public static long sumMinorUnits(Iterable<RawRecord> records, Function<RawRecord, Optional<BigDecimal>> amount) {
        long total = 0;
        for (RawRecord record : records) {
            Optional<BigDecimal> value = amount.apply(record);
            if (value.isPresent()) {
                total = Math.addExact(total, toMinorUnits(value.get()));
            }
        }
        return total;
    }

    public static long count(Iterable<RawRecord> records, Predicate<RawRecord> predicate) {
        long count = 0;
        for (RawRecord record : records) {
            if (predicate.test(record)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Sums an integral field; records without the field are skipped.
     */
    public static long sumLong(Iterable<RawRecord> records, String field) {
        long total = 0;
        for (RawRecord record : records) {
            total = Math.addExact(total, record.longValue(field).orElse(0L));
        }
        return total;
    }

    /**
     * Computes {@code conversions / max(views, 1) * 100} with two decimals.
     * <p>
     * With no views the divisor is floored to one rather than guarded to zero, so the rate
     * equals {@code conversions * 100}; with no conversions it is 0.
     */
    public static BigDecimal conversionRate(long conversions, long views) {
        return BigDecimal.valueOf(conversions)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(Math.max(views, 1L)), MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
