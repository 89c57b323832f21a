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

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Factory methods for common {@link ChangeGate}s.
 * <p>
 * Every gate publishes the first snapshot. After that they compare values only; wrap a
 * gate with {@link #withProvenance(ChangeGate)} to also publish when a contributing feed
 * changes state.
 */
public final class ChangeGates {

    private ChangeGates() {
    }

    /**
     * Publishes unless the values are equal according to the given predicate.
     */
    public static <T> ChangeGate<T> byEquality(BiPredicate<? super T, ? super T> equality) {
        Objects.requireNonNull(equality, "equality cannot be null");
        return (previous, next) -> previous == null || !equality.test(previous.value(), next.value());
    }

    /**
     * Publishes when {@link Object#equals(Object)} reports a different value.
     */
    public static <T> ChangeGate<T> valueEquality() {
        return byEquality(Objects::equals);
    }

    /**
     * Publishes when the extracted key changes.
     */
    public static <T> ChangeGate<T> comparing(Function<? super T, ?> keyExtractor) {
        return byEquality((a, b) -> Objects.equals(keyExtractor.apply(a), keyExtractor.apply(b)));
    }

    /**
     * Publishes when the extracted amount changes numerically; {@code 40.0} and
     * {@code 40.00} are the same amount.
     */
    public static <T> ChangeGate<T> numeric(Function<? super T, BigDecimal> amount) {
        return byEquality((a, b) -> compareAmounts(amount.apply(a), amount.apply(b)));
    }

    /**
     * Publishes when set membership of the extracted collection changes. Order and
     * duplicates are ignored.
     */
    public static <T> ChangeGate<T> setEquality(Function<? super T, ? extends Collection<?>> members) {
        return byEquality((a, b) -> new HashSet<>(members.apply(a)).equals(new HashSet<>(members.apply(b))));
    }

    /**
     * Also publishes when the state of any contributing feed changed.
     */
    public static <T> ChangeGate<T> withProvenance(ChangeGate<T> delegate) {
        return (previous, next) -> previous == null
                || !previous.provenance().equals(next.provenance())
                || delegate.shouldPublish(previous, next);
    }

    private static boolean compareAmounts(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
