/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.tally.aggregate.legacy;

import org.apache.tally.aggregate.Accumulator;
import org.apache.tally.aggregate.AggregateFunction;
import org.apache.tally.annotation.PublicEvolving;
import org.apache.tally.block.BlockAccessor;
import org.apache.tally.exception.InvalidConfigException;
import org.apache.tally.metadata.Schema;

import javax.annotation.Nullable;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * A user-defined aggregation built from plain functions, applied either row by row or block by
 * block.
 *
 * <pre>{@code
 * RowAggregateFunction<String, Long, Long> rows =
 *         RowAggregateFunction.<String, Long, Long>builder()
 *                 .name("rows")
 *                 .init(key -> 0L)
 *                 .accumulateRow((acc, row) -> acc + 1)
 *                 .merge(Long::sum)
 *                 .build();
 * AggregateFunction<Long, Long> perGroup = rows.forKey("group-1");
 * }</pre>
 *
 * <p>Unlike the built-in aggregations, the functions see null values as they are; handling them is
 * up to the caller. The initial accumulator may depend on the group key.
 *
 * @param <K> the group key type
 * @param <A> the accumulator type
 * @param <R> the result type
 * @deprecated implement {@link org.apache.tally.aggregate.AbstractAggregateFunction} instead,
 *     which handles null values and empty blocks consistently.
 */
@Deprecated
@PublicEvolving
public final class RowAggregateFunction<K, A, R> {

    private final String name;
    private final Function<K, A> init;
    private final BinaryOperator<A> merge;
    @Nullable private final BiFunction<A, Map<String, Object>, A> accumulateRow;
    @Nullable private final BiFunction<A, BlockAccessor, A> accumulateBlock;
    @Nullable private final Function<A, R> finalizer;

    private RowAggregateFunction(Builder<K, A, R> builder) {
        this.name = builder.name;
        this.init = builder.init;
        this.merge = builder.merge;
        this.accumulateRow = builder.accumulateRow;
        this.accumulateBlock = builder.accumulateBlock;
        this.finalizer = builder.finalizer;
    }

    public static <K, A, R> Builder<K, A, R> builder() {
        return new Builder<>();
    }

    public String getName() {
        return name;
    }

    /** Returns the aggregation of the group with the given key. */
    public AggregateFunction<A, R> forKey(@Nullable K key) {
        return new KeyedAggregateFunction(key);
    }

    private A accumulate(A accumulator, BlockAccessor block) {
        if (accumulateBlock != null) {
            return accumulateBlock.apply(accumulator, block);
        }
        A result = accumulator;
        Iterator<Map<String, Object>> rows = block.rows();
        while (rows.hasNext()) {
            result = accumulateRow.apply(result, rows.next());
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private R finish(A accumulator) {
        return finalizer == null ? (R) accumulator : finalizer.apply(accumulator);
    }

    @Override
    public String toString() {
        return "RowAggregateFunction{name='" + name + "'}";
    }

    // --------------------------------------------------------------------------------------------

    private final class KeyedAggregateFunction implements AggregateFunction<A, R> {

        @Nullable private final K key;

        private KeyedAggregateFunction(@Nullable K key) {
            this.key = key;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Optional<String> getTargetColumn() {
            return Optional.empty();
        }

        @Override
        public boolean isIgnoreNulls() {
            return false;
        }

        @Override
        public Accumulator<A> zero() {
            return wrap(init.apply(key));
        }

        @Override
        public Accumulator<A> aggregateBlock(BlockAccessor block) {
            if (block.numRows() == 0) {
                return Accumulator.empty();
            }
            return wrap(accumulate(init.apply(key), block));
        }

        @Override
        public Accumulator<A> combine(Accumulator<A> current, Accumulator<A> next) {
            if (!current.hasValue()) {
                return next;
            }
            if (!next.hasValue()) {
                return current;
            }
            return wrap(merge.apply(current.getValue(), next.getValue()));
        }

        @Nullable
        @Override
        public R finalizeResult(Accumulator<A> accumulator) {
            return accumulator.hasValue() ? finish(accumulator.getValue()) : null;
        }

        @Override
        public void validate(Schema schema) {
            // the functions are opaque, nothing to check
        }

        private Accumulator<A> wrap(@Nullable A value) {
            return value == null ? Accumulator.empty() : Accumulator.of(value);
        }

        @Override
        public String toString() {
            return "RowAggregateFunction{name='" + name + "', key=" + key + '}';
        }
    }

    // --------------------------------------------------------------------------------------------

    /** Builder for {@link RowAggregateFunction}. */
    public static final class Builder<K, A, R> {

        private String name;
        private Function<K, A> init;
        private BinaryOperator<A> merge;
        private BiFunction<A, Map<String, Object>, A> accumulateRow;
        private BiFunction<A, BlockAccessor, A> accumulateBlock;
        private Function<A, R> finalizer;

        private Builder() {}

        public Builder<K, A, R> name(String name) {
            this.name = name;
            return this;
        }

        /** Sets the function creating the initial accumulator of a group from its key. */
        public Builder<K, A, R> init(Function<K, A> init) {
            this.init = init;
            return this;
        }

        public Builder<K, A, R> merge(BinaryOperator<A> merge) {
            this.merge = merge;
            return this;
        }

        /** Sets the function folding a single row into the accumulator. */
        public Builder<K, A, R> accumulateRow(BiFunction<A, Map<String, Object>, A> accumulateRow) {
            this.accumulateRow = accumulateRow;
            return this;
        }

        /** Sets the function folding a whole block into the accumulator. */
        public Builder<K, A, R> accumulateBlock(BiFunction<A, BlockAccessor, A> accumulateBlock) {
            this.accumulateBlock = accumulateBlock;
            return this;
        }

        public Builder<K, A, R> finalizer(Function<A, R> finalizer) {
            this.finalizer = finalizer;
            return this;
        }

        /**
         * Builds the aggregation.
         *
         * @throws InvalidConfigException if the name, init or merge is missing, or if not exactly
         *     one of accumulateRow and accumulateBlock is set
         */
        public RowAggregateFunction<K, A, R> build() {
            if (name == null || name.isEmpty()) {
                throw new InvalidConfigException(
                        String.format(
                                "Non-empty string has to be provided as name (got %s)", name));
            }
            if (init == null) {
                throw new InvalidConfigException("An init function has to be provided.");
            }
            if (merge == null) {
                throw new InvalidConfigException("A merge function has to be provided.");
            }
            if ((accumulateRow == null) == (accumulateBlock == null)) {
                throw new InvalidConfigException(
                        "Exactly one of accumulateRow and accumulateBlock has to be provided.");
            }
            return new RowAggregateFunction<>(this);
        }
    }
}
