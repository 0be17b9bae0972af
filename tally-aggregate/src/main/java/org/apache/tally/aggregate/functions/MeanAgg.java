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

package org.apache.tally.aggregate.functions;

import org.apache.tally.aggregate.AbstractAggregateFunction;
import org.apache.tally.block.BlockAccessor;
import org.apache.tally.metadata.AggregateKind;
import org.apache.tally.types.DataType;
import org.apache.tally.types.DataTypeChecks;
import org.apache.tally.utils.ValueUtils;

import javax.annotation.Nullable;

import java.util.Objects;

/**
 * Mean aggregator - computes the arithmetic mean of numeric values from a sum and a count.
 *
 * <p>A block without rows contributes nothing, also when nulls are not ignored: it does not turn
 * the result into null. Only a block that holds a null does that, so the result does not depend
 * on how the rows are split into blocks.
 */
public class MeanAgg extends AbstractAggregateFunction<MeanAgg.MeanState, Double> {

    public MeanAgg(String targetColumn) {
        this(targetColumn, true, null);
    }

    public MeanAgg(@Nullable String targetColumn, boolean ignoreNulls, @Nullable String alias) {
        super(
                resolveName(alias, AggregateKind.MEAN, targetColumn),
                targetColumn,
                ignoreNulls,
                () -> new MeanState(0L, 0L));
    }

    @Nullable
    @Override
    protected MeanState aggregate(BlockAccessor block) {
        String column = getTargetColumn().orElse(null);
        long count = block.count(column, isIgnoreNulls());
        if (count == 0) {
            // all values are null
            return null;
        }
        Number sum = block.sum(column, isIgnoreNulls());
        if (sum == null) {
            // nulls are not ignored and the block holds one
            return null;
        }
        return new MeanState(sum, count);
    }

    @Override
    protected MeanState merge(MeanState current, MeanState next) {
        return new MeanState(
                ValueUtils.add(current.getSum(), next.getSum()),
                current.getCount() + next.getCount());
    }

    @Override
    protected Double finish(MeanState accumulator) {
        if (accumulator.getCount() == 0) {
            return Double.NaN;
        }
        return accumulator.getSum().doubleValue() / accumulator.getCount();
    }

    @Override
    protected boolean supportsType(DataType dataType) {
        return DataTypeChecks.isNumeric(dataType);
    }

    /** Sum and count of the values seen so far. */
    public static final class MeanState {
        private final Number sum;
        private final long count;

        public MeanState(Number sum, long count) {
            this.sum = sum;
            this.count = count;
        }

        public Number getSum() {
            return sum;
        }

        public long getCount() {
            return count;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            MeanState that = (MeanState) o;
            return count == that.count && Objects.equals(sum, that.sum);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sum, count);
        }

        @Override
        public String toString() {
            return "MeanState{sum=" + sum + ", count=" + count + '}';
        }
    }
}
