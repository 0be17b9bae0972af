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
import org.apache.tally.exception.InvalidConfigException;
import org.apache.tally.metadata.AggregateKind;
import org.apache.tally.types.DataType;
import org.apache.tally.types.DataTypeChecks;

import javax.annotation.Nullable;

import java.util.Objects;

/**
 * Standard deviation aggregator.
 *
 * <p>Each block contributes its count, mean and sum of squared differences from that mean (M2).
 * Partial results are merged with the parallel variant of Welford's online algorithm (Chan et
 * al.), which is numerically stable and needs a single pass over the data. See <a
 * href="https://en.wikipedia.org/wiki/Algorithms_for_calculating_variance#Parallel_algorithm">
 * Algorithms for calculating variance</a>.
 *
 * <p>The result may differ in the last digits from libraries that use a two-pass algorithm.
 *
 * <p>A block without rows contributes nothing, also when nulls are not ignored: it does not turn
 * the result into null. Only a block that holds a null does that, so the result does not depend
 * on how the rows are split into blocks.
 */
public class StdAgg extends AbstractAggregateFunction<StdAgg.VarianceState, Double> {

    public static final int DEFAULT_DDOF = 1;

    private final int ddof;

    public StdAgg(String targetColumn) {
        this(targetColumn, DEFAULT_DDOF, true, null);
    }

    /**
     * Creates a standard deviation aggregation.
     *
     * @param ddof delta degrees of freedom; the divisor is {@code N - ddof}
     * @throws InvalidConfigException if ddof is negative
     */
    public StdAgg(
            @Nullable String targetColumn,
            int ddof,
            boolean ignoreNulls,
            @Nullable String alias) {
        super(
                resolveName(alias, AggregateKind.STD, targetColumn),
                targetColumn,
                ignoreNulls,
                () -> new VarianceState(0.0d, 0.0d, 0L));
        if (ddof < 0) {
            throw new InvalidConfigException(
                    String.format("Delta degrees of freedom must not be negative (got %s)", ddof));
        }
        this.ddof = ddof;
    }

    public int getDdof() {
        return ddof;
    }

    @Nullable
    @Override
    protected VarianceState aggregate(BlockAccessor block) {
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
        double mean = sum.doubleValue() / count;
        Double m2 = block.sumOfSquaredDiffsFromMean(column, isIgnoreNulls(), mean);
        if (m2 == null) {
            return null;
        }
        return new VarianceState(m2, mean, count);
    }

    @Override
    protected VarianceState merge(VarianceState current, VarianceState next) {
        if (current.getCount() == 0) {
            return next;
        } else if (next.getCount() == 0) {
            return current;
        }
        long countA = current.getCount();
        long countB = next.getCount();
        long count = countA + countB;
        double delta = next.getMean() - current.getMean();
        // the weighted mean matches reference libraries in the low-order digits, unlike the
        // equivalent meanA + delta * countB / count
        double mean = (current.getMean() * countA + next.getMean() * countB) / count;
        double m2 =
                current.getM2()
                        + next.getM2()
                        + delta * delta * ((double) countA) * ((double) countB) / count;
        return new VarianceState(m2, mean, count);
    }

    @Override
    protected Double finish(VarianceState accumulator) {
        if (accumulator.getCount() - ddof <= 0) {
            return Double.NaN;
        }
        return Math.sqrt(accumulator.getM2() / (accumulator.getCount() - ddof));
    }

    @Override
    protected boolean supportsType(DataType dataType) {
        return DataTypeChecks.isNumeric(dataType);
    }

    /** Sum of squared differences from the mean, the mean, and the count of values seen so far. */
    public static final class VarianceState {
        private final double m2;
        private final double mean;
        private final long count;

        public VarianceState(double m2, double mean, long count) {
            this.m2 = m2;
            this.mean = mean;
            this.count = count;
        }

        public double getM2() {
            return m2;
        }

        public double getMean() {
            return mean;
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
            VarianceState that = (VarianceState) o;
            return Double.compare(that.m2, m2) == 0
                    && Double.compare(that.mean, mean) == 0
                    && count == that.count;
        }

        @Override
        public int hashCode() {
            return Objects.hash(m2, mean, count);
        }

        @Override
        public String toString() {
            return "VarianceState{m2=" + m2 + ", mean=" + mean + ", count=" + count + '}';
        }
    }
}
