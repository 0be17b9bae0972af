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
import org.apache.tally.exception.TooManyValuesException;
import org.apache.tally.metadata.AggregateKind;
import org.apache.tally.types.DataType;
import org.apache.tally.types.DataTypeChecks;
import org.apache.tally.utils.ValueUtils;

import javax.annotation.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Quantile aggregator - computes the q-th quantile by linear interpolation between the two closest
 * ranks (the "R-7" estimator also used by NumPy and pandas). Interpolated results are rounded to
 * five decimal places; if the rank is exact the value itself is returned.
 *
 * <p>The accumulator retains every value of the group, so memory grows with the group size. Pass
 * a {@code maxValues} bound to fail groups that grow beyond it.
 */
public class QuantileAgg extends AbstractAggregateFunction<List<Object>, Object> {

    public static final double DEFAULT_Q = 0.5;

    private static final int ROUNDING_SCALE = 5;

    private final double q;
    @Nullable private final Integer maxValues;

    public QuantileAgg(String targetColumn) {
        this(targetColumn, DEFAULT_Q, true, null, null);
    }

    public QuantileAgg(
            @Nullable String targetColumn, double q, boolean ignoreNulls, @Nullable String alias) {
        this(targetColumn, q, ignoreNulls, alias, null);
    }

    /**
     * Creates a quantile aggregation.
     *
     * @param q the quantile, between 0 and 1 inclusive
     * @param maxValues the maximum number of values retained for a group, or null for no bound
     * @throws InvalidConfigException if q or maxValues is out of range
     */
    public QuantileAgg(
            @Nullable String targetColumn,
            double q,
            boolean ignoreNulls,
            @Nullable String alias,
            @Nullable Integer maxValues) {
        super(
                resolveName(alias, AggregateKind.QUANTILE, targetColumn),
                targetColumn,
                ignoreNulls,
                ArrayList::new);
        if (!(q >= 0.0 && q <= 1.0)) {
            throw new InvalidConfigException(
                    String.format("Quantile must be between 0 and 1 inclusive (got %s)", q));
        }
        if (maxValues != null && maxValues <= 0) {
            throw new InvalidConfigException(
                    String.format("Maximum number of values must be positive (got %s)", maxValues));
        }
        this.q = q;
        this.maxValues = maxValues;
    }

    public double getQ() {
        return q;
    }

    @Override
    protected List<Object> aggregate(BlockAccessor block) {
        return checkSize(block.column(getTargetColumn().orElse(null)));
    }

    @Override
    protected List<Object> merge(List<Object> current, List<Object> next) {
        return checkSize(mergeValues(current, next));
    }

    @Nullable
    @Override
    protected Object finish(List<Object> accumulator) {
        List<Object> values = new ArrayList<>(accumulator.size());
        for (Object value : accumulator) {
            if (value != null) {
                values.add(value);
            } else if (!isIgnoreNulls()) {
                return null;
            }
        }
        if (values.isEmpty()) {
            return null;
        }

        values.sort(ValueUtils::compare);
        double k = (values.size() - 1) * q;
        double f = Math.floor(k);
        double c = Math.ceil(k);
        if (f == c) {
            return values.get((int) k);
        }

        double d0 = ValueUtils.toDouble(values.get((int) f)) * (c - k);
        double d1 = ValueUtils.toDouble(values.get((int) c)) * (k - f);
        return round(d0 + d1);
    }

    @Override
    protected boolean supportsType(DataType dataType) {
        return DataTypeChecks.isNumeric(dataType);
    }

    /**
     * Merges two partial results, either of which may be a list of values or a bare value. Lists
     * are concatenated; bare values are appended unless they are null or an empty string.
     */
    public static List<Object> mergeValues(@Nullable Object current, @Nullable Object next) {
        if (current instanceof List && next instanceof List) {
            List<?> left = (List<?>) current;
            List<?> right = (List<?>) next;
            List<Object> merged = new ArrayList<>(left.size() + right.size());
            merged.addAll(left);
            merged.addAll(right);
            return merged;
        }
        if (current instanceof List) {
            List<Object> merged = new ArrayList<>((List<?>) current);
            appendIfPresent(merged, next);
            return merged;
        }
        if (next instanceof List) {
            List<Object> merged = new ArrayList<>((List<?>) next);
            appendIfPresent(merged, current);
            return merged;
        }
        List<Object> merged = new ArrayList<>(2);
        appendIfPresent(merged, current);
        appendIfPresent(merged, next);
        return merged;
    }

    private static void appendIfPresent(List<Object> values, @Nullable Object value) {
        if (value != null && !"".equals(value)) {
            values.add(value);
        }
    }

    private List<Object> checkSize(List<Object> values) {
        if (maxValues != null && values.size() > maxValues) {
            throw new TooManyValuesException(
                    String.format(
                            "Aggregation %s retains %s values, exceeding the maximum of %s.",
                            getName(), values.size(), maxValues));
        }
        return values;
    }

    private static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(ROUNDING_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
