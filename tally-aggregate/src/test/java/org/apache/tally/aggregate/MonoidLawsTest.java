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

package org.apache.tally.aggregate;

import org.apache.tally.aggregate.functions.AbsMaxAgg;
import org.apache.tally.aggregate.functions.CountAgg;
import org.apache.tally.aggregate.functions.MaxAgg;
import org.apache.tally.aggregate.functions.MeanAgg;
import org.apache.tally.aggregate.functions.MinAgg;
import org.apache.tally.aggregate.functions.QuantileAgg;
import org.apache.tally.aggregate.functions.StdAgg;
import org.apache.tally.aggregate.functions.SumAgg;
import org.apache.tally.aggregate.functions.UniqueAgg;
import org.apache.tally.block.ColumnarBlock;
import org.apache.tally.types.DataTypes;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.apache.tally.testutils.block.BlockTestUtils.singleColumnBlock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/** Checks that every aggregation combines partial results as a commutative monoid. */
class MonoidLawsTest {

    private static final List<ColumnarBlock> DOUBLES =
            Arrays.asList(
                    singleColumnBlock("x", DataTypes.DOUBLE(), 1.5d, -4.0d, 2.0d),
                    singleColumnBlock("x", DataTypes.DOUBLE(), 7.25d, null),
                    singleColumnBlock("x", DataTypes.DOUBLE(), Collections.emptyList()),
                    singleColumnBlock("x", DataTypes.DOUBLE(), (Object) null),
                    singleColumnBlock("x", DataTypes.DOUBLE(), 0.5d));

    private static final List<ColumnarBlock> BIGINTS =
            Arrays.asList(
                    singleColumnBlock("x", DataTypes.BIGINT(), 12L, -40L),
                    singleColumnBlock("x", DataTypes.BIGINT(), 3L, null),
                    singleColumnBlock("x", DataTypes.BIGINT(), Collections.emptyList()),
                    singleColumnBlock("x", DataTypes.BIGINT(), Long.MAX_VALUE / 4));

    private static final List<ColumnarBlock> BIGINT_EXTREMES =
            Arrays.asList(
                    singleColumnBlock("x", DataTypes.BIGINT(), Long.MIN_VALUE, 1L),
                    singleColumnBlock("x", DataTypes.BIGINT(), Long.MAX_VALUE, null),
                    singleColumnBlock("x", DataTypes.BIGINT(), -3L));

    private static final List<ColumnarBlock> DECIMALS =
            Arrays.asList(
                    singleColumnBlock(
                            "x", DataTypes.DECIMAL(), new BigDecimal("1.25"), new BigDecimal("-3")),
                    singleColumnBlock("x", DataTypes.DECIMAL(), new BigDecimal("0.10"), null),
                    singleColumnBlock("x", DataTypes.DECIMAL(), Collections.emptyList()),
                    singleColumnBlock("x", DataTypes.DECIMAL(), new BigDecimal("42.5")));

    private static final List<ColumnarBlock> STRINGS =
            Arrays.asList(
                    singleColumnBlock("x", DataTypes.STRING(), "pear", "apple"),
                    singleColumnBlock("x", DataTypes.STRING(), "fig", null),
                    singleColumnBlock("x", DataTypes.STRING(), Collections.emptyList()),
                    singleColumnBlock("x", DataTypes.STRING(), "zucchini"));

    private static final List<ColumnarBlock> DATES =
            Arrays.asList(
                    singleColumnBlock("x", DataTypes.DATE(), LocalDate.of(2024, 3, 1)),
                    singleColumnBlock("x", DataTypes.DATE(), LocalDate.of(1999, 12, 31), null),
                    singleColumnBlock("x", DataTypes.DATE(), Collections.emptyList()),
                    singleColumnBlock("x", DataTypes.DATE(), LocalDate.of(2010, 7, 4)));

    private static final List<ColumnarBlock> BOOLEANS =
            Arrays.asList(
                    singleColumnBlock("x", DataTypes.BOOLEAN(), true),
                    singleColumnBlock("x", DataTypes.BOOLEAN(), false, null),
                    singleColumnBlock("x", DataTypes.BOOLEAN(), Collections.emptyList()),
                    singleColumnBlock("x", DataTypes.BOOLEAN(), true, true));

    static Stream<Arguments> functions() {
        List<Arguments> arguments = new ArrayList<>();
        for (boolean ignoreNulls : new boolean[] {true, false}) {
            add(
                    arguments,
                    "DOUBLE",
                    DOUBLES,
                    new CountAgg("x", ignoreNulls, null),
                    new SumAgg("x", ignoreNulls, null),
                    new MinAgg("x", ignoreNulls, null),
                    new MaxAgg("x", ignoreNulls, null),
                    new MeanAgg("x", ignoreNulls, null),
                    new StdAgg("x", 1, ignoreNulls, null),
                    new AbsMaxAgg("x", ignoreNulls, null),
                    new QuantileAgg("x", 0.3, ignoreNulls, null),
                    new UniqueAgg("x", ignoreNulls, null));
            add(
                    arguments,
                    "BIGINT",
                    BIGINTS,
                    new SumAgg("x", ignoreNulls, null),
                    new MinAgg("x", ignoreNulls, null),
                    new AbsMaxAgg("x", ignoreNulls, null));
            add(arguments, "BIGINT", BIGINT_EXTREMES, new AbsMaxAgg("x", ignoreNulls, null));
            add(
                    arguments,
                    "DECIMAL",
                    DECIMALS,
                    new SumAgg("x", ignoreNulls, null),
                    new MeanAgg("x", ignoreNulls, null),
                    new MaxAgg("x", ignoreNulls, null));
            for (Map.Entry<String, List<ColumnarBlock>> entry : orderableColumns().entrySet()) {
                add(
                        arguments,
                        entry.getKey(),
                        entry.getValue(),
                        new MinAgg("x", ignoreNulls, null),
                        new MaxAgg("x", ignoreNulls, null),
                        new UniqueAgg("x", ignoreNulls, null));
            }
        }
        return arguments.stream();
    }

    private static Map<String, List<ColumnarBlock>> orderableColumns() {
        Map<String, List<ColumnarBlock>> columns = new LinkedHashMap<>();
        columns.put("STRING", STRINGS);
        columns.put("DATE", DATES);
        columns.put("BOOLEAN", BOOLEANS);
        return columns;
    }

    private static void add(
            List<Arguments> arguments,
            String type,
            List<ColumnarBlock> blocks,
            AggregateFunction<?, ?>... functions) {
        for (AggregateFunction<?, ?> function : functions) {
            String description =
                    String.format(
                            "%s on %s, ignoreNulls=%s",
                            function.getName(), type, function.isIgnoreNulls());
            arguments.add(Arguments.of(description, function, blocks));
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("functions")
    void testZeroIsIdentity(
            String description, AggregateFunction<?, ?> function, List<ColumnarBlock> blocks) {
        checkIdentity(function, blocks);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("functions")
    void testCombineIsAssociative(
            String description, AggregateFunction<?, ?> function, List<ColumnarBlock> blocks) {
        checkAssociativity(function, blocks);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("functions")
    void testCombineIsCommutative(
            String description, AggregateFunction<?, ?> function, List<ColumnarBlock> blocks) {
        checkCommutativity(function, blocks);
    }

    private static <A, R> void checkIdentity(
            AggregateFunction<A, R> function, List<ColumnarBlock> blocks) {
        for (ColumnarBlock block : blocks) {
            Accumulator<A> partial = function.aggregateBlock(block);
            if (!partial.hasValue()) {
                continue;
            }
            R expected = function.finalizeResult(partial);
            assertResult(
                    function.finalizeResult(function.combine(function.zero(), partial)), expected);
            assertResult(
                    function.finalizeResult(function.combine(partial, function.zero())), expected);
        }
    }

    private static <A, R> void checkAssociativity(
            AggregateFunction<A, R> function, List<ColumnarBlock> blocks) {
        for (ColumnarBlock a : blocks) {
            for (ColumnarBlock b : blocks) {
                for (ColumnarBlock c : blocks) {
                    Accumulator<A> x = function.aggregateBlock(a);
                    Accumulator<A> y = function.aggregateBlock(b);
                    Accumulator<A> z = function.aggregateBlock(c);
                    assertResult(
                            function.finalizeResult(
                                    function.combine(function.combine(x, y), z)),
                            function.finalizeResult(
                                    function.combine(x, function.combine(y, z))));
                }
            }
        }
    }

    private static <A, R> void checkCommutativity(
            AggregateFunction<A, R> function, List<ColumnarBlock> blocks) {
        for (ColumnarBlock a : blocks) {
            for (ColumnarBlock b : blocks) {
                Accumulator<A> x = function.aggregateBlock(a);
                Accumulator<A> y = function.aggregateBlock(b);
                assertResult(
                        function.finalizeResult(function.combine(x, y)),
                        function.finalizeResult(function.combine(y, x)));
            }
        }
    }

    static void assertResult(Object actual, Object expected) {
        if (expected instanceof Double && actual instanceof Double) {
            double e = (Double) expected;
            if (Double.isNaN(e)) {
                assertThat((Double) actual).isNaN();
            } else {
                assertThat((Double) actual).isCloseTo(e, within(1e-9 * Math.max(1.0, Math.abs(e))));
            }
        } else if (expected instanceof BigDecimal && actual instanceof BigDecimal) {
            assertThat((BigDecimal) actual).isEqualByComparingTo((BigDecimal) expected);
        } else {
            assertThat(actual).isEqualTo(expected);
        }
    }
}
