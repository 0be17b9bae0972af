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

import org.apache.tally.aggregate.Accumulator;
import org.apache.tally.block.ColumnarBlock;
import org.apache.tally.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.apache.tally.aggregate.AggregationTestUtils.aggregate;
import static org.apache.tally.testutils.block.BlockTestUtils.singleColumnBlock;
import static org.apache.tally.testutils.block.BlockTestUtils.singleColumnBlocks;
import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link MinAgg} and {@link MaxAgg}. */
class MinMaxAggTest {

    private static final List<ColumnarBlock> INTS =
            singleColumnBlocks(
                    "x",
                    DataTypes.INT(),
                    Arrays.asList(
                            Arrays.asList(3, 1, null), Collections.emptyList(), Arrays.asList(7)));

    @Test
    void testMinMaxKeepValueType() {
        assertThat(aggregate(new MinAgg("x"), INTS)).isEqualTo(1);
        assertThat(aggregate(new MaxAgg("x"), INTS)).isEqualTo(7);
    }

    @Test
    void testNullPropagation() {
        assertThat(aggregate(new MinAgg("x", false, null), INTS)).isNull();
        assertThat(aggregate(new MaxAgg("x", false, null), INTS)).isNull();
    }

    @Test
    void testAllNullGroup() {
        List<ColumnarBlock> blocks =
                singleColumnBlocks(
                        "x",
                        DataTypes.DOUBLE(),
                        Collections.singletonList(Arrays.asList(null, null)));
        assertThat(aggregate(new MinAgg("x"), blocks)).isNull();
        assertThat(aggregate(new MaxAgg("x"), blocks)).isNull();
    }

    @Test
    void testOrderableNonNumericValues() {
        List<ColumnarBlock> strings =
                singleColumnBlocks(
                        "s",
                        DataTypes.STRING(),
                        Arrays.asList(Arrays.asList("pear", null), Arrays.asList("apple", "fig")));
        assertThat(aggregate(new MinAgg("s"), strings)).isEqualTo("apple");
        assertThat(aggregate(new MaxAgg("s"), strings)).isEqualTo("pear");

        List<ColumnarBlock> dates =
                singleColumnBlocks(
                        "d",
                        DataTypes.DATE(),
                        Arrays.asList(
                                Arrays.asList(LocalDate.of(2024, 3, 1)),
                                Arrays.asList(LocalDate.of(2023, 12, 31))));
        assertThat(aggregate(new MinAgg("d"), dates)).isEqualTo(LocalDate.of(2023, 12, 31));
    }

    @Test
    void testNonNumericValuesWithoutIgnoringNulls() {
        List<ColumnarBlock> strings =
                singleColumnBlocks(
                        "s",
                        DataTypes.STRING(),
                        Arrays.asList(Arrays.asList("b", "a"), Arrays.asList("c")));
        assertThat(aggregate(new MinAgg("s", false, null), strings)).isEqualTo("a");
        assertThat(aggregate(new MaxAgg("s", false, null), strings)).isEqualTo("c");

        List<ColumnarBlock> booleans =
                singleColumnBlocks(
                        "b",
                        DataTypes.BOOLEAN(),
                        Arrays.asList(Arrays.asList(true), Arrays.asList(false, true)));
        assertThat(aggregate(new MinAgg("b", false, null), booleans)).isEqualTo(false);
        assertThat(aggregate(new MaxAgg("b", false, null), booleans)).isEqualTo(true);

        List<ColumnarBlock> timestamps =
                singleColumnBlocks(
                        "t",
                        DataTypes.TIMESTAMP(),
                        Arrays.asList(
                                Arrays.asList(LocalDateTime.of(2024, 1, 1, 12, 0)),
                                Arrays.asList(LocalDateTime.of(2024, 1, 1, 8, 30))));
        assertThat(aggregate(new MinAgg("t", false, null), timestamps))
                .isEqualTo(LocalDateTime.of(2024, 1, 1, 8, 30));
    }

    @Test
    void testZeroIsNeutralForNonNumericPartials() {
        MinAgg min = new MinAgg("s", false, null);
        Accumulator<Object> partial =
                min.aggregateBlock(singleColumnBlock("s", DataTypes.STRING(), "b", "a"));
        assertThat(min.finalizeResult(min.combine(min.zero(), partial))).isEqualTo("a");
        assertThat(min.finalizeResult(min.combine(partial, min.zero()))).isEqualTo("a");

        MaxAgg max = new MaxAgg("d", false, null);
        Accumulator<Object> dates =
                max.aggregateBlock(
                        singleColumnBlock("d", DataTypes.DATE(), LocalDate.of(2020, 5, 17)));
        assertThat(max.finalizeResult(max.combine(max.zero(), dates)))
                .isEqualTo(LocalDate.of(2020, 5, 17));
    }

    @Test
    void testNames() {
        assertThat(new MinAgg("x").getName()).isEqualTo("min(x)");
        assertThat(new MaxAgg("x", true, "highest").getName()).isEqualTo("highest");
    }
}
