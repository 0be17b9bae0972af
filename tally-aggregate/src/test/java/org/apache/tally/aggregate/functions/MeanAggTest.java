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

import org.apache.tally.block.ColumnarBlock;
import org.apache.tally.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.apache.tally.aggregate.AggregationTestUtils.aggregate;
import static org.apache.tally.testutils.block.BlockTestUtils.singleColumnBlocks;
import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link MeanAgg}. */
class MeanAggTest {

    private static final List<ColumnarBlock> BLOCKS =
            singleColumnBlocks(
                    "x",
                    DataTypes.INT(),
                    Arrays.asList(Arrays.asList(1, 2, null), Arrays.asList(3, null)));

    @Test
    void testMean() {
        MeanAgg mean = new MeanAgg("x");
        assertThat(mean.getName()).isEqualTo("mean(x)");
        assertThat(aggregate(mean, BLOCKS)).isEqualTo(2.0d);
    }

    @Test
    void testNullPropagation() {
        assertThat(aggregate(new MeanAgg("x", false, null), BLOCKS)).isNull();
    }

    @Test
    void testAllNullGroup() {
        List<ColumnarBlock> blocks =
                singleColumnBlocks(
                        "x", DataTypes.INT(), Collections.singletonList(Arrays.asList(null, null)));
        assertThat(aggregate(new MeanAgg("x"), blocks)).isNull();
    }

    @Test
    void testEmptyBlocksDoNotPoison() {
        List<ColumnarBlock> blocks =
                singleColumnBlocks(
                        "x",
                        DataTypes.INT(),
                        Arrays.asList(Arrays.asList(4, 6), Collections.emptyList()));
        assertThat(aggregate(new MeanAgg("x", false, null), blocks)).isEqualTo(5.0d);

        List<ColumnarBlock> onlyEmpty =
                singleColumnBlocks(
                        "x", DataTypes.INT(), Collections.singletonList(Collections.emptyList()));
        assertThat(aggregate(new MeanAgg("x", false, null), onlyEmpty)).isNaN();
    }

    @Test
    void testDecimals() {
        List<ColumnarBlock> blocks =
                singleColumnBlocks(
                        "x",
                        DataTypes.DECIMAL(),
                        Arrays.asList(
                                Arrays.asList(new BigDecimal("1.5")),
                                Arrays.asList(new BigDecimal("2.5"))));
        assertThat(aggregate(new MeanAgg("x"), blocks)).isEqualTo(2.0d);
    }

    @Test
    void testMergeState() {
        MeanAgg.MeanState merged =
                new MeanAgg("x")
                        .merge(new MeanAgg.MeanState(3L, 2L), new MeanAgg.MeanState(3L, 1L));
        assertThat(merged).isEqualTo(new MeanAgg.MeanState(6L, 3L));
    }
}
