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
import org.apache.tally.exception.InvalidConfigException;
import org.apache.tally.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.apache.tally.aggregate.AggregationTestUtils.aggregate;
import static org.apache.tally.aggregate.AggregationTestUtils.treeReduce;
import static org.apache.tally.testutils.block.BlockTestUtils.singleColumnBlocks;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/** Tests for {@link StdAgg}. */
class StdAggTest {

    private static final List<ColumnarBlock> SINGLE_BLOCK =
            singleColumnBlocks(
                    "x",
                    DataTypes.INT(),
                    Collections.singletonList(Arrays.asList(2, 4, 4, 4, 5, 5, 7, 9)));

    private static final List<ColumnarBlock> SPLIT =
            singleColumnBlocks(
                    "x",
                    DataTypes.INT(),
                    Arrays.asList(
                            Arrays.asList(2, 4, null),
                            Arrays.asList(4),
                            Collections.emptyList(),
                            Arrays.asList(4, 5, 5, 7, 9)));

    @Test
    void testSampleStandardDeviation() {
        StdAgg std = new StdAgg("x");
        assertThat(std.getDdof()).isEqualTo(StdAgg.DEFAULT_DDOF);
        assertThat(aggregate(std, SINGLE_BLOCK)).isCloseTo(2.1380899, within(1e-7));
        assertThat(aggregate(std, SPLIT)).isCloseTo(2.1380899352993947, within(1e-12));
        assertThat(std.finalizeResult(treeReduce(std, SPLIT)))
                .isCloseTo(2.1380899352993947, within(1e-12));
    }

    @Test
    void testPopulationStandardDeviation() {
        StdAgg std = new StdAgg("x", 0, true, "pstd");
        assertThat(std.getName()).isEqualTo("pstd");
        assertThat(aggregate(std, SPLIT)).isCloseTo(2.0d, within(1e-12));
    }

    @Test
    void testNotEnoughValues() {
        List<ColumnarBlock> single =
                singleColumnBlocks(
                        "x", DataTypes.DOUBLE(), Collections.singletonList(Arrays.asList(3.0d)));
        assertThat(aggregate(new StdAgg("x"), single)).isNaN();
        assertThat(aggregate(new StdAgg("x", 0, true, null), single)).isEqualTo(0.0d);
    }

    @Test
    void testNullHandling() {
        assertThat(aggregate(new StdAgg("x", 1, false, null), SPLIT)).isNull();

        List<ColumnarBlock> allNull =
                singleColumnBlocks(
                        "x", DataTypes.INT(), Collections.singletonList(Arrays.asList(null, null)));
        assertThat(aggregate(new StdAgg("x"), allNull)).isNull();
    }

    @Test
    void testEmptyBlocksDoNotPoison() {
        List<ColumnarBlock> blocks =
                singleColumnBlocks(
                        "x",
                        DataTypes.INT(),
                        Arrays.asList(
                                Collections.emptyList(),
                                Arrays.asList(1, 3),
                                Collections.emptyList()));
        assertThat(aggregate(new StdAgg("x", 1, false, null), blocks))
                .isCloseTo(Math.sqrt(2.0d), within(1e-12));
    }

    @Test
    void testMergeWithEmptyState() {
        StdAgg std = new StdAgg("x");
        StdAgg.VarianceState state = new StdAgg.VarianceState(8.0, 3.0, 4L);
        StdAgg.VarianceState zero = new StdAgg.VarianceState(0.0, 0.0, 0L);
        assertThat(std.merge(zero, state)).isSameAs(state);
        assertThat(std.merge(state, zero)).isSameAs(state);
    }

    @Test
    void testMergeMatchesSinglePass() {
        StdAgg std = new StdAgg("x", 0, true, null);
        // [1, 2, 3] and [4, 5]
        StdAgg.VarianceState left = new StdAgg.VarianceState(2.0, 2.0, 3L);
        StdAgg.VarianceState right = new StdAgg.VarianceState(0.5, 4.5, 2L);
        StdAgg.VarianceState merged = std.merge(left, right);
        assertThat(merged.getCount()).isEqualTo(5L);
        assertThat(merged.getMean()).isCloseTo(3.0, within(1e-12));
        assertThat(merged.getM2()).isCloseTo(10.0, within(1e-12));
    }

    @Test
    void testNegativeDdof() {
        assertThatThrownBy(() -> new StdAgg("x", -1, true, null))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("(got -1)");
    }
}
