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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static org.apache.tally.aggregate.MonoidLawsTest.assertResult;
import static org.apache.tally.testutils.block.BlockTestUtils.randomSplit;
import static org.apache.tally.testutils.block.BlockTestUtils.singleColumnBlock;

/**
 * Checks that the result of an aggregation does not depend on how the data is split into blocks
 * or in which order the partial results are merged.
 */
class PartitioningInvarianceTest {

    private static final int NUM_VALUES = 500;

    static Stream<Arguments> cases() {
        List<Arguments> arguments = new ArrayList<>();
        for (double nullFraction : new double[] {0.0, 0.1}) {
            for (boolean ignoreNulls : new boolean[] {true, false}) {
                ColumnarBlock data = randomBlock(nullFraction, new Random(42));
                List<AggregateFunction<?, ?>> functions = new ArrayList<>();
                functions.add(new CountAgg());
                functions.add(new CountAgg("x", ignoreNulls, null));
                functions.add(new SumAgg("x", ignoreNulls, null));
                functions.add(new MinAgg("x", ignoreNulls, null));
                functions.add(new MaxAgg("x", ignoreNulls, null));
                functions.add(new MeanAgg("x", ignoreNulls, null));
                functions.add(new StdAgg("x", 1, ignoreNulls, null));
                functions.add(new StdAgg("x", 0, ignoreNulls, null));
                functions.add(new AbsMaxAgg("x", ignoreNulls, null));
                functions.add(new QuantileAgg("x", 0.5, ignoreNulls, null));
                functions.add(new QuantileAgg("x", 0.95, ignoreNulls, null));
                functions.add(new UniqueAgg("x", ignoreNulls, null));
                for (AggregateFunction<?, ?> function : functions) {
                    arguments.add(
                            Arguments.of(
                                    function.getName()
                                            + ", ignoreNulls="
                                            + ignoreNulls
                                            + ", nulls="
                                            + nullFraction,
                                    function,
                                    data));
                }
            }
        }
        return arguments.stream();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("cases")
    void testRandomPartitioning(String name, AggregateFunction<?, ?> function, ColumnarBlock data) {
        checkPartitioning(function, data);
    }

    private static <A, R> void checkPartitioning(
            AggregateFunction<A, R> function, ColumnarBlock data) {
        R expected = AggregationTestUtils.aggregate(function, Collections.singletonList(data));
        Random random = new Random(7);
        for (int round = 0; round < 20; round++) {
            int parts = 1 + random.nextInt(16);
            List<ColumnarBlock> blocks = new ArrayList<>(randomSplit(data, parts, random));

            assertResult(AggregationTestUtils.aggregate(function, blocks), expected);
            assertResult(
                    function.finalizeResult(AggregationTestUtils.treeReduce(function, blocks)),
                    expected);

            Collections.shuffle(blocks, random);
            assertResult(AggregationTestUtils.aggregate(function, blocks), expected);
        }
    }

    private static ColumnarBlock randomBlock(double nullFraction, Random random) {
        List<Object> values = new ArrayList<>(NUM_VALUES);
        for (int i = 0; i < NUM_VALUES; i++) {
            if (random.nextDouble() < nullFraction) {
                values.add(null);
            } else {
                // quarter steps keep partial sums exact
                values.add((random.nextInt(4001) - 2000) / 4.0d);
            }
        }
        return singleColumnBlock("x", DataTypes.DOUBLE(), values);
    }
}
