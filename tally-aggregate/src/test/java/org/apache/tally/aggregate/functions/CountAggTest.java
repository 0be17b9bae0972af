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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.apache.tally.aggregate.AggregationTestUtils.aggregate;
import static org.apache.tally.testutils.block.BlockTestUtils.singleColumnBlocks;
import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link CountAgg}. */
class CountAggTest {

    private static final List<ColumnarBlock> BLOCKS =
            singleColumnBlocks(
                    "x",
                    DataTypes.INT(),
                    Arrays.asList(
                            Arrays.asList(1, 2, null),
                            Collections.emptyList(),
                            Arrays.asList(3, null)));

    @Test
    void testCountRows() {
        CountAgg count = new CountAgg();
        assertThat(count.getName()).isEqualTo("count()");
        assertThat(count.getTargetColumn()).isEmpty();
        assertThat(aggregate(count, BLOCKS)).isEqualTo(5L);
    }

    @Test
    void testCountColumnIncludesNullsByDefault() {
        CountAgg count = new CountAgg("x");
        assertThat(count.isIgnoreNulls()).isFalse();
        assertThat(aggregate(count, BLOCKS)).isEqualTo(5L);
    }

    @Test
    void testCountColumnIgnoringNulls() {
        assertThat(aggregate(new CountAgg("x", true, "non_null"), BLOCKS)).isEqualTo(3L);

        List<ColumnarBlock> allNull =
                singleColumnBlocks(
                        "x",
                        DataTypes.INT(),
                        Collections.singletonList(Arrays.asList(null, null)));
        assertThat(aggregate(new CountAgg("x", true, null), allNull)).isEqualTo(0L);
    }

    @Test
    void testCountOfNoBlocks() {
        assertThat(aggregate(new CountAgg(), Collections.<ColumnarBlock>emptyList()))
                .isEqualTo(0L);
    }
}
