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

package org.apache.tally.testutils.block;

import org.apache.tally.block.ColumnarBlock;
import org.apache.tally.metadata.Schema;
import org.apache.tally.types.DataType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/** Utilities to build {@link ColumnarBlock}s in tests. */
public final class BlockTestUtils {

    /** Creates a schema with a single column. */
    public static Schema singleColumnSchema(String column, DataType dataType) {
        return Schema.newBuilder().column(column, dataType).build();
    }

    /** Creates a block with a single column holding the given values, nulls included. */
    public static ColumnarBlock singleColumnBlock(
            String column, DataType dataType, List<?> values) {
        return ColumnarBlock.fromColumns(
                singleColumnSchema(column, dataType),
                Collections.<List<?>>singletonList(values));
    }

    /** Creates a block with a single column holding the given values, nulls included. */
    public static ColumnarBlock singleColumnBlock(
            String column, DataType dataType, Object... values) {
        return singleColumnBlock(column, dataType, Arrays.asList(values));
    }

    /** Creates one single-column block per value list. */
    public static List<ColumnarBlock> singleColumnBlocks(
            String column, DataType dataType, List<? extends List<?>> blockValues) {
        List<ColumnarBlock> blocks = new ArrayList<>(blockValues.size());
        for (List<?> values : blockValues) {
            blocks.add(singleColumnBlock(column, dataType, values));
        }
        return blocks;
    }

    /**
     * Splits a block into contiguous blocks at random positions. Empty blocks may be produced and
     * the concatenation of the result equals the input.
     */
    public static List<ColumnarBlock> randomSplit(ColumnarBlock block, int parts, Random random) {
        int[] cuts = new int[parts + 1];
        cuts[parts] = block.numRows();
        for (int i = 1; i < parts; i++) {
            cuts[i] = random.nextInt(block.numRows() + 1);
        }
        Arrays.sort(cuts);

        List<ColumnarBlock> blocks = new ArrayList<>(parts);
        for (int i = 0; i < parts; i++) {
            blocks.add(block.slice(cuts[i], cuts[i + 1]));
        }
        return blocks;
    }

    private BlockTestUtils() {}
}
