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

import org.apache.tally.block.BlockAccessor;

import java.util.ArrayList;
import java.util.List;

/** Drives an {@link AggregateFunction} over blocks the way a distributed engine would. */
public final class AggregationTestUtils {

    /** Folds the partial results of the blocks left to right, starting from zero. */
    public static <A> Accumulator<A> fold(
            AggregateFunction<A, ?> function, List<? extends BlockAccessor> blocks) {
        Accumulator<A> accumulator = function.zero();
        for (BlockAccessor block : blocks) {
            accumulator = function.combine(accumulator, function.aggregateBlock(block));
        }
        return accumulator;
    }

    /** Merges the partial results of the blocks pairwise, as a balanced tree. */
    public static <A> Accumulator<A> treeReduce(
            AggregateFunction<A, ?> function, List<? extends BlockAccessor> blocks) {
        List<Accumulator<A>> level = new ArrayList<>();
        for (BlockAccessor block : blocks) {
            level.add(function.aggregateBlock(block));
        }
        if (level.isEmpty()) {
            return function.zero();
        }
        while (level.size() > 1) {
            List<Accumulator<A>> next = new ArrayList<>();
            for (int i = 0; i < level.size(); i += 2) {
                next.add(
                        i + 1 < level.size()
                                ? function.combine(level.get(i), level.get(i + 1))
                                : level.get(i));
            }
            level = next;
        }
        return function.combine(function.zero(), level.get(0));
    }

    /** Folds the blocks and finalizes the result. */
    public static <A, R> R aggregate(
            AggregateFunction<A, R> function, List<? extends BlockAccessor> blocks) {
        return function.finalizeResult(fold(function, blocks));
    }

    private AggregationTestUtils() {}
}
