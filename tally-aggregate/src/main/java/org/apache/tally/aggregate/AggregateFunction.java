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

import org.apache.tally.annotation.PublicEvolving;
import org.apache.tally.block.BlockAccessor;
import org.apache.tally.exception.SchemaValidationException;
import org.apache.tally.metadata.Schema;

import javax.annotation.Nullable;

import java.util.Optional;

/**
 * An aggregation that is computed block by block and merged in any order.
 *
 * <p>An execution engine drives an aggregation function through the following steps for every
 * group:
 *
 * <ol>
 *   <li>{@link #validate(Schema)} once, before any block is processed;
 *   <li>{@link #aggregateBlock(BlockAccessor)} once per block of the group, in parallel;
 *   <li>{@link #combine(Accumulator, Accumulator)} to merge the partial accumulators pairwise, in
 *       any order or tree shape, seeded with {@link #zero()} if desired;
 *   <li>{@link #finalizeResult(Accumulator)} exactly once on the fully merged accumulator.
 * </ol>
 *
 * <p>Implementations are immutable and may be shared across threads and groups. {@code combine}
 * is associative and commutative with {@code zero()} as identity when nulls are ignored.
 *
 * @param <A> type of the partial results held by accumulators
 * @param <R> type of the final result
 * @since 0.1
 */
@PublicEvolving
public interface AggregateFunction<A, R> {

    /** Returns the display name, used as the output name of the aggregation. */
    String getName();

    /** Returns the column the aggregation is applied to, or empty for whole-row aggregations. */
    Optional<String> getTargetColumn();

    /** Returns whether null values are skipped rather than propagated to the result. */
    boolean isIgnoreNulls();

    /** Returns the initial accumulator of a group. */
    Accumulator<A> zero();

    /**
     * Computes the partial accumulator of one block. Exceptions raised by the block are
     * propagated unmodified.
     */
    Accumulator<A> aggregateBlock(BlockAccessor block);

    /** Merges two partial accumulators of the same group. */
    Accumulator<A> combine(Accumulator<A> current, Accumulator<A> next);

    /**
     * Transforms the fully merged accumulator of a group into the result. Returns null if the
     * group has no non-null values, or if it holds a null and nulls are not ignored.
     */
    @Nullable
    R finalizeResult(Accumulator<A> accumulator);

    /**
     * Checks that the aggregation can be applied to blocks of the given schema.
     *
     * @throws SchemaValidationException if the target column is absent or of an unsupported type
     */
    void validate(Schema schema);
}
