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

import org.apache.tally.annotation.Internal;
import org.apache.tally.block.BlockAccessor;

import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Lifts the raw functions of an aggregation, which know nothing about nulls, to functions over
 * {@link Accumulator}s that implement the aggregation protocol for a null policy.
 *
 * <p>The protocol must form a monoid: {@code combine} is associative and has an identity element,
 * so that blocks can be aggregated independently and merged in any order or tree shape. Nulls are
 * handled differently depending on the policy:
 *
 * <ul>
 *   <li>{@code ignoreNulls = true}: the result is null if and only if the group holds no non-null
 *       value. A block without non-null values contributes {@link Accumulator#empty()}, and the
 *       zero accumulator is empty too.
 *   <li>{@code ignoreNulls = false}: the result is null if the group holds any null. A block with a
 *       null contributes {@link Accumulator#poisoned()}, which wins over every later input. The
 *       zero accumulator holds the raw zero value (0 for sums, +inf for min, ...), so that a group
 *       without nulls behaves like an ordinary aggregation.
 * </ul>
 *
 * <p>Under both policies a block without rows contributes an empty accumulator.
 */
@Internal
public final class NullSafeFunctions {

    /** Creates the zero accumulator factory for the given null policy. */
    public static <A> Supplier<Accumulator<A>> zeroFactory(
            Supplier<A> rawZeroFactory, boolean ignoreNulls) {
        if (ignoreNulls) {
            return Accumulator::empty;
        } else {
            return () -> Accumulator.of(rawZeroFactory.get());
        }
    }

    /**
     * Creates the per-block aggregate function. A {@code null} raw result means that the block has
     * no defined value: it holds only nulls, or nulls are not ignored and it holds at least one.
     */
    public static <A> Function<BlockAccessor, Accumulator<A>> aggregate(
            Function<BlockAccessor, A> rawAggregate, boolean ignoreNulls) {
        return block -> {
            if (block.numRows() == 0) {
                return Accumulator.empty();
            }
            A result = rawAggregate.apply(block);
            if (result != null) {
                return Accumulator.of(result);
            }
            return ignoreNulls ? Accumulator.empty() : Accumulator.poisoned();
        };
    }

    /** Creates the combine function for the given null policy. */
    public static <A> BinaryOperator<Accumulator<A>> combine(
            BinaryOperator<A> rawCombine, boolean ignoreNulls) {
        if (ignoreNulls) {
            return (current, next) -> {
                if (current.isEmpty()) {
                    return next;
                } else if (next.isEmpty()) {
                    return current;
                } else if (current.isPoisoned() || next.isPoisoned()) {
                    return Accumulator.poisoned();
                }
                return Accumulator.of(rawCombine.apply(current.getValue(), next.getValue()));
            };
        } else {
            return (current, next) -> {
                // a poisoned input wins over anything combined before or after it
                if (next.isPoisoned()) {
                    return next;
                } else if (current.isPoisoned()) {
                    return current;
                } else if (current.isEmpty()) {
                    return next;
                } else if (next.isEmpty()) {
                    return current;
                }
                return Accumulator.of(rawCombine.apply(current.getValue(), next.getValue()));
            };
        }
    }

    /** Creates the finalize function. Empty and poisoned accumulators finalize to null. */
    public static <A, R> Function<Accumulator<A>, R> finalizer(Function<A, R> rawFinalize) {
        return accumulator ->
                accumulator.hasValue() ? rawFinalize.apply(accumulator.getValue()) : null;
    }

    private NullSafeFunctions() {
        // no instantiation
    }
}
