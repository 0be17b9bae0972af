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
import org.apache.tally.exception.InvalidConfigException;
import org.apache.tally.exception.SchemaValidationException;
import org.apache.tally.metadata.AggregateKind;
import org.apache.tally.metadata.Schema;
import org.apache.tally.types.DataType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class of the built-in aggregations. Subclasses implement the raw per-block aggregation and
 * merge over non-null partial results; this class lifts them with {@link NullSafeFunctions} so
 * that every aggregation handles nulls the same way.
 *
 * @param <A> type of the partial results
 * @param <R> type of the final result
 */
@PublicEvolving
public abstract class AbstractAggregateFunction<A, R> implements AggregateFunction<A, R> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractAggregateFunction.class);

    private final String name;
    @Nullable private final String targetColumn;
    private final boolean ignoreNulls;

    private final Supplier<Accumulator<A>> safeZero;
    private final Function<BlockAccessor, Accumulator<A>> safeAggregate;
    private final BinaryOperator<Accumulator<A>> safeCombine;
    private final Function<Accumulator<A>, R> safeFinalize;

    /**
     * Creates an aggregation.
     *
     * @param name the display name, must not be empty
     * @param targetColumn the column to aggregate, or null for whole-row aggregations
     * @param ignoreNulls whether null values are skipped rather than propagated
     * @param zeroFactory creates the mathematical identity of {@link #merge}, e.g. 0 for sums
     * @throws InvalidConfigException if the name is null or empty
     */
    protected AbstractAggregateFunction(
            String name,
            @Nullable String targetColumn,
            boolean ignoreNulls,
            Supplier<A> zeroFactory) {
        if (name == null || name.isEmpty()) {
            throw new InvalidConfigException(
                    String.format(
                            "Non-empty string has to be provided as name (got %s)", name));
        }
        this.name = name;
        this.targetColumn = targetColumn;
        this.ignoreNulls = ignoreNulls;

        this.safeZero = NullSafeFunctions.zeroFactory(zeroFactory, ignoreNulls);
        this.safeAggregate = NullSafeFunctions.aggregate(this::aggregate, ignoreNulls);
        this.safeCombine = NullSafeFunctions.combine(this::merge, ignoreNulls);
        this.safeFinalize = NullSafeFunctions.finalizer(this::finish);
    }

    /**
     * Computes the raw partial result of a block.
     *
     * @return the partial result, or null if the block holds no defined value under the null
     *     policy of this aggregation
     */
    @Nullable
    protected abstract A aggregate(BlockAccessor block);

    /** Merges two raw partial results. Must be associative and commutative. */
    protected abstract A merge(A current, A next);

    /** Transforms the merged raw partial result into the final result. Identity by default. */
    @SuppressWarnings("unchecked")
    protected R finish(A accumulator) {
        return (R) accumulator;
    }

    /** Returns whether the aggregation can only be applied to a target column. */
    protected boolean requiresTargetColumn() {
        return true;
    }

    /** Returns whether values of the given type can be aggregated. */
    protected boolean supportsType(DataType dataType) {
        return true;
    }

    // --------------------------------------------------------------------------------------------

    @Override
    public final String getName() {
        return name;
    }

    @Override
    public final Optional<String> getTargetColumn() {
        return Optional.ofNullable(targetColumn);
    }

    @Override
    public final boolean isIgnoreNulls() {
        return ignoreNulls;
    }

    @Override
    public final Accumulator<A> zero() {
        return safeZero.get();
    }

    @Override
    public final Accumulator<A> aggregateBlock(BlockAccessor block) {
        return safeAggregate.apply(block);
    }

    @Override
    public final Accumulator<A> combine(Accumulator<A> current, Accumulator<A> next) {
        return safeCombine.apply(current, next);
    }

    @Nullable
    @Override
    public final R finalizeResult(Accumulator<A> accumulator) {
        return safeFinalize.apply(accumulator);
    }

    @Override
    public void validate(Schema schema) {
        if (targetColumn == null) {
            if (requiresTargetColumn()) {
                throw new SchemaValidationException(
                        String.format("Aggregation %s requires a target column.", name));
            }
            return;
        }
        Optional<Schema.Column> found = schema.getColumn(targetColumn);
        if (!found.isPresent()) {
            throw new SchemaValidationException(
                    String.format(
                            "The column '%s' does not exist in the schema %s.",
                            targetColumn, schema));
        }
        Schema.Column column = found.get();
        if (!supportsType(column.getDataType())) {
            throw new SchemaValidationException(
                    String.format(
                            "Aggregation %s does not support column '%s' of type %s.",
                            name, targetColumn, column.getDataType()));
        }
        LOG.debug("Validated aggregation {} against column {}.", name, column);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{name='"
                + name
                + "', targetColumn="
                + targetColumn
                + ", ignoreNulls="
                + ignoreNulls
                + '}';
    }

    // --------------------------------------------------------------------------------------------

    /**
     * Resolves the display name: the alias if given, otherwise {@code "<kind>(<column>)"}.
     *
     * @throws InvalidConfigException if the alias is given but empty
     */
    protected static String resolveName(
            @Nullable String alias, AggregateKind kind, @Nullable String targetColumn) {
        if (alias == null) {
            return kind + "(" + (targetColumn == null ? "" : targetColumn) + ")";
        }
        if (alias.trim().isEmpty()) {
            throw new InvalidConfigException(
                    String.format(
                            "Alias of aggregation %s must not be empty (got '%s').", kind, alias));
        }
        return alias;
    }
}
