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
import org.apache.tally.exception.InvalidConfigException;
import org.apache.tally.metadata.Schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.apache.tally.utils.Preconditions.checkArgument;
import static org.apache.tally.utils.Preconditions.checkNotNull;

/**
 * Context for computing several aggregations over the same blocks, e.g. {@code count(), sum(x),
 * std(y)} per group.
 *
 * <p>The context validates every aggregation against the block schema when it is created, so that
 * configuration and schema errors surface before any block is processed. Accumulators are passed
 * around as arrays holding one accumulator per aggregation, in the order the aggregations were
 * given.
 *
 * <p>This class is immutable and thread-safe. It does not partition, schedule or group data; it
 * only applies the aggregations to the blocks and accumulators it is given.
 */
public class AggregationContext {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationContext.class);

    private final Schema schema;
    private final List<AggregateFunction<?, ?>> functions;

    private AggregationContext(Schema schema, List<AggregateFunction<?, ?>> functions) {
        this.schema = schema;
        this.functions = Collections.unmodifiableList(functions);
    }

    /**
     * Creates an aggregation context.
     *
     * @param schema the schema of the blocks to aggregate
     * @param functions the aggregations, at least one, with unique names
     * @throws InvalidConfigException if no aggregation is given or names collide
     * @throws org.apache.tally.exception.SchemaValidationException if an aggregation cannot be
     *     applied to the schema
     */
    public static AggregationContext create(
            Schema schema, List<? extends AggregateFunction<?, ?>> functions) {
        checkNotNull(schema, "Schema must not be null.");
        if (functions == null || functions.isEmpty()) {
            throw new InvalidConfigException("At least one aggregation has to be provided.");
        }

        Set<String> names = new HashSet<>();
        for (AggregateFunction<?, ?> function : functions) {
            if (!names.add(function.getName())) {
                throw new InvalidConfigException(
                        String.format(
                                "Duplicate aggregation name '%s'. Use an alias to disambiguate.",
                                function.getName()));
            }
        }
        for (AggregateFunction<?, ?> function : functions) {
            function.validate(schema);
        }

        LOG.debug("Created aggregation context for {} over schema {}.", names, schema);
        return new AggregationContext(schema, new ArrayList<>(functions));
    }

    public Schema getSchema() {
        return schema;
    }

    public List<AggregateFunction<?, ?>> getFunctions() {
        return functions;
    }

    public int getFunctionCount() {
        return functions.size();
    }

    /** Returns the output names of the aggregations, in order. */
    public List<String> getOutputNames() {
        List<String> names = new ArrayList<>(functions.size());
        for (AggregateFunction<?, ?> function : functions) {
            names.add(function.getName());
        }
        return names;
    }

    /** Returns the initial accumulators of a group. */
    public Accumulator<?>[] zero() {
        Accumulator<?>[] accumulators = new Accumulator<?>[functions.size()];
        for (int i = 0; i < functions.size(); i++) {
            accumulators[i] = functions.get(i).zero();
        }
        return accumulators;
    }

    /** Computes the partial accumulators of one block. */
    public Accumulator<?>[] aggregateBlock(BlockAccessor block) {
        Accumulator<?>[] accumulators = new Accumulator<?>[functions.size()];
        for (int i = 0; i < functions.size(); i++) {
            accumulators[i] = functions.get(i).aggregateBlock(block);
        }
        return accumulators;
    }

    /** Merges the partial accumulators of two parts of the same group. */
    public Accumulator<?>[] combine(Accumulator<?>[] current, Accumulator<?>[] next) {
        checkLength(current);
        checkLength(next);
        Accumulator<?>[] combined = new Accumulator<?>[functions.size()];
        for (int i = 0; i < functions.size(); i++) {
            combined[i] = combineWith(functions.get(i), current[i], next[i]);
        }
        return combined;
    }

    /**
     * Finalizes the fully merged accumulators of a group.
     *
     * @return the results keyed by aggregation name, in aggregation order; values may be null
     */
    public Map<String, Object> finalizeResult(Accumulator<?>[] accumulators) {
        checkLength(accumulators);
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < functions.size(); i++) {
            AggregateFunction<?, ?> function = functions.get(i);
            result.put(function.getName(), finalizeWith(function, accumulators[i]));
        }
        return result;
    }

    // --------------------------------------------------------------------------------------------

    private void checkLength(Accumulator<?>[] accumulators) {
        checkArgument(
                accumulators.length == functions.size(),
                "Expected %s accumulators but got %s.",
                functions.size(),
                accumulators.length);
    }

    @SuppressWarnings("unchecked")
    private static <A> Accumulator<A> combineWith(
            AggregateFunction<A, ?> function, Accumulator<?> current, Accumulator<?> next) {
        return function.combine((Accumulator<A>) current, (Accumulator<A>) next);
    }

    @SuppressWarnings("unchecked")
    private static <A> Object finalizeWith(
            AggregateFunction<A, ?> function, Accumulator<?> accumulator) {
        return function.finalizeResult((Accumulator<A>) accumulator);
    }
}
