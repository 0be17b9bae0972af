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

import org.apache.tally.aggregate.factory.AggregateFunctionFactory;
import org.apache.tally.annotation.PublicEvolving;
import org.apache.tally.config.Configuration;
import org.apache.tally.exception.InvalidConfigException;
import org.apache.tally.metadata.AggregateSpec;

import javax.annotation.Nullable;

/**
 * Creates {@link AggregateFunction}s from {@link AggregateSpec}s through the registered {@link
 * AggregateFunctionFactory}s.
 *
 * <pre>{@code
 * AggregateFunction<?, ?> median =
 *         AggregateFunctions.create(AggregateSpecs.QUANTILE(0.5), "latency", "p50", conf);
 * }</pre>
 */
@PublicEvolving
public final class AggregateFunctions {

    /** Creates an aggregate function with default name and default configuration. */
    public static AggregateFunction<?, ?> create(
            AggregateSpec spec, @Nullable String targetColumn) {
        return create(spec, targetColumn, null, new Configuration());
    }

    /**
     * Creates an aggregate function.
     *
     * @param spec the aggregation kind with its parameters
     * @param targetColumn the column to aggregate, or null for whole-row aggregations
     * @param alias the display name, or null for the default name
     * @param conf the configuration providing defaults for parameters missing from
     *     the aggregate spec
     * @throws InvalidConfigException if the aggregate spec or its parameters are invalid
     */
    public static AggregateFunction<?, ?> create(
            AggregateSpec spec,
            @Nullable String targetColumn,
            @Nullable String alias,
            Configuration conf) {
        spec.validate();
        AggregateFunctionFactory factory = AggregateFunctionFactory.getFactory(spec.getKind());
        if (factory == null) {
            throw new InvalidConfigException(
                    String.format(
                            "Unsupported aggregation: %s, no factory is registered for it.",
                            spec.getKind()));
        }
        return factory.create(spec, targetColumn, alias, conf);
    }

    private AggregateFunctions() {
        // no instantiation
    }
}
