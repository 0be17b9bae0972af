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

package org.apache.tally.aggregate.factory;

import org.apache.tally.aggregate.AggregateFunction;
import org.apache.tally.config.AggregateOptions;
import org.apache.tally.config.Configuration;
import org.apache.tally.metadata.AggregateKind;
import org.apache.tally.metadata.AggregateSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.EnumMap;
import java.util.ServiceLoader;

/** Factory interface for creating {@link AggregateFunction} instances of one aggregation kind. */
public interface AggregateFunctionFactory {

    /**
     * Creates an aggregate function.
     *
     * @param spec the aggregation kind with its parameters
     * @param targetColumn the column to aggregate, or null for whole-row aggregations
     * @param alias the display name, or null for the default name
     * @param conf the configuration providing defaults for parameters missing from
     *     the aggregate spec
     * @return the aggregate function
     */
    AggregateFunction<?, ?> create(
            AggregateSpec spec,
            @Nullable String targetColumn,
            @Nullable String alias,
            Configuration conf);

    /**
     * Returns the unique identifier for this factory.
     *
     * @return the identifier string
     */
    String identifier();

    /**
     * Resolves the null policy: the {@link AggregateKind#PARAM_IGNORE_NULLS} parameter if the
     * aggregate spec has one, otherwise {@link AggregateOptions#IGNORE_NULLS}.
     */
    default boolean resolveIgnoreNulls(AggregateSpec spec, Configuration conf) {
        return spec.getBooleanParameter(AggregateKind.PARAM_IGNORE_NULLS)
                .orElseGet(() -> conf.get(AggregateOptions.IGNORE_NULLS));
    }

    /**
     * Gets a factory by its aggregation kind.
     *
     * @param kind the aggregation kind
     * @return the factory, or null if not found
     */
    @Nullable
    static AggregateFunctionFactory getFactory(AggregateKind kind) {
        return FactoryRegistry.INSTANCE.getFactory(kind);
    }

    /** Registry for aggregate function factories using Java SPI. */
    class FactoryRegistry {
        private static final Logger LOG = LoggerFactory.getLogger(FactoryRegistry.class);

        private static final FactoryRegistry INSTANCE = new FactoryRegistry();
        private final EnumMap<AggregateKind, AggregateFunctionFactory> factories;

        private FactoryRegistry() {
            this.factories = new EnumMap<>(AggregateKind.class);
            loadFactories();
        }

        private void loadFactories() {
            ServiceLoader<AggregateFunctionFactory> loader =
                    ServiceLoader.load(
                            AggregateFunctionFactory.class,
                            AggregateFunctionFactory.class.getClassLoader());
            for (AggregateFunctionFactory factory : loader) {
                AggregateKind kind = AggregateKind.fromString(factory.identifier());
                if (kind == null) {
                    LOG.warn(
                            "Ignoring aggregate function factory {} with unknown identifier '{}'.",
                            factory.getClass().getName(),
                            factory.identifier());
                    continue;
                }
                AggregateFunctionFactory previous = factories.put(kind, factory);
                if (previous != null) {
                    LOG.warn(
                            "Aggregate function factory {} for '{}' replaces {}.",
                            factory.getClass().getName(),
                            kind,
                            previous.getClass().getName());
                }
            }
            LOG.debug("Loaded aggregate function factories for {}.", factories.keySet());
        }

        AggregateFunctionFactory getFactory(AggregateKind kind) {
            return factories.get(kind);
        }
    }
}
