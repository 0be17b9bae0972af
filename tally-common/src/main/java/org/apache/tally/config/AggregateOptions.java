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

package org.apache.tally.config;

import org.apache.tally.annotation.PublicEvolving;

import static org.apache.tally.config.ConfigBuilder.key;

/**
 * Config options for aggregations. Parameters given explicitly when an aggregation is created
 * take precedence over these options.
 *
 * @since 0.1
 */
@PublicEvolving
public class AggregateOptions {

    public static final ConfigOption<Boolean> IGNORE_NULLS =
            key("aggregate.ignore-nulls")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether aggregations skip null values by default. If false, a single "
                                    + "null value in a group makes the aggregation result null. "
                                    + "Does not apply to count, "
                                    + "see 'aggregate.count.ignore-nulls'.");

    public static final ConfigOption<Boolean> COUNT_IGNORE_NULLS =
            key("aggregate.count.ignore-nulls")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether count aggregations only count non-null values by default. "
                                    + "If false, every row is counted.");

    public static final ConfigOption<Integer> STD_DDOF =
            key("aggregate.std.ddof")
                    .intType()
                    .defaultValue(1)
                    .withDescription(
                            "The default delta degrees of freedom of the standard deviation. The "
                                    + "divisor used is N - ddof, where N is the number of values.");

    public static final ConfigOption<Double> QUANTILE_Q =
            key("aggregate.quantile.q")
                    .doubleType()
                    .defaultValue(0.5)
                    .withDescription(
                            "The default quantile to compute, a value between 0 and 1 inclusive.");

    public static final ConfigOption<Integer> QUANTILE_MAX_VALUES =
            key("aggregate.quantile.max-values")
                    .intType()
                    .noDefaultValue()
                    .withDescription(
                            "The maximum number of values a quantile aggregation keeps for one "
                                    + "group. Quantiles retain every value of a group in memory; "
                                    + "exceeding this bound fails the aggregation. Unbounded if "
                                    + "not set.");

    private AggregateOptions() {}
}
