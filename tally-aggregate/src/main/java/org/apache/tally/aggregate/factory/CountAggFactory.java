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

import org.apache.tally.aggregate.functions.CountAgg;
import org.apache.tally.config.AggregateOptions;
import org.apache.tally.config.Configuration;
import org.apache.tally.metadata.AggregateKind;
import org.apache.tally.metadata.AggregateSpec;

import javax.annotation.Nullable;

/** Factory for {@link CountAgg}. */
public class CountAggFactory implements AggregateFunctionFactory {

    @Override
    public CountAgg create(
            AggregateSpec spec,
            @Nullable String targetColumn,
            @Nullable String alias,
            Configuration conf) {
        return new CountAgg(targetColumn, resolveIgnoreNulls(spec, conf), alias);
    }

    /** Count falls back to {@link AggregateOptions#COUNT_IGNORE_NULLS}, which defaults to false. */
    @Override
    public boolean resolveIgnoreNulls(AggregateSpec spec, Configuration conf) {
        return spec.getBooleanParameter(AggregateKind.PARAM_IGNORE_NULLS)
                .orElseGet(() -> conf.get(AggregateOptions.COUNT_IGNORE_NULLS));
    }

    @Override
    public String identifier() {
        return AggregateKind.COUNT.toString();
    }
}
