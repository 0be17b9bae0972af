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

import org.apache.tally.aggregate.functions.MeanAgg;
import org.apache.tally.config.Configuration;
import org.apache.tally.metadata.AggregateKind;
import org.apache.tally.metadata.AggregateSpec;

import javax.annotation.Nullable;

/** Factory for {@link MeanAgg}. */
public class MeanAggFactory implements AggregateFunctionFactory {

    @Override
    public MeanAgg create(
            AggregateSpec spec,
            @Nullable String targetColumn,
            @Nullable String alias,
            Configuration conf) {
        return new MeanAgg(targetColumn, resolveIgnoreNulls(spec, conf), alias);
    }

    @Override
    public String identifier() {
        return AggregateKind.MEAN.toString();
    }
}
