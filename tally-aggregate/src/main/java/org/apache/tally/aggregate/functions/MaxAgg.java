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

package org.apache.tally.aggregate.functions;

import org.apache.tally.aggregate.AbstractAggregateFunction;
import org.apache.tally.block.BlockAccessor;
import org.apache.tally.metadata.AggregateKind;
import org.apache.tally.types.DataType;
import org.apache.tally.types.DataTypeChecks;
import org.apache.tally.utils.ValueUtils;

import javax.annotation.Nullable;

/** Max aggregator - selects the maximum value. */
public class MaxAgg extends AbstractAggregateFunction<Object, Object> {

    private static final Double IDENTITY = Double.NEGATIVE_INFINITY;

    public MaxAgg(String targetColumn) {
        this(targetColumn, true, null);
    }

    public MaxAgg(@Nullable String targetColumn, boolean ignoreNulls, @Nullable String alias) {
        super(
                resolveName(alias, AggregateKind.MAX, targetColumn),
                targetColumn,
                ignoreNulls,
                () -> IDENTITY);
    }

    @Nullable
    @Override
    protected Object aggregate(BlockAccessor block) {
        return block.max(getTargetColumn().orElse(null), isIgnoreNulls());
    }

    @Override
    protected Object merge(Object current, Object next) {
        // the infinite identity only orders against numbers, it is neutral for any other value
        if (IDENTITY.equals(current) && !(next instanceof Number)) {
            return next;
        }
        if (IDENTITY.equals(next) && !(current instanceof Number)) {
            return current;
        }
        return ValueUtils.max(current, next);
    }

    @Override
    protected boolean supportsType(DataType dataType) {
        return DataTypeChecks.isOrderable(dataType);
    }
}
