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
import org.apache.tally.exception.InvalidConfigException;
import org.apache.tally.metadata.AggregateKind;
import org.apache.tally.types.DataType;
import org.apache.tally.types.DataTypeChecks;
import org.apache.tally.utils.ValueUtils;

import javax.annotation.Nullable;

/** Absolute max aggregator - selects the largest absolute value of numeric values. */
public class AbsMaxAgg extends AbstractAggregateFunction<Number, Number> {

    public AbsMaxAgg(String targetColumn) {
        this(targetColumn, true, null);
    }

    /**
     * Creates an absolute max aggregation.
     *
     * @throws InvalidConfigException if no target column is given
     */
    public AbsMaxAgg(String targetColumn, boolean ignoreNulls, @Nullable String alias) {
        super(
                resolveName(alias, AggregateKind.ABS_MAX, checkTargetColumn(targetColumn)),
                targetColumn,
                ignoreNulls,
                () -> 0L);
    }

    @Nullable
    @Override
    protected Number aggregate(BlockAccessor block) {
        String column = getTargetColumn().orElse(null);
        Object max = block.max(column, isIgnoreNulls());
        Object min = block.min(column, isIgnoreNulls());
        if (max == null || min == null) {
            return null;
        }
        return (Number) ValueUtils.max(ValueUtils.abs((Number) max), ValueUtils.abs((Number) min));
    }

    @Override
    protected Number merge(Number current, Number next) {
        return (Number) ValueUtils.max(current, next);
    }

    @Override
    protected boolean supportsType(DataType dataType) {
        return DataTypeChecks.isNumeric(dataType);
    }

    private static String checkTargetColumn(@Nullable String targetColumn) {
        if (targetColumn == null || targetColumn.isEmpty()) {
            throw new InvalidConfigException(
                    String.format(
                            "Column to aggregate on has to be provided (got %s)", targetColumn));
        }
        return targetColumn;
    }
}
