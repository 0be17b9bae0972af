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

import javax.annotation.Nullable;

/**
 * Count aggregator - counts the rows of a group, or the values of the target column. Unlike the
 * other aggregators, nulls are counted by default.
 */
public class CountAgg extends AbstractAggregateFunction<Long, Long> {

    /** Counts all rows. */
    public CountAgg() {
        this(null, false, null);
    }

    public CountAgg(@Nullable String targetColumn) {
        this(targetColumn, false, null);
    }

    public CountAgg(@Nullable String targetColumn, boolean ignoreNulls, @Nullable String alias) {
        super(
                resolveName(alias, AggregateKind.COUNT, targetColumn),
                targetColumn,
                ignoreNulls,
                () -> 0L);
    }

    @Override
    protected Long aggregate(BlockAccessor block) {
        String column = getTargetColumn().orElse(null);
        if (column == null) {
            return (long) block.numRows();
        }
        return block.count(column, isIgnoreNulls());
    }

    @Override
    protected Long merge(Long current, Long next) {
        return current + next;
    }

    @Override
    protected boolean requiresTargetColumn() {
        return false;
    }
}
