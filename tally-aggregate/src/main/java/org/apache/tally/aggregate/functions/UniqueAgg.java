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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Unique aggregator - collects the distinct values of a column.
 *
 * <p>Null is collected as a value of its own unless nulls are ignored. When nulls are ignored it
 * is dropped from the set, and a group holding only nulls yields null rather than a set
 * containing null.
 */
public class UniqueAgg extends AbstractAggregateFunction<Set<Object>, Set<Object>> {

    public UniqueAgg(String targetColumn) {
        this(targetColumn, true, null);
    }

    public UniqueAgg(@Nullable String targetColumn, boolean ignoreNulls, @Nullable String alias) {
        super(
                resolveName(alias, AggregateKind.UNIQUE, targetColumn),
                targetColumn,
                ignoreNulls,
                LinkedHashSet::new);
    }

    @Nullable
    @Override
    protected Set<Object> aggregate(BlockAccessor block) {
        Set<Object> distinct = new LinkedHashSet<>(block.distinct(getTargetColumn().orElse(null)));
        if (isIgnoreNulls()) {
            distinct.remove(null);
            if (distinct.isEmpty()) {
                return null;
            }
        }
        return distinct;
    }

    @Override
    protected Set<Object> merge(Set<Object> current, Set<Object> next) {
        Set<Object> union = new LinkedHashSet<>(toSet(current));
        union.addAll(toSet(next));
        return union;
    }

    @Override
    protected Set<Object> finish(Set<Object> accumulator) {
        return Collections.unmodifiableSet(accumulator);
    }

    /** Normalizes a set, any other collection, or a bare value into a set. */
    public static Set<Object> toSet(@Nullable Object value) {
        if (value instanceof Set) {
            @SuppressWarnings("unchecked")
            Set<Object> set = (Set<Object>) value;
            return set;
        } else if (value instanceof Collection) {
            return new LinkedHashSet<>((Collection<?>) value);
        } else {
            Set<Object> set = new LinkedHashSet<>();
            set.add(value);
            return set;
        }
    }
}
