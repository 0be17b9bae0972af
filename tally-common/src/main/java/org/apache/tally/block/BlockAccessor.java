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

package org.apache.tally.block;

import org.apache.tally.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Primitive, column-oriented operations over one block of rows. Aggregations compute their
 * per-block partial results exclusively through this interface and never call back into the
 * engine that owns the block.
 *
 * <p>The null-aware primitives share one contract: with {@code ignoreNulls = true} null values are
 * skipped and {@code null} is returned only if the column holds no non-null value; with {@code
 * ignoreNulls = false} a single null value in the column makes the result {@code null}.
 *
 * <p>Implementations report unknown columns and primitives that the column type cannot support by
 * throwing; aggregations propagate such exceptions unmodified.
 *
 * @since 0.1
 */
@PublicEvolving
public interface BlockAccessor {

    /** Returns the number of rows in the block. */
    int numRows();

    /**
     * Counts the values of a column.
     *
     * @param column the column name
     * @param ignoreNulls whether only non-null values are counted; otherwise all rows are counted
     * @return the number of counted values
     */
    long count(String column, boolean ignoreNulls);

    /**
     * Sums the values of a numeric column. Integral columns sum to {@link Long}, floating point
     * columns to {@link Double} and decimal columns to {@link java.math.BigDecimal}.
     */
    @Nullable
    Number sum(String column, boolean ignoreNulls);

    /** Returns the smallest value of an orderable column. */
    @Nullable
    Object min(String column, boolean ignoreNulls);

    /** Returns the largest value of an orderable column. */
    @Nullable
    Object max(String column, boolean ignoreNulls);

    /**
     * Returns the sum of squared differences of a numeric column's values from the given mean,
     * i.e. {@code sum((x - mean)^2)}.
     */
    @Nullable
    Double sumOfSquaredDiffsFromMean(String column, boolean ignoreNulls, double mean);

    /** Returns the values of a column in row order, including nulls. */
    List<Object> column(String column);

    /** Returns the distinct values of a column in order of first appearance, including null. */
    List<Object> distinct(String column);

    /** Returns an iterator over the rows of the block, each row mapping column name to value. */
    Iterator<Map<String, Object>> rows();
}
