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

package org.apache.tally.metadata;

import org.apache.tally.annotation.PublicEvolving;

import java.util.HashMap;
import java.util.Map;

/**
 * Utility class for creating {@link AggregateSpec}s of the built-in aggregation kinds.
 *
 * @since 0.1
 */
@PublicEvolving
// CHECKSTYLE.OFF: MethodName - Factory methods use uppercase naming convention like DataTypes
public final class AggregateSpecs {

    private AggregateSpecs() {
        // Utility class, no instantiation
    }

    /** Counts rows, or the values of the target column. */
    public static AggregateSpec COUNT() {
        return new AggregateSpec(AggregateKind.COUNT, null);
    }

    /**
     * Sums numeric values.
     *
     * <p>Supported data types: TINYINT, SMALLINT, INT, BIGINT, FLOAT, DOUBLE, DECIMAL
     */
    public static AggregateSpec SUM() {
        return new AggregateSpec(AggregateKind.SUM, null);
    }

    /**
     * Selects the minimum value.
     *
     * <p>Supported data types: all numeric types, BOOLEAN, STRING, DATE, TIMESTAMP
     */
    public static AggregateSpec MIN() {
        return new AggregateSpec(AggregateKind.MIN, null);
    }

    /**
     * Selects the maximum value.
     *
     * <p>Supported data types: all numeric types, BOOLEAN, STRING, DATE, TIMESTAMP
     */
    public static AggregateSpec MAX() {
        return new AggregateSpec(AggregateKind.MAX, null);
    }

    /** Computes the arithmetic mean of numeric values. */
    public static AggregateSpec MEAN() {
        return new AggregateSpec(AggregateKind.MEAN, null);
    }

    /** Computes the standard deviation with the configured default delta degrees of freedom. */
    public static AggregateSpec STD() {
        return new AggregateSpec(AggregateKind.STD, null);
    }

    /**
     * Computes the standard deviation.
     *
     * @param ddof delta degrees of freedom; the divisor is N - ddof
     */
    public static AggregateSpec STD(int ddof) {
        Map<String, String> params = new HashMap<>();
        params.put(AggregateKind.PARAM_DDOF, String.valueOf(ddof));
        return new AggregateSpec(AggregateKind.STD, params);
    }

    /** Selects the largest absolute value of numeric values. */
    public static AggregateSpec ABS_MAX() {
        return new AggregateSpec(AggregateKind.ABS_MAX, null);
    }

    /** Computes the configured default quantile. */
    public static AggregateSpec QUANTILE() {
        return new AggregateSpec(AggregateKind.QUANTILE, null);
    }

    /**
     * Computes a quantile with linear interpolation between the closest ranks.
     *
     * @param q the quantile, between 0 and 1 inclusive
     */
    public static AggregateSpec QUANTILE(double q) {
        Map<String, String> params = new HashMap<>();
        params.put(AggregateKind.PARAM_Q, String.valueOf(q));
        return new AggregateSpec(AggregateKind.QUANTILE, params);
    }

    /** Collects the distinct values. */
    public static AggregateSpec UNIQUE() {
        return new AggregateSpec(AggregateKind.UNIQUE, null);
    }

    /** Creates a spec of the given kind with explicit parameters. */
    public static AggregateSpec of(AggregateKind kind, Map<String, String> parameters) {
        return new AggregateSpec(kind, parameters);
    }

    /** Creates a spec of the given kind without parameters. */
    public static AggregateSpec of(AggregateKind kind) {
        return new AggregateSpec(kind, null);
    }
}
// CHECKSTYLE.ON: MethodName
