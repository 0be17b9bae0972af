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
import org.apache.tally.exception.InvalidConfigException;

import javax.annotation.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * The built-in aggregation kinds.
 *
 * <p>Every kind accepts the {@link #PARAM_IGNORE_NULLS} parameter. {@link #STD} additionally
 * accepts {@link #PARAM_DDOF}, {@link #QUANTILE} accepts {@link #PARAM_Q} and {@link
 * #PARAM_MAX_VALUES}.
 *
 * @since 0.1
 */
@PublicEvolving
public enum AggregateKind {
    COUNT,
    SUM,
    MIN,
    MAX,
    MEAN,
    STD,
    ABS_MAX,
    QUANTILE,
    UNIQUE;

    /** Parameter name for the null policy, "true" or "false". */
    public static final String PARAM_IGNORE_NULLS = "ignore-nulls";

    /** Parameter name for the delta degrees of freedom of {@link #STD}. */
    public static final String PARAM_DDOF = "ddof";

    /** Parameter name for the quantile of {@link #QUANTILE}. */
    public static final String PARAM_Q = "q";

    /** Parameter name for the per-group value bound of {@link #QUANTILE}. */
    public static final String PARAM_MAX_VALUES = "max-values";

    /**
     * Returns the set of supported parameter names for this aggregation kind.
     *
     * @return an immutable set of parameter names
     */
    public Set<String> getSupportedParameters() {
        switch (this) {
            case STD:
                return parameters(PARAM_IGNORE_NULLS, PARAM_DDOF);
            case QUANTILE:
                return parameters(PARAM_IGNORE_NULLS, PARAM_Q, PARAM_MAX_VALUES);
            default:
                return Collections.singleton(PARAM_IGNORE_NULLS);
        }
    }

    /**
     * Validates a parameter value for this aggregation kind.
     *
     * @param parameterName the parameter name
     * @param parameterValue the parameter value
     * @throws InvalidConfigException if the parameter is unsupported or its value is invalid
     */
    public void validateParameter(String parameterName, String parameterValue) {
        if (!getSupportedParameters().contains(parameterName)) {
            throw new InvalidConfigException(
                    String.format(
                            "Parameter '%s' is not supported for aggregation '%s'. "
                                    + "Supported parameters: %s",
                            parameterName, this, getSupportedParameters()));
        }
        if (parameterValue == null || parameterValue.trim().isEmpty()) {
            throw new InvalidConfigException(
                    String.format(
                            "Parameter '%s' for aggregation '%s' must be a non-empty string",
                            parameterName, this));
        }

        switch (parameterName) {
            case PARAM_IGNORE_NULLS:
                String normalized = parameterValue.trim().toLowerCase(Locale.ROOT);
                if (!normalized.equals("true") && !normalized.equals("false")) {
                    throw invalidValue(parameterName, parameterValue, "true or false");
                }
                break;
            case PARAM_DDOF:
                if (parseInt(parameterName, parameterValue) < 0) {
                    throw invalidValue(parameterName, parameterValue, "a non-negative integer");
                }
                break;
            case PARAM_Q:
                double q = parseDouble(parameterName, parameterValue);
                if (!(q >= 0.0 && q <= 1.0)) {
                    throw invalidValue(parameterName, parameterValue, "a number in [0, 1]");
                }
                break;
            case PARAM_MAX_VALUES:
                if (parseInt(parameterName, parameterValue) <= 0) {
                    throw invalidValue(parameterName, parameterValue, "a positive integer");
                }
                break;
            default:
                break;
        }
    }

    /**
     * Converts a string to an AggregateKind enum value. Matching is case insensitive and accepts
     * both underscores and hyphens, e.g. "abs_max" and "abs-max".
     *
     * @param name the aggregation kind name
     * @return the AggregateKind enum value, or null if not found
     */
    @Nullable
    public static AggregateKind fromString(String name) {
        if (name == null || name.trim().isEmpty()) {
            return null;
        }

        String normalized = name.replace('-', '_').toUpperCase(Locale.ROOT).trim();

        try {
            return AggregateKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Converts this AggregateKind to its string identifier, the lowercase name with underscores,
     * e.g. "sum", "abs_max". The identifier also prefixes default display names like "sum(x)".
     */
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }

    // --------------------------------------------------------------------------------------------

    private static Set<String> parameters(String... names) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(names)));
    }

    private InvalidConfigException invalidValue(String name, String value, String expected) {
        return new InvalidConfigException(
                String.format(
                        "Parameter '%s' for aggregation '%s' must be %s, but was '%s'.",
                        name, this, expected, value));
    }

    private int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw invalidValue(name, value, "an integer");
        }
    }

    private double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw invalidValue(name, value, "a number");
        }
    }
}
