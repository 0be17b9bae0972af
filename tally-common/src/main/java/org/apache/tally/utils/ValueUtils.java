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

package org.apache.tally.utils;

import org.apache.tally.annotation.Internal;

import java.math.BigDecimal;

import static org.apache.tally.utils.Preconditions.checkNotNull;

/**
 * Arithmetic and ordering over the boxed values held by block columns and accumulators.
 *
 * <p>Numbers of different classes are compared and added by value: integral operands stay in
 * {@code long} arithmetic, any {@link BigDecimal} operand promotes finite operands to {@link
 * BigDecimal}, everything else is computed in {@code double}. This allows identity values such as
 * {@link Double#POSITIVE_INFINITY} to be combined with integral column values.
 */
@Internal
public final class ValueUtils {

    /**
     * Compares two non-null values. Numbers are compared by numeric value regardless of their
     * class, any other value must be {@link Comparable} to the other.
     *
     * @throws ClassCastException if the values are not mutually comparable
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object left, Object right) {
        checkNotNull(left, "Cannot compare null values.");
        checkNotNull(right, "Cannot compare null values.");
        if (left instanceof Number && right instanceof Number) {
            return compareNumbers((Number) left, (Number) right);
        }
        return ((Comparable) left).compareTo(right);
    }

    public static Object min(Object left, Object right) {
        return compare(left, right) <= 0 ? left : right;
    }

    public static Object max(Object left, Object right) {
        return compare(left, right) >= 0 ? left : right;
    }

    /**
     * Adds two numbers.
     *
     * @throws ArithmeticException if integral addition overflows a {@code long}
     */
    public static Number add(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Math.addExact(left.longValue(), right.longValue());
        }
        if ((left instanceof BigDecimal || right instanceof BigDecimal)
                && isFinite(left)
                && isFinite(right)) {
            return toBigDecimal(left).add(toBigDecimal(right));
        }
        return left.doubleValue() + right.doubleValue();
    }

    /**
     * Returns the absolute value, widening integral values to {@code long}. The absolute value of
     * {@link Long#MIN_VALUE} does not fit a {@code long} and is returned as a {@link BigDecimal}.
     */
    public static Number abs(Number value) {
        if (isIntegral(value)) {
            long longValue = value.longValue();
            if (longValue == Long.MIN_VALUE) {
                return BigDecimal.valueOf(longValue).negate();
            }
            return Math.abs(longValue);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).abs();
        }
        return Math.abs(value.doubleValue());
    }

    public static double toDouble(Object value) {
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(
                    String.format(
                            "Value %s of class %s is not numeric.",
                            value, value == null ? null : value.getClass().getName()));
        }
        return ((Number) value).doubleValue();
    }

    public static boolean isIntegral(Number value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte;
    }

    private static int compareNumbers(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        if ((left instanceof BigDecimal || right instanceof BigDecimal)
                && isFinite(left)
                && isFinite(right)) {
            return toBigDecimal(left).compareTo(toBigDecimal(right));
        }
        return Double.compare(left.doubleValue(), right.doubleValue());
    }

    private static boolean isFinite(Number value) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            return !Double.isNaN(d) && !Double.isInfinite(d);
        }
        return true;
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (isIntegral(value)) {
            return BigDecimal.valueOf(value.longValue());
        }
        return BigDecimal.valueOf(value.doubleValue());
    }

    private ValueUtils() {
        // no instantiation
    }
}
