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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ValueUtils}. */
class ValueUtilsTest {

    @Test
    void testCompareNumbersByValue() {
        assertThat(ValueUtils.compare(1, 2L)).isNegative();
        assertThat(ValueUtils.compare(3L, 3)).isZero();
        assertThat(ValueUtils.compare(Double.POSITIVE_INFINITY, 5)).isPositive();
        assertThat(ValueUtils.compare(new BigDecimal("1.5"), 1)).isPositive();
        assertThat(ValueUtils.compare("a", "b")).isNegative();
        assertThat(ValueUtils.compare(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)))
                .isPositive();
    }

    @Test
    void testMinMaxKeepOperands() {
        assertThat(ValueUtils.min(Double.POSITIVE_INFINITY, 3)).isEqualTo(3);
        assertThat(ValueUtils.max(Double.NEGATIVE_INFINITY, 3L)).isEqualTo(3L);
        assertThat(ValueUtils.max("x", "y")).isEqualTo("y");
    }

    @Test
    void testAdd() {
        assertThat(ValueUtils.add(1, 2L)).isEqualTo(3L);
        assertThat(ValueUtils.add(1.5d, 2)).isEqualTo(3.5d);
        assertThat(ValueUtils.add(new BigDecimal("1.25"), 2L)).isEqualTo(new BigDecimal("3.25"));
        assertThatThrownBy(() -> ValueUtils.add(Long.MAX_VALUE, 1))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void testAbs() {
        assertThat(ValueUtils.abs(-3)).isEqualTo(3L);
        assertThat(ValueUtils.abs(-2.5d)).isEqualTo(2.5d);
        assertThat(ValueUtils.abs(new BigDecimal("-1.1"))).isEqualTo(new BigDecimal("1.1"));
        assertThat(ValueUtils.abs(Integer.MIN_VALUE)).isEqualTo(2147483648L);
    }

    @Test
    void testAbsOfLongMinValueDoesNotOverflow() {
        assertThat(ValueUtils.abs(Long.MIN_VALUE))
                .isEqualTo(new BigDecimal("9223372036854775808"));
        assertThat(ValueUtils.abs(Long.MIN_VALUE + 1)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void testToDouble() {
        assertThat(ValueUtils.toDouble(2)).isEqualTo(2.0d);
        assertThatThrownBy(() -> ValueUtils.toDouble("2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not numeric");
    }
}
