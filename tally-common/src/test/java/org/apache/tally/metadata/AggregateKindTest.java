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

import org.apache.tally.exception.InvalidConfigException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link AggregateKind}. */
class AggregateKindTest {

    @ParameterizedTest
    @EnumSource(AggregateKind.class)
    void testStringRoundTrip(AggregateKind kind) {
        assertThat(AggregateKind.fromString(kind.toString())).isEqualTo(kind);
        assertThat(AggregateKind.fromString(kind.name())).isEqualTo(kind);
    }

    @Test
    void testFromString() {
        assertThat(AggregateKind.fromString("abs-max")).isEqualTo(AggregateKind.ABS_MAX);
        assertThat(AggregateKind.fromString(" Quantile ")).isEqualTo(AggregateKind.QUANTILE);
        assertThat(AggregateKind.fromString("median")).isNull();
        assertThat(AggregateKind.fromString("")).isNull();
        assertThat(AggregateKind.fromString(null)).isNull();
        assertThat(AggregateKind.ABS_MAX.toString()).isEqualTo("abs_max");
    }

    @Test
    void testSupportedParameters() {
        assertThat(AggregateKind.SUM.getSupportedParameters())
                .containsExactly(AggregateKind.PARAM_IGNORE_NULLS);
        assertThat(AggregateKind.STD.getSupportedParameters())
                .containsExactlyInAnyOrder(
                        AggregateKind.PARAM_IGNORE_NULLS, AggregateKind.PARAM_DDOF);
        assertThat(AggregateKind.QUANTILE.getSupportedParameters())
                .contains(AggregateKind.PARAM_Q, AggregateKind.PARAM_MAX_VALUES);
    }

    @Test
    void testValidateParameter() {
        AggregateKind.STD.validateParameter(AggregateKind.PARAM_DDOF, "0");
        AggregateKind.QUANTILE.validateParameter(AggregateKind.PARAM_Q, "1.0");
        AggregateKind.COUNT.validateParameter(AggregateKind.PARAM_IGNORE_NULLS, "TRUE");

        assertThatThrownBy(() -> AggregateKind.SUM.validateParameter(AggregateKind.PARAM_Q, "0.5"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("is not supported for aggregation 'sum'");
        assertThatThrownBy(
                        () -> AggregateKind.STD.validateParameter(AggregateKind.PARAM_DDOF, "-1"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("a non-negative integer");
        assertThatThrownBy(
                        () -> AggregateKind.QUANTILE.validateParameter(AggregateKind.PARAM_Q, "2"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("a number in [0, 1]");
        assertThatThrownBy(
                        () ->
                                AggregateKind.QUANTILE.validateParameter(
                                        AggregateKind.PARAM_Q, "half"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("a number");
        assertThatThrownBy(
                        () ->
                                AggregateKind.MIN.validateParameter(
                                        AggregateKind.PARAM_IGNORE_NULLS, "yes"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("true or false");
        assertThatThrownBy(
                        () ->
                                AggregateKind.QUANTILE.validateParameter(
                                        AggregateKind.PARAM_MAX_VALUES, " "))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("must be a non-empty string");
    }
}
