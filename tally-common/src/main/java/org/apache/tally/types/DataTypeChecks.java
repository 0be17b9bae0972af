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

package org.apache.tally.types;

/** Utilities for checking {@link DataType} capabilities required by aggregations. */
public final class DataTypeChecks {

    /** Returns whether values of the type support arithmetic (sum, mean, variance). */
    public static boolean isNumeric(DataType dataType) {
        return dataType.is(DataTypeFamily.NUMERIC);
    }

    /** Returns whether values of the type have a total order (min, max, sort). */
    public static boolean isOrderable(DataType dataType) {
        return isNumeric(dataType)
                || dataType.is(DataTypeFamily.CHARACTER_STRING)
                || dataType.is(DataTypeFamily.DATETIME)
                || dataType.is(DataTypeFamily.BOOLEAN);
    }

    /** Returns whether sums over the type stay in integral arithmetic. */
    public static boolean isIntegral(DataType dataType) {
        return dataType.is(DataTypeFamily.INTEGER_NUMERIC);
    }

    private DataTypeChecks() {
        // no instantiation
    }
}
