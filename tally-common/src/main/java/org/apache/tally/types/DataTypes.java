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

import org.apache.tally.annotation.PublicEvolving;

/**
 * A {@link DataType} can be used to declare input and/or output types of aggregations. This class
 * enumerates all supported data types. All types are nullable by default; use {@link
 * DataType#copy(boolean)} to declare a NOT NULL type.
 *
 * @since 0.1
 */
@PublicEvolving
// CHECKSTYLE.OFF: MethodName - Factory methods use uppercase naming convention
public class DataTypes {

    /** Data type of a boolean with a three-valued logic of {@code TRUE, FALSE, UNKNOWN}. */
    public static DataType BOOLEAN() {
        return new DataType(DataTypeRoot.BOOLEAN, true);
    }

    /** Data type of a 1-byte signed integer with values from -128 to 127. */
    public static DataType TINYINT() {
        return new DataType(DataTypeRoot.TINYINT, true);
    }

    /** Data type of a 2-byte signed integer with values from -32,768 to 32,767. */
    public static DataType SMALLINT() {
        return new DataType(DataTypeRoot.SMALLINT, true);
    }

    /** Data type of a 4-byte signed integer with values from -2,147,483,648 to 2,147,483,647. */
    public static DataType INT() {
        return new DataType(DataTypeRoot.INTEGER, true);
    }

    /** Data type of an 8-byte signed integer. */
    public static DataType BIGINT() {
        return new DataType(DataTypeRoot.BIGINT, true);
    }

    /** Data type of a 4-byte single precision floating point number. */
    public static DataType FLOAT() {
        return new DataType(DataTypeRoot.FLOAT, true);
    }

    /** Data type of an 8-byte double precision floating point number. */
    public static DataType DOUBLE() {
        return new DataType(DataTypeRoot.DOUBLE, true);
    }

    /** Data type of a decimal number, held as {@link java.math.BigDecimal}. */
    public static DataType DECIMAL() {
        return new DataType(DataTypeRoot.DECIMAL, true);
    }

    /** Data type of a variable-length character string. */
    public static DataType STRING() {
        return new DataType(DataTypeRoot.STRING, true);
    }

    /** Data type of a date consisting of {@code year-month-day}. */
    public static DataType DATE() {
        return new DataType(DataTypeRoot.DATE, true);
    }

    /** Data type of a timestamp without time zone. */
    public static DataType TIMESTAMP() {
        return new DataType(DataTypeRoot.TIMESTAMP_WITHOUT_TIME_ZONE, true);
    }

    private DataTypes() {
        // no instantiation
    }
}
// CHECKSTYLE.ON: MethodName
