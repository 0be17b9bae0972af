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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An enumeration of the logical type roots a block column can have. Each root is tagged with the
 * {@link DataTypeFamily}s it belongs to and the Java class used to hold its values.
 *
 * @since 0.1
 */
@PublicEvolving
public enum DataTypeRoot {
    STRING(String.class, DataTypeFamily.PREDEFINED, DataTypeFamily.CHARACTER_STRING),

    BOOLEAN(Boolean.class, DataTypeFamily.PREDEFINED, DataTypeFamily.BOOLEAN),

    DECIMAL(
            java.math.BigDecimal.class,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    TINYINT(
            Byte.class,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    SMALLINT(
            Short.class,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    INTEGER(
            Integer.class,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    BIGINT(
            Long.class,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.INTEGER_NUMERIC,
            DataTypeFamily.EXACT_NUMERIC),

    FLOAT(
            Float.class,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.APPROXIMATE_NUMERIC),

    DOUBLE(
            Double.class,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.NUMERIC,
            DataTypeFamily.APPROXIMATE_NUMERIC),

    DATE(java.time.LocalDate.class, DataTypeFamily.PREDEFINED, DataTypeFamily.DATETIME),

    TIMESTAMP_WITHOUT_TIME_ZONE(
            java.time.LocalDateTime.class,
            DataTypeFamily.PREDEFINED,
            DataTypeFamily.DATETIME,
            DataTypeFamily.TIMESTAMP);

    private final Class<?> conversionClass;

    private final Set<DataTypeFamily> families;

    DataTypeRoot(
            Class<?> conversionClass,
            DataTypeFamily firstFamily,
            DataTypeFamily... otherFamilies) {
        this.conversionClass = conversionClass;
        this.families = Collections.unmodifiableSet(EnumSet.of(firstFamily, otherFamilies));
    }

    /** Returns the Java class holding values of this type inside a block. */
    public Class<?> getConversionClass() {
        return conversionClass;
    }

    public Set<DataTypeFamily> getFamilies() {
        return families;
    }
}
