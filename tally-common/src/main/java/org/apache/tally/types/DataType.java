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

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

import static org.apache.tally.utils.Preconditions.checkNotNull;

/**
 * Describes the logical type of a column in a block. A type is a {@link DataTypeRoot} plus a
 * nullability flag. Instances are created through {@link DataTypes}.
 *
 * @since 0.1
 */
@PublicEvolving
public final class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DataTypeRoot typeRoot;

    private final boolean isNullable;

    DataType(DataTypeRoot typeRoot, boolean isNullable) {
        this.typeRoot = checkNotNull(typeRoot, "Data type root must not be null.");
        this.isNullable = isNullable;
    }

    public DataTypeRoot getTypeRoot() {
        return typeRoot;
    }

    public boolean isNullable() {
        return isNullable;
    }

    /** Returns a copy of this type with the given nullability. */
    public DataType copy(boolean isNullable) {
        return new DataType(typeRoot, isNullable);
    }

    /** Returns whether the root of the type equals to the {@code typeRoot} or not. */
    public boolean is(DataTypeRoot typeRoot) {
        return this.typeRoot == typeRoot;
    }

    /** Returns whether the root of the type is part of the given family or not. */
    public boolean is(DataTypeFamily family) {
        return typeRoot.getFamilies().contains(family);
    }

    public String asSummaryString() {
        String name = typeRoot.name().replace('_', ' ').toUpperCase(Locale.ROOT);
        return isNullable ? name : name + " NOT NULL";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType that = (DataType) o;
        return isNullable == that.isNullable && typeRoot == that.typeRoot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeRoot, isNullable);
    }

    @Override
    public String toString() {
        return asSummaryString();
    }
}
