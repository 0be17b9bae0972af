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
import org.apache.tally.types.DataType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.apache.tally.utils.Preconditions.checkArgument;
import static org.apache.tally.utils.Preconditions.checkNotNull;

/**
 * The schema of a block: an ordered list of uniquely named, typed columns. Aggregations validate
 * their target column against a schema once, before any block is processed.
 *
 * <p>Use {@link #newBuilder()} to create a schema:
 *
 * <pre>{@code
 * Schema schema = Schema.newBuilder()
 *     .column("id", DataTypes.BIGINT())
 *     .column("price", DataTypes.DOUBLE())
 *     .build();
 * }</pre>
 *
 * @since 0.1
 */
@PublicEvolving
public final class Schema implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Column> columns;

    private Schema(List<Column> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return columns.stream().map(Column::getName).collect(Collectors.toList());
    }

    public int getColumnCount() {
        return columns.size();
    }

    /** Returns the column with the given name, if the schema contains it. */
    public Optional<Column> getColumn(String columnName) {
        for (Column column : columns) {
            if (column.getName().equals(columnName)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /** Returns the position of the column with the given name, or -1 if there is none. */
    public int indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getName().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Schema schema = (Schema) o;
        return columns.equals(schema.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns);
    }

    @Override
    public String toString() {
        return columns.stream().map(Column::toString).collect(Collectors.joining(", ", "(", ")"));
    }

    /** Builder for configuring and creating instances of {@link Schema}. */
    public static Schema.Builder newBuilder() {
        return new Builder();
    }

    // --------------------------------------------------------------------------------------------

    /** A column of a {@link Schema}. */
    public static final class Column implements Serializable {

        private static final long serialVersionUID = 1L;

        private final String name;
        private final DataType dataType;

        public Column(String name, DataType dataType) {
            this.name = checkNotNull(name, "Column name must not be null.");
            this.dataType = checkNotNull(dataType, "Column data type must not be null.");
        }

        public String getName() {
            return name;
        }

        public DataType getDataType() {
            return dataType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Column column = (Column) o;
            return name.equals(column.name) && dataType.equals(column.dataType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, dataType);
        }

        @Override
        public String toString() {
            return name + " " + dataType.asSummaryString();
        }
    }

    // --------------------------------------------------------------------------------------------

    /** A builder for constructing an immutable {@link Schema}. */
    public static final class Builder {
        private final List<Column> columns = new ArrayList<>();
        private final Set<String> columnNames = new HashSet<>();

        private Builder() {}

        /**
         * Declares a column that is appended to this schema.
         *
         * @param columnName the name of the column
         * @param dataType the data type of the column
         */
        public Builder column(String columnName, DataType dataType) {
            checkNotNull(columnName, "Column name must not be null.");
            checkArgument(
                    columnNames.add(columnName),
                    "Column %s already exists in the schema.",
                    columnName);
            columns.add(new Column(columnName, dataType));
            return this;
        }

        /** Adopts all columns from the given schema. */
        public Builder fromSchema(Schema schema) {
            for (Column column : schema.getColumns()) {
                column(column.getName(), column.getDataType());
            }
            return this;
        }

        public Schema build() {
            return new Schema(columns);
        }
    }
}
