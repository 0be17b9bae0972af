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

package org.apache.tally.block;

import org.apache.tally.annotation.PublicEvolving;
import org.apache.tally.metadata.Schema;
import org.apache.tally.types.DataType;
import org.apache.tally.types.DataTypeChecks;
import org.apache.tally.types.DataTypeRoot;
import org.apache.tally.utils.ValueUtils;

import javax.annotation.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.apache.tally.utils.Preconditions.checkArgument;
import static org.apache.tally.utils.Preconditions.checkNotNull;

/**
 * An immutable, in-memory {@link BlockAccessor} that stores each column of a {@link Schema} as a
 * list of boxed values.
 *
 * <p>Blocks are built row by row with {@link #newBuilder(Schema)} or column by column with {@link
 * #fromColumns(Schema, List)}. Every value must be an instance of the {@link
 * DataTypeRoot#getConversionClass() conversion class} of its column type.
 *
 * @since 0.1
 */
@PublicEvolving
public final class ColumnarBlock implements BlockAccessor {

    private final Schema schema;
    private final List<List<Object>> columns;
    private final int numRows;

    private ColumnarBlock(Schema schema, List<List<Object>> columns, int numRows) {
        this.schema = schema;
        this.columns = columns;
        this.numRows = numRows;
    }

    public Schema getSchema() {
        return schema;
    }

    @Override
    public int numRows() {
        return numRows;
    }

    @Override
    public long count(String column, boolean ignoreNulls) {
        List<Object> values = values(column);
        if (!ignoreNulls) {
            return values.size();
        }
        long count = 0;
        for (Object value : values) {
            if (value != null) {
                count++;
            }
        }
        return count;
    }

    @Nullable
    @Override
    public Number sum(String column, boolean ignoreNulls) {
        DataType type = requireNumeric(column, "sum");
        List<Object> values = nonNullValues(column, ignoreNulls);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (DataTypeChecks.isIntegral(type)) {
            long sum = 0L;
            for (Object value : values) {
                sum = Math.addExact(sum, ((Number) value).longValue());
            }
            return sum;
        } else if (type.is(DataTypeRoot.DECIMAL)) {
            BigDecimal sum = BigDecimal.ZERO;
            for (Object value : values) {
                sum = sum.add((BigDecimal) value);
            }
            return sum;
        } else {
            double sum = 0.0d;
            for (Object value : values) {
                sum += ((Number) value).doubleValue();
            }
            return sum;
        }
    }

    @Nullable
    @Override
    public Object min(String column, boolean ignoreNulls) {
        return extreme(column, ignoreNulls, true);
    }

    @Nullable
    @Override
    public Object max(String column, boolean ignoreNulls) {
        return extreme(column, ignoreNulls, false);
    }

    @Nullable
    @Override
    public Double sumOfSquaredDiffsFromMean(String column, boolean ignoreNulls, double mean) {
        requireNumeric(column, "sum of squared differences");
        List<Object> values = nonNullValues(column, ignoreNulls);
        if (values == null || values.isEmpty()) {
            return null;
        }
        double m2 = 0.0d;
        for (Object value : values) {
            double delta = ((Number) value).doubleValue() - mean;
            m2 += delta * delta;
        }
        return m2;
    }

    @Override
    public List<Object> column(String column) {
        return new ArrayList<>(values(column));
    }

    @Override
    public List<Object> distinct(String column) {
        Set<Object> distinct = new LinkedHashSet<>(values(column));
        return new ArrayList<>(distinct);
    }

    @Override
    public Iterator<Map<String, Object>> rows() {
        final List<String> names = schema.getColumnNames();
        return new Iterator<Map<String, Object>>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < numRows;
            }

            @Override
            public Map<String, Object> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < names.size(); i++) {
                    row.put(names.get(i), columns.get(i).get(next));
                }
                next++;
                return row;
            }
        };
    }

    /** Returns the rows {@code [from, to)} of this block as a new block. */
    public ColumnarBlock slice(int from, int to) {
        checkArgument(
                0 <= from && from <= to && to <= numRows,
                "Invalid slice [%s, %s) of a block with %s rows.",
                from,
                to,
                numRows);
        List<List<Object>> sliced = new ArrayList<>(columns.size());
        for (List<Object> column : columns) {
            sliced.add(Collections.unmodifiableList(new ArrayList<>(column.subList(from, to))));
        }
        return new ColumnarBlock(schema, Collections.unmodifiableList(sliced), to - from);
    }

    @Override
    public String toString() {
        return "ColumnarBlock{schema=" + schema + ", numRows=" + numRows + '}';
    }

    // --------------------------------------------------------------------------------------------

    private List<Object> values(String column) {
        return columns.get(indexOf(column));
    }

    private DataType requireNumeric(String column, String operation) {
        DataType type = typeOf(column);
        if (!DataTypeChecks.isNumeric(type)) {
            throw new UnsupportedOperationException(
                    String.format(
                            "Cannot compute %s of column %s with non-numeric type %s.",
                            operation, column, type));
        }
        return type;
    }

    private DataType typeOf(String column) {
        return schema.getColumns().get(indexOf(column)).getDataType();
    }

    private int indexOf(String column) {
        checkNotNull(column, "Column name must not be null.");
        int index = schema.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException(
                    String.format(
                            "Column %s does not exist in block with columns %s.",
                            column, schema.getColumnNames()));
        }
        return index;
    }

    /**
     * Returns the non-null values of a column, or null if nulls are not ignored and the column
     * contains one.
     */
    @Nullable
    private List<Object> nonNullValues(String column, boolean ignoreNulls) {
        List<Object> values = values(column);
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value == null) {
                if (!ignoreNulls) {
                    return null;
                }
            } else {
                result.add(value);
            }
        }
        return result;
    }

    @Nullable
    private Object extreme(String column, boolean ignoreNulls, boolean smallest) {
        DataType type = typeOf(column);
        if (!DataTypeChecks.isOrderable(type)) {
            throw new UnsupportedOperationException(
                    String.format(
                            "Cannot compute %s of column %s with unordered type %s.",
                            smallest ? "min" : "max", column, type));
        }
        List<Object> values = nonNullValues(column, ignoreNulls);
        if (values == null || values.isEmpty()) {
            return null;
        }
        Object result = values.get(0);
        for (int i = 1; i < values.size(); i++) {
            result =
                    smallest
                            ? ValueUtils.min(result, values.get(i))
                            : ValueUtils.max(result, values.get(i));
        }
        return result;
    }

    // --------------------------------------------------------------------------------------------

    /** Creates a builder that appends rows to a block of the given schema. */
    public static Builder newBuilder(Schema schema) {
        return new Builder(schema);
    }

    /**
     * Creates a block from whole columns. The columns are given in schema order and must all have
     * the same length.
     */
    public static ColumnarBlock fromColumns(Schema schema, List<? extends List<?>> columnValues) {
        checkNotNull(schema, "Schema must not be null.");
        checkArgument(
                columnValues.size() == schema.getColumnCount(),
                "Expected %s columns but got %s.",
                schema.getColumnCount(),
                columnValues.size());
        int numRows = columnValues.isEmpty() ? 0 : columnValues.get(0).size();
        List<List<Object>> columns = new ArrayList<>(columnValues.size());
        for (int i = 0; i < columnValues.size(); i++) {
            Schema.Column column = schema.getColumns().get(i);
            List<?> values = columnValues.get(i);
            checkArgument(
                    values.size() == numRows,
                    "Column %s has %s values, expected %s.",
                    column.getName(),
                    values.size(),
                    numRows);
            List<Object> copy = new ArrayList<>(values.size());
            for (Object value : values) {
                copy.add(checkValue(column, value));
            }
            columns.add(Collections.unmodifiableList(copy));
        }
        return new ColumnarBlock(schema, Collections.unmodifiableList(columns), numRows);
    }

    private static Object checkValue(Schema.Column column, @Nullable Object value) {
        DataType type = column.getDataType();
        if (value == null) {
            checkArgument(
                    type.isNullable(),
                    "Column %s of type %s does not accept null values.",
                    column.getName(),
                    type);
            return null;
        }
        Class<?> expected = type.getTypeRoot().getConversionClass();
        checkArgument(
                expected.isInstance(value),
                "Column %s of type %s expects values of %s, but got %s.",
                column.getName(),
                type,
                expected.getSimpleName(),
                value.getClass().getSimpleName());
        return value;
    }

    /** Builder appending rows to a {@link ColumnarBlock}. */
    public static final class Builder {
        private final Schema schema;
        private final List<List<Object>> columns;

        private Builder(Schema schema) {
            this.schema = checkNotNull(schema, "Schema must not be null.");
            this.columns = new ArrayList<>(schema.getColumnCount());
            for (int i = 0; i < schema.getColumnCount(); i++) {
                columns.add(new ArrayList<>());
            }
        }

        /** Appends one row, given its values in schema order. */
        public Builder addRow(Object... values) {
            checkArgument(
                    values.length == schema.getColumnCount(),
                    "Expected %s values per row but got %s.",
                    schema.getColumnCount(),
                    values.length);
            for (int i = 0; i < values.length; i++) {
                columns.get(i).add(checkValue(schema.getColumns().get(i), values[i]));
            }
            return this;
        }

        public ColumnarBlock build() {
            return fromColumns(schema, columns);
        }
    }
}
