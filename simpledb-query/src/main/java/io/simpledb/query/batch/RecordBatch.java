package io.simpledb.query.batch;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

/**
 * The unit of data passed between operators: a schema and one column per field, all of the same length.
 * A batch never changes after construction.
 */
public final class RecordBatch {
    private final StructType schema;
    private final List<ColumnVector> columns;
    private final int numRows;

    public RecordBatch(StructType schema, List<ColumnVector> columns, int numRows) {
        Preconditions.checkArgument(schema.size() == columns.size(),
                "schema has %s fields but got %s columns", schema.size(), columns.size());
        for (ColumnVector c : columns) {
            Preconditions.checkArgument(c.size() == numRows, "column size %s, expected %s", c.size(), numRows);
        }
        this.schema = schema;
        this.columns = ImmutableList.copyOf(columns);
        this.numRows = numRows;
    }

    public RecordBatch(StructType schema, List<ColumnVector> columns) {
        this(schema, columns, columns.isEmpty() ? 0 : columns.get(0).size());
    }

    public static RecordBatch empty(StructType schema) {
        List<ColumnVector> columns = new ArrayList<>(schema.size());
        for (StructField f : schema.fields()) {
            columns.add(ColumnVector.of(f.dataType, ImmutableList.of()));
        }
        return new RecordBatch(schema, columns, 0);
    }

    /** Builds a batch from row-major values, as used by table registration. */
    public static RecordBatch fromRows(StructType schema, List<? extends List<Value>> rows) {
        List<ColumnVector> columns = new ArrayList<>(schema.size());
        for (int c = 0; c < schema.size(); c++) {
            ColumnVector.Builder builder = new ColumnVector.Builder(schema.get(c).dataType, rows.size());
            for (List<Value> row : rows) {
                Preconditions.checkArgument(row.size() == schema.size(),
                        "row %s does not match schema %s", row, schema);
                builder.add(row.get(c));
            }
            columns.add(builder.build());
        }
        return new RecordBatch(schema, columns, rows.size());
    }

    public StructType schema() {
        return schema;
    }

    public int numRows() {
        return numRows;
    }

    public int numColumns() {
        return columns.size();
    }

    public ColumnVector column(int ordinal) {
        return columns.get(ordinal);
    }

    public List<ColumnVector> columns() {
        return columns;
    }

    public List<Value> row(int rowId) {
        List<Value> row = new ArrayList<>(columns.size());
        for (ColumnVector c : columns) {
            row.add(c.get(rowId));
        }
        return row;
    }

    public List<List<Value>> rows() {
        List<List<Value>> rows = new ArrayList<>(numRows);
        for (int i = 0; i < numRows; i++) {
            rows.add(row(i));
        }
        return rows;
    }

    public RecordBatch filter(boolean[] mask) {
        int count = 0;
        for (boolean b : mask) {
            if (b) count++;
        }
        if (count == numRows) {
            return this;
        }
        List<ColumnVector> filtered = new ArrayList<>(columns.size());
        for (ColumnVector c : columns) {
            filtered.add(c.filter(mask, count));
        }
        return new RecordBatch(schema, filtered, count);
    }

    public RecordBatch slice(int from, int to) {
        Preconditions.checkPositionIndexes(from, to, numRows);
        if (from == 0 && to == numRows) {
            return this;
        }
        List<ColumnVector> sliced = new ArrayList<>(columns.size());
        for (ColumnVector c : columns) {
            sliced.add(c.slice(from, to));
        }
        return new RecordBatch(schema, sliced, to - from);
    }

    @Override
    public String toString() {
        return "RecordBatch" + schema + " rows=" + numRows;
    }
}
