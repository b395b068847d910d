package io.simpledb.query.batch;

import com.google.common.base.Preconditions;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;

import io.simpledb.query.types.DataType;
import io.simpledb.query.types.Value;

/**
 * A dense, immutable column of values. Every non-null value has the declared type.
 */
public final class ColumnVector {
    private final DataType dataType;
    private final Value[] values;

    private ColumnVector(DataType dataType, Value[] values) {
        this.dataType = dataType;
        this.values = values;
    }

    public static ColumnVector of(DataType dataType, List<Value> values) {
        Value[] vs = values.toArray(new Value[0]);
        for (Value v : vs) {
            Preconditions.checkArgument(v.isNull() || v.dataType() == dataType,
                    "value %s does not fit column type %s", v, dataType);
        }
        return new ColumnVector(dataType, vs);
    }

    public static ColumnVector constant(Value value, int size) {
        Value[] vs = new Value[size];
        Arrays.fill(vs, value);
        return new ColumnVector(value.dataType(), vs);
    }

    public DataType dataType() {
        return dataType;
    }

    public int size() {
        return values.length;
    }

    public Value get(int row) {
        return values[row];
    }

    public List<Value> values() {
        return new AbstractList<Value>() {
            @Override
            public Value get(int index) {
                return values[index];
            }

            @Override
            public int size() {
                return values.length;
            }
        };
    }

    /** Keeps the rows whose mask slot is set. {@code count} is the number of set slots. */
    public ColumnVector filter(boolean[] mask, int count) {
        Preconditions.checkArgument(mask.length == values.length);
        Value[] vs = new Value[count];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (mask[i]) {
                vs[j++] = values[i];
            }
        }
        return new ColumnVector(dataType, vs);
    }

    public ColumnVector slice(int from, int to) {
        return new ColumnVector(dataType, Arrays.copyOfRange(values, from, to));
    }

    @Override
    public String toString() {
        return dataType.typeName() + Arrays.toString(values);
    }

    /**
     * Collects values row by row. The builder is single use.
     */
    public static class Builder {
        private final DataType dataType;
        private final Value[] values;
        private int size;

        public Builder(DataType dataType, int capacity) {
            this.dataType = dataType;
            this.values = new Value[capacity];
        }

        public Builder add(Value v) {
            values[size++] = v;
            return this;
        }

        public ColumnVector build() {
            Preconditions.checkState(size == values.length, "expected %s values, got %s", values.length, size);
            return new ColumnVector(dataType, values);
        }
    }
}
