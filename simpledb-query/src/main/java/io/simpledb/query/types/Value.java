package io.simpledb.query.types;

import com.google.common.base.Preconditions;

import java.util.Objects;

import io.simpledb.query.ExecutionException;

/**
 * An immutable scalar. Numbers and booleans are kept in one uniform long slot, doubles as their raw bits.
 */
public final class Value {
    public static final Value NULL = new Value(DataType.NullType, 0, null);
    public static final Value TRUE = new Value(DataType.BooleanType, 1, null);
    public static final Value FALSE = new Value(DataType.BooleanType, 0, null);

    private final DataType dataType;
    private final long uniformVal;
    private final String stringVal;

    private Value(DataType dataType, long uniformVal, String stringVal) {
        this.dataType = dataType;
        this.uniformVal = uniformVal;
        this.stringVal = stringVal;
    }

    public static Value ofLong(long v) {
        return new Value(DataType.LongType, v, null);
    }

    /**
     * Negative zero is stored as zero and every NaN as the canonical NaN, so equal doubles share one group key.
     */
    public static Value ofDouble(double v) {
        return new Value(DataType.DoubleType, Double.doubleToLongBits(v == 0.0 ? 0.0 : v), null);
    }

    public static Value ofBoolean(boolean v) {
        return v ? TRUE : FALSE;
    }

    public static Value ofString(String v) {
        return v == null ? NULL : new Value(DataType.StringType, 0, v);
    }

    /**
     * Wraps a plain java object, mostly for building tables by hand. Integral boxes become longs,
     * floating boxes become doubles.
     */
    public static Value of(Object o) {
        if (o == null) {
            return NULL;
        }
        if (o instanceof Value) {
            return (Value) o;
        }
        if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
            return ofLong(((Number) o).longValue());
        }
        if (o instanceof Double || o instanceof Float) {
            return ofDouble(((Number) o).doubleValue());
        }
        if (o instanceof Boolean) {
            return ofBoolean((Boolean) o);
        }
        if (o instanceof String) {
            return ofString((String) o);
        }
        throw new IllegalArgumentException("Unsupported value class: " + o.getClass().getName());
    }

    public DataType dataType() {return dataType;}

    public boolean isNull() {return dataType == DataType.NullType;}

    public boolean isNumeric() {return dataType.isNumeric();}

    public long getLong() {
        Preconditions.checkState(dataType == DataType.LongType, "not a bigint: %s", this);
        return uniformVal;
    }

    /** Reads a numeric value as double, widening bigints. */
    public double getDouble() {
        if (dataType == DataType.LongType) {
            return (double) uniformVal;
        }
        Preconditions.checkState(dataType == DataType.DoubleType, "not a number: %s", this);
        return Double.longBitsToDouble(uniformVal);
    }

    public boolean getBoolean() {
        Preconditions.checkState(dataType == DataType.BooleanType, "not a boolean: %s", this);
        return uniformVal != 0;
    }

    public String getString() {
        Preconditions.checkState(dataType == DataType.StringType, "not a string: %s", this);
        return stringVal;
    }

    /**
     * Orders two non-null values of comparable types. Numbers compare across bigint and double.
     *
     * @throws ExecutionException if the types can not be compared.
     */
    public static int compare(Value v1, Value v2) {
        DataType t1 = v1.dataType, t2 = v2.dataType;
        if (t1 == DataType.LongType && t2 == DataType.LongType) {
            return Long.compare(v1.uniformVal, v2.uniformVal);
        }
        if (t1.isNumeric() && t2.isNumeric()) {
            return Double.compare(v1.getDouble(), v2.getDouble());
        }
        if (t1 == t2 && t1 == DataType.StringType) {
            return v1.stringVal.compareTo(v2.stringVal);
        }
        if (t1 == t2 && t1 == DataType.BooleanType) {
            return Long.compare(v1.uniformVal, v2.uniformVal);
        }
        throw ExecutionException.typeError(String.format("Cannot compare %s with %s", t1.typeName(), t2.typeName()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Value value = (Value) o;
        return uniformVal == value.uniformVal
                && dataType == value.dataType
                && Objects.equals(stringVal, value.stringVal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, uniformVal, stringVal);
    }

    /** The textual rendering used for display names and result tables. */
    @Override
    public String toString() {
        switch (dataType) {
            case NullType:
                return "NULL";
            case BooleanType:
                return uniformVal != 0 ? "true" : "false";
            case LongType:
                return Long.toString(uniformVal);
            case DoubleType:
                return Double.toString(Double.longBitsToDouble(uniformVal));
            case StringType:
                return stringVal;
            default:
                throw new IllegalStateException(dataType.name());
        }
    }
}
