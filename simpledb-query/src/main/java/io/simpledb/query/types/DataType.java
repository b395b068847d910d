package io.simpledb.query.types;

import org.apache.commons.lang.StringUtils;

/**
 * Scalar column types. The declaration order is the numeric promotion order.
 */
public enum DataType {
    // @formatter:off
    NullType("void", false),
    BooleanType("bool", false),
    LongType("bigint", true),
    DoubleType("double", true),
    StringType("varchar", false),
    ;
    // @formatter:on

    public final String aliasName;
    public final boolean numeric;

    DataType(String aliasName, boolean numeric) {
        this.aliasName = aliasName;
        this.numeric = numeric;
    }

    public String typeName() {return StringUtils.removeEnd(this.name(), "Type").toLowerCase();}

    public String simpleString() {return aliasName;}

    public boolean isNumeric() {return numeric;}

    /**
     * The type arithmetic between {@code t1} and {@code t2} produces. Nulls take the other side's type,
     * a double on either side makes the result double.
     */
    public static DataType calType(DataType t1, DataType t2) {
        if (t1 == NullType) {
            return t2;
        }
        if (t2 == NullType) {
            return t1;
        }
        return t1.ordinal() >= t2.ordinal() ? t1 : t2;
    }

    public static DataType fromName(String name) {
        for (DataType dt : DataType.values()) {
            if (dt.typeName().equalsIgnoreCase(name) || dt.aliasName.equalsIgnoreCase(name)) {
                return dt;
            }
        }
        return null;
    }
}
