package io.simpledb.query.types;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * A schema column. Computed columns have no qualifier.
 */
public class StructField {
    @Nullable
    public final String qualifier;
    public final String name;
    public final DataType dataType;

    public StructField(@Nullable String qualifier, String name, DataType dataType) {
        this.qualifier = qualifier;
        this.name = name;
        this.dataType = dataType;
    }

    public StructField(String name, DataType dataType) {
        this(null, name, dataType);
    }

    @Nullable
    public String qualifier() {return qualifier;}

    public String name() {return name;}

    public DataType dataType() {return dataType;}

    /** The header shown to users, {@code t1.id} or just {@code name}. */
    public String qualifiedName() {
        return qualifier == null ? name : qualifier + "." + name;
    }

    /** Whether both fields address the same column, regardless of type. */
    public boolean sameColumn(StructField other) {
        return Objects.equals(qualifier, other.qualifier) && name.equals(other.name);
    }

    public StructField withQualifier(@Nullable String newQualifier) {
        return new StructField(newQualifier, name, dataType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructField that = (StructField) o;
        return Objects.equals(qualifier, that.qualifier)
                && name.equals(that.name)
                && dataType == that.dataType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier, name, dataType);
    }

    @Override
    public String toString() {
        return qualifiedName() + ":" + dataType.typeName();
    }
}
