package io.simpledb.query.expr.attr;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import io.simpledb.query.expr.ExprKind;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructField;

/**
 * A column resolved against a schema field. It still addresses the column by qualifier and name,
 * the position is only fixed when the expression is bound to a physical input.
 */
public final class AttributeReference extends Expression {
    @Nullable
    public final String qualifier;
    public final String name;
    public final DataType dataType;

    public AttributeReference(@Nullable String qualifier, String name, DataType dataType) {
        this.qualifier = qualifier;
        this.name = name;
        this.dataType = dataType;
    }

    public static AttributeReference of(StructField field) {
        return new AttributeReference(field.qualifier, field.name, field.dataType);
    }

    public StructField toField() {
        return new StructField(qualifier, name, dataType);
    }

    public String name() {return name;}

    @Override
    public ExprKind kind() {return ExprKind.COLUMN;}

    @Override
    public DataType dataType() {return dataType;}

    @Override
    public List<Expression> children() {return Collections.emptyList();}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {return new AttributeReference(qualifier, name, dataType);}

    @Override
    public List<Object> args() {return Lists.newArrayList(qualifier, name, dataType);}

    /** Whether both reference the same column. */
    public boolean sameRef(AttributeReference other) {
        return Objects.equals(qualifier, other.qualifier) && name.equals(other.name);
    }

    @Override
    public boolean semanticEquals(Expression other) {
        return other instanceof AttributeReference && sameRef((AttributeReference) other);
    }

    @Override
    public String prettyString() {return name;}

    @Override
    public String simpleString() {
        return (qualifier == null ? name : qualifier + "." + name) + ":" + dataType.typeName();
    }
}
