package io.simpledb.query.expr.attr;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import io.simpledb.query.UnresolvedException;
import io.simpledb.query.expr.ExprKind;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.DataType;

/**
 * A column reference straight from the statement, looked up by name against the input schema.
 */
public class UnresolvedAttribute extends Expression {
    @Nullable
    public final String qualifier;
    public final String name;

    public UnresolvedAttribute(@Nullable String qualifier, String name) {
        this.qualifier = qualifier;
        this.name = name;
    }

    public UnresolvedAttribute(String name) {
        this(null, name);
    }

    public String qualifiedName() {
        return qualifier == null ? name : qualifier + "." + name;
    }

    @Override
    public ExprKind kind() {return ExprKind.COLUMN;}

    @Override
    public boolean resolved() {return false;}

    @Override
    public DataType dataType() {throw new UnresolvedException(this, "dataType");}

    @Override
    public List<Expression> children() {return Collections.emptyList();}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {return new UnresolvedAttribute(qualifier, name);}

    @Override
    public List<Object> args() {return Lists.newArrayList(qualifier, name);}

    @Override
    public String prettyString() {return name;}

    @Override
    public String simpleString() {return "'" + qualifiedName();}
}
