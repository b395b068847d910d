package io.simpledb.query.expr.attr;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.expr.ExprKind;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.DataType;

/**
 * Names the output column of its child, {@code age + 1 AS older}.
 */
public class Alias extends Expression {
    public final Expression child;
    public final String name;

    public Alias(Expression child, String name) {
        this.child = child;
        this.name = name;
    }

    public String name() {return name;}

    @Override
    public ExprKind kind() {return ExprKind.ALIAS;}

    @Override
    public DataType dataType() {return child.dataType();}

    @Override
    public List<Expression> children() {return Collections.singletonList(child);}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        assert newChildren.size() == 1;
        return new Alias(newChildren.get(0), name);
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(child, name);}

    @Override
    public String prettyString() {return name;}

    @Override
    public String simpleString() {return child.simpleString() + " AS " + name;}

    @Override
    public ColumnVector evaluate(RecordBatch input) {
        return child.evaluate(input);
    }
}
