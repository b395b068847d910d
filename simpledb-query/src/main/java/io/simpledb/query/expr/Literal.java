package io.simpledb.query.expr;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.Value;

public class Literal extends Expression {
    public final Value value;

    public Literal(Value value) {
        this.value = value;
    }

    public static Literal of(Object o) {
        return new Literal(Value.of(o));
    }

    @Override
    public ExprKind kind() {return ExprKind.LITERAL;}

    @Override
    public boolean foldable() {return true;}

    @Override
    public DataType dataType() {return value.dataType();}

    @Override
    public List<Expression> children() {return Collections.emptyList();}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        assert newChildren.size() == 0;
        return new Literal(value);
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(value, value.dataType());}

    @Override
    public String prettyString() {return value.toString();}

    @Override
    public String simpleString() {
        return value.dataType() == DataType.StringType ? "'" + value + "'" : value.toString();
    }

    @Override
    public ColumnVector evaluate(RecordBatch input) {
        return ColumnVector.constant(value, input.numRows());
    }
}
