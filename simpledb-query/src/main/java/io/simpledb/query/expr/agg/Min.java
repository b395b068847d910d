package io.simpledb.query.expr.agg;

import java.util.List;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.DataType;

public class Min extends AggregateFunction {

    public Min(Expression child) {
        super(child);
    }

    @Override
    public DataType dataType() {return child.dataType();}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        assert newChildren.size() == 1;
        return new Min(newChildren.get(0));
    }

    @Override
    public Accumulator newAccumulator() {
        return new Max.Extremum(-1);
    }
}
