package io.simpledb.query.expr.agg;

import java.util.List;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.Value;

/**
 * sum / count of the non-null arguments, divided once at the end. Null for a group without any.
 */
public class Average extends AggregateFunction {

    public Average(Expression child) {
        super(child);
    }

    @Override
    public String prettyName() {return "avg";}

    @Override
    public DataType dataType() {return DataType.DoubleType;}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        assert newChildren.size() == 1;
        return new Average(newChildren.get(0));
    }

    @Override
    public Accumulator newAccumulator() {
        return new Accumulator() {
            double sum = 0;
            long count = 0;

            @Override
            public void update(Value value) {
                if (value.isNull()) {
                    return;
                }
                checkNumeric(value);
                sum += value.getDouble();
                count++;
            }

            @Override
            public Value evaluate() {
                return count == 0 ? Value.NULL : Value.ofDouble(sum / count);
            }
        };
    }
}
