package io.simpledb.query.expr.agg;

import java.util.List;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.Value;

/**
 * Sums the non-null arguments. Bigint arguments sum to bigint, anything else to double.
 * A group without any non-null argument sums to zero.
 */
public class Sum extends AggregateFunction {

    public Sum(Expression child) {
        super(child);
    }

    @Override
    public DataType dataType() {
        return child.dataType() == DataType.DoubleType ? DataType.DoubleType : DataType.LongType;
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        assert newChildren.size() == 1;
        return new Sum(newChildren.get(0));
    }

    @Override
    public Accumulator newAccumulator() {
        boolean isDouble = dataType() == DataType.DoubleType;
        return new Accumulator() {
            long longSum = 0;
            double doubleSum = 0;

            @Override
            public void update(Value value) {
                if (value.isNull()) {
                    return;
                }
                checkNumeric(value);
                if (isDouble) {
                    doubleSum += value.getDouble();
                } else {
                    longSum += value.getLong();
                }
            }

            @Override
            public Value evaluate() {
                return isDouble ? Value.ofDouble(doubleSum) : Value.ofLong(longSum);
            }
        };
    }
}
