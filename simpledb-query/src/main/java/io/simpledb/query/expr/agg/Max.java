package io.simpledb.query.expr.agg;

import java.util.List;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.Value;

public class Max extends AggregateFunction {

    public Max(Expression child) {
        super(child);
    }

    @Override
    public DataType dataType() {return child.dataType();}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        assert newChildren.size() == 1;
        return new Max(newChildren.get(0));
    }

    @Override
    public Accumulator newAccumulator() {
        return new Extremum(1);
    }

    /**
     * Keeps the value that wins every comparison in {@code direction}. Null until a non-null value shows up.
     */
    static class Extremum implements Accumulator {
        private final int direction;
        private Value current = Value.NULL;

        Extremum(int direction) {
            this.direction = direction;
        }

        @Override
        public void update(Value value) {
            if (value.isNull()) {
                return;
            }
            if (current.isNull() || Integer.signum(Value.compare(value, current)) == direction) {
                current = value;
            }
        }

        @Override
        public Value evaluate() {
            return current;
        }
    }
}
