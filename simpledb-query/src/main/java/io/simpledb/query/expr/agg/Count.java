package io.simpledb.query.expr.agg;

import com.google.common.collect.Lists;

import java.util.List;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.Literal;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.Value;

/**
 * Counts every member row of the group, nulls included.
 */
public class Count extends AggregateFunction {
    public final boolean star;

    public Count(Expression child) {
        this(child, false);
    }

    private Count(Expression child, boolean star) {
        super(child);
        this.star = star;
    }

    /** {@code count(*)}. */
    public static Count star() {
        return new Count(Literal.of(1L), true);
    }

    @Override
    public DataType dataType() {return DataType.LongType;}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        assert newChildren.size() == 1;
        return new Count(newChildren.get(0), star);
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(child, star);}

    @Override
    public String prettyString() {
        return star ? "count(*)" : super.prettyString();
    }

    @Override
    public Accumulator newAccumulator() {
        return new Accumulator() {
            long count = 0;

            @Override
            public void update(Value value) {
                count++;
            }

            @Override
            public Value evaluate() {
                return Value.ofLong(count);
            }
        };
    }
}
