package io.simpledb.query.expr.agg;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

import io.simpledb.query.ExecutionException;
import io.simpledb.query.expr.ExprKind;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.Value;

/**
 * An aggregate call over one argument expression. It can only be computed by an aggregate operator,
 * which feeds each group member into a fresh {@link Accumulator}.
 */
public abstract class AggregateFunction extends Expression {
    public final Expression child;

    protected AggregateFunction(Expression child) {
        this.child = child;
    }

    /**
     * Looks up an aggregate function by its SQL name, returns null if there is no such one.
     */
    public static AggregateFunction create(String name, Expression child) {
        switch (name.toLowerCase()) {
            case "count":
                return new Count(child);
            case "sum":
                return new Sum(child);
            case "avg":
                return new Average(child);
            case "max":
                return new Max(child);
            case "min":
                return new Min(child);
            default:
                return null;
        }
    }

    public abstract Accumulator newAccumulator();

    @Override
    public ExprKind kind() {return ExprKind.AGGREGATE;}

    @Override
    public List<Expression> children() {return Collections.singletonList(child);}

    @Override
    public List<Object> args() {return Lists.newArrayList(child);}

    /** The SQL name of the function. */
    public String prettyName() {return getClass().getSimpleName().toLowerCase();}

    @Override
    public String prettyString() {
        return prettyName() + "(" + child.prettyString() + ")";
    }

    @Override
    public String simpleString() {
        return prettyName() + "(" + child.simpleString() + ")";
    }

    protected void checkNumeric(Value v) {
        if (!v.isNumeric()) {
            throw ExecutionException.typeError(String.format("Function %s requires a numeric argument, got %s",
                    prettyName(), v.dataType().typeName()));
        }
    }
}
