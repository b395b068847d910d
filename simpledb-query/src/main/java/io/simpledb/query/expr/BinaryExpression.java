package io.simpledb.query.expr;

import com.google.common.collect.Lists;

import java.util.List;

import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.types.DataType;

/**
 * {@code left op right}. Evaluated column at a time: both sides are evaluated over the whole batch first.
 */
public class BinaryExpression extends Expression {
    public final BinaryOperator op;
    public final Expression left, right;

    public BinaryExpression(BinaryOperator op, Expression left, Expression right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    @Override
    public ExprKind kind() {return ExprKind.BINARY;}

    public Expression left() {return left;}

    public Expression right() {return right;}

    @Override
    public boolean foldable() {return left.foldable() && right.foldable();}

    @Override
    public DataType dataType() {
        return op.resultType(left.dataType(), right.dataType());
    }

    @Override
    public List<Expression> children() {return Lists.newArrayList(left, right);}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        assert newChildren.size() == 2;
        return new BinaryExpression(op, newChildren.get(0), newChildren.get(1));
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(op, left, right);}

    @Override
    public String prettyString() {
        return left.prettyString() + " " + op.symbol + " " + right.prettyString();
    }

    @Override
    public String simpleString() {
        return "(" + left.simpleString() + " " + op.symbol + " " + right.simpleString() + ")";
    }

    @Override
    public ColumnVector evaluate(RecordBatch input) {
        ColumnVector l = left.evaluate(input);
        ColumnVector r = right.evaluate(input);
        int rows = input.numRows();
        ColumnVector.Builder builder = new ColumnVector.Builder(dataType(), rows);
        for (int i = 0; i < rows; i++) {
            builder.add(op.apply(l.get(i), r.get(i)));
        }
        return builder.build();
    }
}
