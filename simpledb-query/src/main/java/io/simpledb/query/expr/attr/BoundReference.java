package io.simpledb.query.expr.attr;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

import io.simpledb.query.PlanningException;
import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.expr.ExprKind;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructType;

import static io.simpledb.util.Trick.indexWhere;

/**
 * A column fixed to a position of the input batch.
 */
public class BoundReference extends Expression {
    public final int ordinal;
    public final DataType dataType;
    public final String name;

    public BoundReference(int ordinal, DataType dataType, String name) {
        this.ordinal = ordinal;
        this.dataType = dataType;
        this.name = name;
    }

    @Override
    public ExprKind kind() {return ExprKind.COLUMN;}

    @Override
    public DataType dataType() {return dataType;}

    @Override
    public List<Expression> children() {return Collections.emptyList();}

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {return new BoundReference(ordinal, dataType, name);}

    @Override
    public List<Object> args() {return Lists.newArrayList(ordinal, dataType);}

    @Override
    public String prettyString() {return name;}

    @Override
    public String simpleString() {return String.format("input[%d, %s]", ordinal, dataType.typeName());}

    @Override
    public ColumnVector evaluate(RecordBatch input) {
        return input.column(ordinal);
    }

    /**
     * Replaces every {@link AttributeReference} in {@code expression} with its position in {@code input}.
     */
    @SuppressWarnings("unchecked")
    public static <A extends Expression> A bindReference(A expression, StructType input) {
        return (A) expression.transformUp(e -> {
            if (!(e instanceof AttributeReference)) {
                return e;
            }
            AttributeReference attr = (AttributeReference) e;
            int ordinal = indexWhere(input.fields(), f -> f.sameColumn(attr.toField()));
            if (ordinal < 0) {
                throw PlanningException.unsupportedExpression(attr.simpleString(),
                        "couldn't find it in input " + input);
            }
            return new BoundReference(ordinal, input.get(ordinal).dataType, attr.name);
        });
    }
}
