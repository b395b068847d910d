package io.simpledb.query.expr.attr;

import java.util.Collections;
import java.util.List;

import io.simpledb.query.UnresolvedException;
import io.simpledb.query.expr.ExprKind;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructType;

import static io.simpledb.util.Trick.mapToList;

/**
 * {@code SELECT *}, stands for every column of the input.
 */
public class Star extends Expression {
    // @formatter:off
    @Override public ExprKind kind() {return ExprKind.STAR;}
    @Override public DataType dataType() {throw new UnresolvedException(this, "dataType");}
    @Override public boolean resolved() {return false;}
    @Override public List<Expression> children() {return Collections.emptyList();}
    @Override public Expression withNewChildren(List<Expression> newChildren) {return new Star();}
    @Override public List<Object> args() {return Collections.emptyList();}
    @Override public String prettyString() {return "*";}
    // @formatter:on

    public List<Expression> expand(StructType input) {
        return mapToList(input.fields(), AttributeReference::of);
    }
}
