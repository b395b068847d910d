package io.simpledb.query.plan.logical;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.attr.Alias;
import io.simpledb.query.expr.attr.AttributeReference;
import io.simpledb.query.plan.QueryPlan;
import io.simpledb.query.types.StructField;

import static io.simpledb.util.Trick.forAll;

/**
 * Schema-only description of what a query computes. The node kinds are closed: subclasses live in this package.
 */
public abstract class LogicalPlan extends QueryPlan<LogicalPlan> {

    LogicalPlan() {}

    @Override
    public String nodeName() {
        return "logical." + getClass().getSimpleName();
    }

    /**
     * Returns true if all expressions of this node and its children are resolved.
     */
    public boolean resolved() {
        return forAll(expressions(), Expression::resolved) && forAll(children(), LogicalPlan::resolved);
    }

    /**
     * The output field an expression produces. A bare column keeps its qualified field, an alias
     * names the column, anything else is named by its display string.
     */
    public static StructField outputField(Expression e) {
        if (e instanceof AttributeReference) {
            return ((AttributeReference) e).toField();
        }
        if (e instanceof Alias) {
            return new StructField(((Alias) e).name(), e.dataType());
        }
        return new StructField(e.prettyString(), e.dataType());
    }
}
