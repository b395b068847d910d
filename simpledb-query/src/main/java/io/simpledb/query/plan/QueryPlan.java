package io.simpledb.query.plan;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

import io.simpledb.query.TreeNode;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.attr.AttributeReference;
import io.simpledb.query.types.StructType;

import static io.simpledb.util.Trick.flatMapToList;

public abstract class QueryPlan<PlanType extends QueryPlan<PlanType>> extends TreeNode<PlanType> {

    public abstract PlanKind kind();

    /** The output schema, derived from the children without touching any data. */
    public abstract StructType schema();

    private static List<Expression> collectionToExprs(Collection<?> c) {
        return flatMapToList(c, e -> {
            if (e instanceof Expression) {
                return Collections.singletonList((Expression) e);
            }
            if (e instanceof Collection) {
                return collectionToExprs((Collection<?>) e);
            }
            return Collections.emptyList();
        });
    }

    /** Returns all of the expressions present in this operator. */
    public List<Expression> expressions() {
        return collectionToExprs(args());
    }

    /**
     * All columns that appear in expressions of this operator. Columns passed through to the
     * output without being referenced are not included.
     */
    public List<AttributeReference> references() {
        return Expression.getReferences(expressions());
    }
}
