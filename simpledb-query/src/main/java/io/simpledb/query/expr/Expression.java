package io.simpledb.query.expr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import io.simpledb.query.PlanningException;
import io.simpledb.query.TreeNode;
import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.expr.attr.AttributeReference;

import static io.simpledb.util.Trick.distinctBy;

public abstract class Expression extends TreeNode<Expression> implements Evaluable {

    public abstract ExprKind kind();

    /**
     * A user-facing string of this expression. Used as the output column name when the expression
     * is projected without an alias.
     */
    public abstract String prettyString();

    public boolean resolved() {
        return childrenResolved();
    }

    public boolean childrenResolved() {
        for (Expression e : children()) {
            if (!e.resolved()) return false;
        }
        return true;
    }

    public boolean foldable() {
        return false;
    }

    /** The resolved columns this expression reads, in first-seen order. */
    public List<AttributeReference> references() {
        List<AttributeReference> refs = collect(e -> e instanceof AttributeReference ? (AttributeReference) e : null);
        return distinctBy(refs, AttributeReference::semanticEquals);
    }

    public static List<AttributeReference> getReferences(Collection<? extends Expression> exprs) {
        List<AttributeReference> refs = new ArrayList<>();
        for (Expression e : exprs) {
            refs.addAll(e.references());
        }
        return distinctBy(refs, AttributeReference::semanticEquals);
    }

    @Override
    public ColumnVector evaluate(RecordBatch input) {
        throw PlanningException.unsupportedExpression(prettyString(), nodeName() + " can not be evaluated directly");
    }

    private static boolean checkSemantic(Collection<?> elements1, Collection<?> elements2) {
        if (elements1.size() != elements2.size()) {
            return false;
        }
        Iterator<?> it1 = elements1.iterator();
        Iterator<?> it2 = elements2.iterator();
        while (it1.hasNext()) {
            Object e1 = it1.next();
            Object e2 = it2.next();
            if (e1 == e2) {
                continue;
            }
            if (e1 == null || e2 == null) {
                return false;
            }
            if (e1 instanceof Expression && e2 instanceof Expression) {
                if (!((Expression) e1).semanticEquals((Expression) e2)) {
                    return false;
                }
            } else if (e1 instanceof Collection && e2 instanceof Collection) {
                if (!checkSemantic((Collection<?>) e1, (Collection<?>) e2)) {
                    return false;
                }
            } else if (!Objects.equals(e1, e2)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true when two expressions always compute the same result, even if they are different instances.
     */
    public boolean semanticEquals(Expression other) {
        return this.getClass() == other.getClass() && checkSemantic(this.args(), other.args());
    }

    @Override
    public String toString() {
        return simpleString();
    }
}
