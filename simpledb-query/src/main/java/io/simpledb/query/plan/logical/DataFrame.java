package io.simpledb.query.plan.logical;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nullable;

import io.simpledb.query.AnalysisException;
import io.simpledb.query.Analyzer;
import io.simpledb.query.catalog.TableSource;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.agg.AggregateFunction;
import io.simpledb.query.expr.attr.AttributeReference;
import io.simpledb.query.expr.attr.Star;
import io.simpledb.query.types.StructType;

import static io.simpledb.util.Trick.mapToList;

/**
 * Builds a logical plan operator by operator. Every step resolves its expressions against the
 * schema of the plan built so far, so name errors surface at the step that introduces them.
 * <pre>
 * DataFrame.scan(table, analyzer).filter(cond).project(exprs).logicalPlan()
 * </pre>
 */
public class DataFrame {
    private final LogicalPlan plan;
    private final Analyzer analyzer;
    @Nullable
    private final String relation;

    private DataFrame(LogicalPlan plan, Analyzer analyzer, @Nullable String relation) {
        this.plan = plan;
        this.analyzer = analyzer;
        this.relation = relation;
    }

    public static DataFrame scan(TableSource table, Analyzer analyzer) {
        return new DataFrame(new Scan(table), analyzer, table.name());
    }

    public LogicalPlan logicalPlan() {
        return plan;
    }

    public StructType schema() {
        return plan.schema();
    }

    /**
     * Resolves {@code expr} against the current output. Columns that were already resolved must still
     * be part of the current output.
     */
    public Expression resolve(Expression expr) {
        StructType schema = plan.schema();
        Expression resolved = analyzer.resolveExpression(expr, schema, relation);
        for (AttributeReference ref : resolved.references()) {
            if (schema.indexOf(ref.toField()) < 0) {
                throw AnalysisException.columnNotFound(ref.name, schema.fieldNames());
            }
        }
        return resolved;
    }

    private DataFrame with(LogicalPlan newPlan) {
        return new DataFrame(newPlan, analyzer, relation);
    }

    public DataFrame filter(Expression condition) {
        return with(new Filter(resolve(condition), plan));
    }

    /** Projects {@code exprs}, a {@link Star} expands to every current column. */
    public DataFrame project(List<Expression> exprs) {
        List<Expression> projectList = new ArrayList<>();
        for (Expression e : exprs) {
            if (e instanceof Star) {
                projectList.addAll(((Star) e).expand(plan.schema()));
            } else {
                projectList.add(resolve(e));
            }
        }
        return with(new Project(projectList, plan));
    }

    public DataFrame aggregate(List<Expression> groupingExpressions, List<AggregateFunction> aggregateExpressions) {
        return with(new Aggregate(
                mapToList(groupingExpressions, this::resolve),
                mapToList(aggregateExpressions, e -> (AggregateFunction) resolve(e)),
                plan));
    }

    public DataFrame limit(@Nullable Long limit, long offset) {
        return with(new Limit(limit, offset, plan));
    }

    @Override
    public String toString() {
        return plan.treeString();
    }
}
