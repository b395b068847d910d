package io.simpledb.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.agg.AggregateFunction;
import io.simpledb.query.expr.attr.BoundReference;
import io.simpledb.query.expr.attr.Star;
import io.simpledb.query.expr.attr.UnresolvedAttribute;
import io.simpledb.query.plan.logical.Aggregate;
import io.simpledb.query.plan.logical.Filter;
import io.simpledb.query.plan.logical.Limit;
import io.simpledb.query.plan.logical.LogicalPlan;
import io.simpledb.query.plan.logical.Project;
import io.simpledb.query.plan.logical.Scan;
import io.simpledb.query.plan.physical.HashAggregate;
import io.simpledb.query.plan.physical.PhysicalPlan;
import io.simpledb.query.plan.physical.TableScan;
import io.simpledb.query.types.StructType;

import static io.simpledb.util.Trick.mapToList;

/**
 * Compiles a logical plan into an executable one, children first. Every expression is bound to the
 * output schema of the child it reads from.
 */
public class PhysicalPlanner {
    private static final Logger logger = LoggerFactory.getLogger(PhysicalPlanner.class);

    public PhysicalPlan createPhysicalPlan(LogicalPlan plan) {
        PhysicalPlan physicalPlan = doCreate(plan);
        logger.debug("Physical plan:\n{}", physicalPlan.treeString());
        return physicalPlan;
    }

    private PhysicalPlan doCreate(LogicalPlan plan) {
        switch (plan.kind()) {
            case SCAN:
                return new TableScan(((Scan) plan).source);
            case PROJECT: {
                Project project = (Project) plan;
                PhysicalPlan child = doCreate(project.child);
                List<Expression> exprs = mapToList(project.projectList, e -> createPhysicalExpression(e, child.schema()));
                return new io.simpledb.query.plan.physical.Project(exprs, project.schema(), child);
            }
            case FILTER: {
                Filter filter = (Filter) plan;
                PhysicalPlan child = doCreate(filter.child);
                return new io.simpledb.query.plan.physical.Filter(
                        createPhysicalExpression(filter.condition, child.schema()), child);
            }
            case AGGREGATE: {
                Aggregate aggregate = (Aggregate) plan;
                PhysicalPlan child = doCreate(aggregate.child);
                StructType input = child.schema();
                List<Expression> groupings = mapToList(aggregate.groupingExpressions, e -> createPhysicalExpression(e, input));
                List<AggregateFunction> functions = mapToList(aggregate.aggregateExpressions, f -> {
                    checkNoAggregate(f.child);
                    checkResolved(f);
                    return BoundReference.bindReference(f, input);
                });
                return new HashAggregate(groupings, functions, aggregate.schema(), child);
            }
            case LIMIT: {
                Limit limit = (Limit) plan;
                return new io.simpledb.query.plan.physical.Limit(limit.limit, limit.offset, doCreate(limit.child));
            }
            default:
                throw PlanningException.unsupportedPlanNode(plan);
        }
    }

    /**
     * Turns a resolved logical expression into one that can be evaluated against batches of {@code input}.
     *
     * @throws PlanningException with {@code UNSUPPORTED_EXPRESSION} for aggregate calls and unresolved names.
     */
    public Expression createPhysicalExpression(Expression expr, StructType input) {
        checkNoAggregate(expr);
        checkResolved(expr);
        return BoundReference.bindReference(expr, input);
    }

    private static void checkNoAggregate(Expression expr) {
        Expression agg = expr.find(e -> e instanceof AggregateFunction);
        if (agg != null) {
            throw PlanningException.unsupportedExpression(agg.prettyString(),
                    "aggregate functions are only allowed as the outermost call of an aggregation");
        }
    }

    private static void checkResolved(Expression expr) {
        Expression unresolved = expr.find(e -> e instanceof UnresolvedAttribute || e instanceof Star);
        if (unresolved != null) {
            throw PlanningException.unsupportedExpression(unresolved.prettyString(), "unresolved " + unresolved.nodeName());
        }
    }
}
