package io.simpledb.query;

import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import javax.annotation.Nullable;

import io.simpledb.query.expr.attr.AttributeReference;
import io.simpledb.query.plan.logical.Aggregate;
import io.simpledb.query.plan.logical.Filter;
import io.simpledb.query.plan.logical.Limit;
import io.simpledb.query.plan.logical.LogicalPlan;
import io.simpledb.query.plan.logical.Project;
import io.simpledb.query.plan.logical.Scan;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;

import static io.simpledb.util.Trick.filterToList;
import static io.simpledb.util.Trick.find;
import static io.simpledb.util.Trick.mapToList;

/**
 * Rewrites logical plans into cheaper equivalent ones. Every batch runs once.
 */
public class Optimizer extends RuleExecutor<LogicalPlan> {

    @Override
    protected List<Batch> batches() {
        return Lists.newArrayList(
                new Batch("Column Pruning", Once,
                        Lists.newArrayList(new ProjectionPushDown()))
        );
    }

    /**
     * Reads only the columns some ancestor needs. The needed columns are threaded from the root down to
     * each Scan, which gets a projection of just those columns right above it.
     * <p>
     * A projection of bare columns sitting directly on a Scan is left alone, so running the rule on its
     * own output changes nothing.
     */
    static class ProjectionPushDown implements Rule<LogicalPlan> {
        @Override
        public LogicalPlan apply(LogicalPlan plan) {
            return pushDown(plan, null);
        }

        /**
         * @param required columns of {@code plan}'s output used above it, null if all of them are.
         */
        private LogicalPlan pushDown(LogicalPlan plan, @Nullable List<StructField> required) {
            switch (plan.kind()) {
                case SCAN:
                    return prune((Scan) plan, required);
                case PROJECT: {
                    Project project = (Project) plan;
                    if (project.child instanceof Scan && project.isColumnPruning()) {
                        return project;
                    }
                    LogicalPlan child = pushDown(project.child, fieldsOf(project.child, project.references()));
                    return child == project.child ? project : new Project(project.projectList, child);
                }
                case FILTER: {
                    Filter filter = (Filter) plan;
                    List<StructField> needed = null;
                    if (required != null) {
                        List<StructField> union = new ArrayList<>(required);
                        for (StructField f : fieldsOf(filter.child, filter.references())) {
                            if (find(union, n -> n.sameColumn(f)) == null) {
                                union.add(f);
                            }
                        }
                        needed = union;
                    }
                    LogicalPlan child = pushDown(filter.child, needed);
                    return child == filter.child ? filter : new Filter(filter.condition, child);
                }
                case AGGREGATE: {
                    Aggregate aggregate = (Aggregate) plan;
                    LogicalPlan child = pushDown(aggregate.child, fieldsOf(aggregate.child, aggregate.references()));
                    return child == aggregate.child
                            ? aggregate
                            : new Aggregate(aggregate.groupingExpressions, aggregate.aggregateExpressions, child);
                }
                case LIMIT: {
                    Limit limit = (Limit) plan;
                    LogicalPlan child = pushDown(limit.child, required);
                    return child == limit.child ? limit : new Limit(limit.limit, limit.offset, child);
                }
                default:
                    throw PlanningException.unsupportedPlanNode(plan);
            }
        }

        private static List<StructField> fieldsOf(LogicalPlan plan, Collection<AttributeReference> refs) {
            StructType schema = plan.schema();
            return filterToList(schema.fields(), f -> refs.stream().anyMatch(r -> f.sameColumn(r.toField())));
        }

        private static LogicalPlan prune(Scan scan, @Nullable List<StructField> required) {
            if (required == null) {
                return scan;
            }
            List<StructField> all = scan.schema().fields();
            List<StructField> kept = filterToList(all, f -> find(required, r -> r.sameColumn(f)) != null);
            if (kept.isEmpty() && !all.isEmpty()) {
                // Nothing is read, keep one column so the row count survives.
                kept = Lists.newArrayList(all.get(0));
            }
            if (kept.size() == all.size()) {
                return scan;
            }
            return new Project(mapToList(kept, AttributeReference::of), scan);
        }
    }
}
