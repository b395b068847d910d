package io.simpledb.query.plan.logical;

import com.google.common.collect.Lists;

import java.util.List;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.agg.AggregateFunction;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.StructType;

import static io.simpledb.util.Trick.concatToList;
import static io.simpledb.util.Trick.mapToList;

/**
 * Groups the input by the grouping expressions, no grouping expression means one global group.
 * The output is the group keys followed by one column per aggregate function.
 */
public class Aggregate extends LPUnaryNode {
    public final List<Expression> groupingExpressions;
    public final List<AggregateFunction> aggregateExpressions;
    private final StructType schema;

    public Aggregate(List<Expression> groupingExpressions, List<AggregateFunction> aggregateExpressions, LogicalPlan child) {
        super(child);
        this.groupingExpressions = groupingExpressions;
        this.aggregateExpressions = aggregateExpressions;
        this.schema = new StructType(concatToList(
                mapToList(groupingExpressions, LogicalPlan::outputField),
                mapToList(aggregateExpressions, LogicalPlan::outputField)));
    }

    @Override
    public PlanKind kind() {return PlanKind.AGGREGATE;}

    @Override
    public StructType schema() {return schema;}

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        assert newChildren.size() == 1;
        return new Aggregate(groupingExpressions, aggregateExpressions, newChildren.get(0));
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(groupingExpressions, aggregateExpressions, child);}
}
