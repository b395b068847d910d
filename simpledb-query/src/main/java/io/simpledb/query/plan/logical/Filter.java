package io.simpledb.query.plan.logical;

import com.google.common.collect.Lists;

import java.util.List;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.StructType;

public class Filter extends LPUnaryNode {
    public final Expression condition;

    public Filter(Expression condition, LogicalPlan child) {
        super(child);
        this.condition = condition;
    }

    @Override
    public PlanKind kind() {return PlanKind.FILTER;}

    @Override
    public StructType schema() {return child.schema();}

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        assert newChildren.size() == 1;
        return new Filter(condition, newChildren.get(0));
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(condition, child);}
}
