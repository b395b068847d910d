package io.simpledb.query.plan.logical;

import java.util.Collections;
import java.util.List;

public abstract class LPLeafNode extends LogicalPlan {
    @Override
    public List<LogicalPlan> children() {return Collections.emptyList();}

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        assert newChildren.isEmpty();
        return this;
    }
}
