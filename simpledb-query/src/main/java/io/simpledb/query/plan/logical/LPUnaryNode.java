package io.simpledb.query.plan.logical;

import java.util.Collections;
import java.util.List;

public abstract class LPUnaryNode extends LogicalPlan {
    public final LogicalPlan child;

    LPUnaryNode(LogicalPlan child) {
        this.child = child;
    }

    public LogicalPlan child() {return child;}

    @Override
    public List<LogicalPlan> children() {return Collections.singletonList(child);}
}
