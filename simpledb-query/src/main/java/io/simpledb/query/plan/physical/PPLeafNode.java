package io.simpledb.query.plan.physical;

import java.util.Collections;
import java.util.List;

public abstract class PPLeafNode extends PhysicalPlan {
    @Override
    public List<PhysicalPlan> children() {return Collections.emptyList();}

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        assert newChildren.isEmpty();
        return this;
    }
}
