package io.simpledb.query.plan.logical;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;

import javax.annotation.Nullable;

import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.StructType;

/**
 * Skips {@code offset} rows, then keeps at most {@code limit} rows. A null limit is unbounded.
 */
public class Limit extends LPUnaryNode {
    @Nullable
    public final Long limit;
    public final long offset;

    public Limit(@Nullable Long limit, long offset, LogicalPlan child) {
        super(child);
        Preconditions.checkArgument(limit == null || limit >= 0, "negative limit %s", limit);
        Preconditions.checkArgument(offset >= 0, "negative offset %s", offset);
        this.limit = limit;
        this.offset = offset;
    }

    @Override
    public PlanKind kind() {return PlanKind.LIMIT;}

    @Override
    public StructType schema() {return child.schema();}

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        assert newChildren.size() == 1;
        return new Limit(limit, offset, newChildren.get(0));
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(limit, offset, child);}
}
