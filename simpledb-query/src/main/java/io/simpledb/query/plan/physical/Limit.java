package io.simpledb.query.plan.physical;

import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nullable;

import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.StructType;

/**
 * Skips the first {@code offset} rows, then passes at most {@code limit} rows, cutting batches where needed.
 */
public class Limit extends PPUnaryNode {
    @Nullable
    public final Long limit;
    public final long offset;

    public Limit(@Nullable Long limit, long offset, PhysicalPlan child) {
        super(child);
        this.limit = limit;
        this.offset = offset;
    }

    @Override
    public PlanKind kind() {return PlanKind.LIMIT;}

    @Override
    public StructType schema() {return child.schema();}

    @Override
    protected List<RecordBatch> doExecute() {
        List<RecordBatch> output = new ArrayList<>();
        if (limit != null && limit == 0) {
            return output;
        }
        long toSkip = offset;
        long remaining = limit == null ? Long.MAX_VALUE : limit;
        for (RecordBatch batch : child.execute()) {
            int rows = batch.numRows();
            if (toSkip >= rows) {
                toSkip -= rows;
                continue;
            }
            int from = (int) toSkip;
            toSkip = 0;
            int to = from + (int) Math.min(rows - from, remaining);
            output.add(batch.slice(from, to));
            remaining -= to - from;
            if (remaining == 0) {
                break;
            }
        }
        return output;
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        assert newChildren.size() == 1;
        return new Limit(limit, offset, newChildren.get(0));
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(limit, offset, child);}
}
