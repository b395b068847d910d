package io.simpledb.query.plan.physical;

import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;

import io.simpledb.query.ExecutionException;
import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

/**
 * Keeps the rows whose condition is true. Rows evaluating to false or null are dropped.
 */
public class Filter extends PPUnaryNode {
    public final Expression condition;

    public Filter(Expression condition, PhysicalPlan child) {
        super(child);
        this.condition = condition;
    }

    @Override
    public PlanKind kind() {return PlanKind.FILTER;}

    @Override
    public StructType schema() {return child.schema();}

    @Override
    protected List<RecordBatch> doExecute() {
        List<RecordBatch> output = new ArrayList<>();
        for (RecordBatch batch : child.execute()) {
            ColumnVector result = condition.evaluate(batch);
            if (result.dataType() != DataType.BooleanType && result.dataType() != DataType.NullType) {
                throw ExecutionException.typeError(String.format("Filter condition '%s' is %s, not boolean",
                        condition.prettyString(), result.dataType().typeName()));
            }
            boolean[] mask = new boolean[batch.numRows()];
            boolean any = false;
            for (int i = 0; i < mask.length; i++) {
                Value v = result.get(i);
                mask[i] = !v.isNull() && v.getBoolean();
                any |= mask[i];
            }
            if (any) {
                output.add(batch.filter(mask));
            }
        }
        return output;
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        assert newChildren.size() == 1;
        return new Filter(condition, newChildren.get(0));
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(condition, child);}
}
