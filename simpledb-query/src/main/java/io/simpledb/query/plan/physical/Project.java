package io.simpledb.query.plan.physical;

import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;

import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.StructType;

/**
 * Computes one output column per expression. The output schema is decided by the logical plan.
 */
public class Project extends PPUnaryNode {
    public final List<Expression> projectList;
    private final StructType schema;

    public Project(List<Expression> projectList, StructType schema, PhysicalPlan child) {
        super(child);
        this.projectList = projectList;
        this.schema = schema;
    }

    @Override
    public PlanKind kind() {return PlanKind.PROJECT;}

    @Override
    public StructType schema() {return schema;}

    @Override
    protected List<RecordBatch> doExecute() {
        List<RecordBatch> output = new ArrayList<>();
        for (RecordBatch batch : child.execute()) {
            List<ColumnVector> columns = new ArrayList<>(projectList.size());
            for (Expression e : projectList) {
                columns.add(e.evaluate(batch));
            }
            output.add(new RecordBatch(schema, columns, batch.numRows()));
        }
        return output;
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        assert newChildren.size() == 1;
        return new Project(projectList, schema, newChildren.get(0));
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(projectList, child);}
}
