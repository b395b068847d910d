package io.simpledb.query.plan.logical;

import com.google.common.collect.Lists;

import java.util.List;

import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.attr.AttributeReference;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.StructType;

import static io.simpledb.util.Trick.forAll;
import static io.simpledb.util.Trick.mapToList;

public class Project extends LPUnaryNode {
    public final List<Expression> projectList;
    private final StructType schema;

    public Project(List<Expression> projectList, LogicalPlan child) {
        super(child);
        this.projectList = projectList;
        this.schema = new StructType(mapToList(projectList, LogicalPlan::outputField));
    }

    @Override
    public PlanKind kind() {return PlanKind.PROJECT;}

    @Override
    public StructType schema() {return schema;}

    /** Whether this projection only picks columns, without computing anything. */
    public boolean isColumnPruning() {
        return forAll(projectList, e -> e instanceof AttributeReference);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        assert newChildren.size() == 1;
        return new Project(projectList, newChildren.get(0));
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(projectList, child);}
}
