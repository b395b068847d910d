package io.simpledb.query;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.plan.logical.LogicalPlan;
import io.simpledb.query.plan.logical.Project;
import io.simpledb.query.plan.logical.Scan;
import io.simpledb.query.types.Value;

public class OptimizerTest {
    private final QueryContext context = SampleTables.context();
    private final Optimizer optimizer = new Optimizer();

    /** The projection placed right above the scan, or null if the scan is read whole. */
    private static Project pruningProjection(LogicalPlan plan) {
        LogicalPlan scanParent = plan.find(p -> !p.children().isEmpty() && p.children().get(0) instanceof Scan);
        if (scanParent instanceof Project && ((Project) scanParent).isColumnPruning()) {
            return (Project) scanParent;
        }
        return null;
    }

    @Test
    public void prunesUnusedColumns() {
        LogicalPlan optimized = context.executeSql("SELECT age + 100 FROM t1 WHERE id < 9").optimizedPlan();
        Project pruning = pruningProjection(optimized);
        Assert.assertNotNull(optimized.treeString(), pruning);
        // Scan order, not reference order.
        Assert.assertEquals(Arrays.asList("t1.id", "age"), pruning.schema().fieldNames());
    }

    @Test
    public void aggregateReadsOnlyItsArguments() {
        LogicalPlan optimized = context.executeSql("SELECT name, max(score) FROM t1 GROUP BY name").optimizedPlan();
        Assert.assertEquals(Arrays.asList("name", "score"), pruningProjection(optimized).schema().fieldNames());
    }

    @Test
    public void countStarKeepsOneColumn() {
        QueryExecution execution = context.executeSql("SELECT count(*) FROM t1");
        Assert.assertEquals(Arrays.asList("t1.id"), pruningProjection(execution.optimizedPlan()).schema().fieldNames());
        Assert.assertEquals(Arrays.asList(Arrays.asList(Value.ofLong(16))), execution.collect());
    }

    @Test
    public void allColumnsNeeded() {
        LogicalPlan plan = context.executeSql("SELECT * FROM t1 WHERE age > 30").logicalPlan();
        LogicalPlan optimized = optimizer.execute(plan);
        Assert.assertNull(pruningProjection(optimized));
        Assert.assertEquals(plan.treeString(), optimized.treeString());
    }

    @Test
    public void bareProjectionOverScanIsKept() {
        LogicalPlan plan = context.executeSql("SELECT name, id FROM t1").logicalPlan();
        Assert.assertSame(plan, optimizer.execute(plan));
    }

    @Test
    public void limitPassesThrough() {
        LogicalPlan optimized = context.executeSql("SELECT id FROM t1 WHERE score > 80 LIMIT 2").optimizedPlan();
        Assert.assertEquals(PlanKind.LIMIT, optimized.kind());
        Assert.assertEquals(Arrays.asList("t1.id", "score"), pruningProjection(optimized).schema().fieldNames());
    }

    @Test
    public void idempotent() {
        String[] queries = {
                "SELECT age + 100 FROM t1 WHERE id < 9",
                "SELECT id % 3, count(id), avg(score) FROM t1 GROUP BY id % 3",
                "SELECT count(*) FROM t1",
                "SELECT * FROM t1 LIMIT 3",
                "SELECT name FROM t1 WHERE age > 20 AND score < 90 LIMIT 5 OFFSET 1",
        };
        for (String sql : queries) {
            LogicalPlan once = optimizer.execute(context.executeSql(sql).logicalPlan());
            LogicalPlan twice = optimizer.execute(once);
            Assert.assertEquals(sql, once.treeString(), twice.treeString());
        }
    }

    @Test
    public void sameResultsAsUnoptimized() {
        String[] queries = {
                "SELECT id, name, age + 100 FROM t1 WHERE id < 9 LIMIT 3 OFFSET 2",
                "SELECT id % 3, count(id), sum(age), max(score) FROM t1 GROUP BY id % 3",
                "SELECT count(*) FROM t1 WHERE score > 75",
                "SELECT city, sum(amount) FROM nulls GROUP BY city",
        };
        PhysicalPlanner planner = new PhysicalPlanner();
        Executor executor = new Executor();
        for (String sql : queries) {
            QueryExecution execution = context.executeSql(sql);
            List<List<Value>> optimized = execution.collect();
            List<List<Value>> unoptimized = new java.util.ArrayList<>();
            executor.execute(planner.createPhysicalPlan(execution.logicalPlan()))
                    .forEach(b -> unoptimized.addAll(b.rows()));
            Assert.assertEquals(sql, unoptimized, optimized);
        }
    }
}
