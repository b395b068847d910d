package io.simpledb.query.sql;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

import io.simpledb.query.Analyzer;
import io.simpledb.query.ErrorCode;
import io.simpledb.query.QueryException;
import io.simpledb.query.SampleTables;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.plan.logical.Aggregate;
import io.simpledb.query.plan.logical.Filter;
import io.simpledb.query.plan.logical.Limit;
import io.simpledb.query.plan.logical.LogicalPlan;
import io.simpledb.query.plan.logical.Project;

public class SqlPlannerTest {
    private final SqlPlanner planner = new SqlPlanner(SampleTables.catalog(), new Analyzer());

    private LogicalPlan plan(String sql) {
        return planner.plan(sql).plan;
    }

    private static void assertParseError(SqlPlanner planner, String sql) {
        try {
            planner.plan(sql);
            Assert.fail("expected parse error for: " + sql);
        } catch (QueryException e) {
            Assert.assertTrue(e instanceof SqlParseException);
            Assert.assertEquals(ErrorCode.PARSE_ERROR, e.errorCode());
        }
    }

    @Test
    public void operatorOrder() {
        LogicalPlan plan = plan("SELECT id FROM t1 WHERE age > 20 LIMIT 3 OFFSET 1");
        Assert.assertEquals(PlanKind.LIMIT, plan.kind());
        Limit limit = (Limit) plan;
        Assert.assertEquals(Long.valueOf(3), limit.limit);
        Assert.assertEquals(1, limit.offset);
        Assert.assertEquals(PlanKind.PROJECT, limit.child.kind());
        Assert.assertEquals(PlanKind.FILTER, ((Project) limit.child).child.kind());
        Assert.assertEquals(PlanKind.SCAN, ((Filter) ((Project) limit.child).child).child.kind());
    }

    @Test
    public void offsetWithoutLimit() {
        Limit limit = (Limit) plan("select * from t1 offset 4;");
        Assert.assertNull(limit.limit);
        Assert.assertEquals(4, limit.offset);
    }

    @Test
    public void displayNames() {
        LogicalPlan plan = plan("SELECT id, name, age + 100, score * 2 / 4, age >= 30 AND id <> 3, 'x', 1.5, NULL FROM t1");
        Assert.assertEquals(
                Arrays.asList("t1.id", "name", "age + 100", "score * 2 / 4", "age >= 30 and id != 3", "x", "1.5", "NULL"),
                plan.schema().fieldNames());
    }

    @Test
    public void aliasNamesColumn() {
        LogicalPlan plan = plan("SELECT id AS key, age + 1 next_age FROM t1");
        Assert.assertEquals(Arrays.asList("key", "next_age"), plan.schema().fieldNames());
        Assert.assertNull(plan.schema().get(0).qualifier);
    }

    @Test
    public void starExpands() {
        LogicalPlan plan = plan("SELECT * FROM T1");
        Assert.assertEquals(Arrays.asList("t1.id", "name", "age", "score"), plan.schema().fieldNames());
    }

    @Test
    public void keywordsAndIdentifiersIgnoreCase() {
        LogicalPlan plan = plan("sElEcT ID, T1.Name FrOm t1 wHeRe AGE < 30");
        Assert.assertEquals(Arrays.asList("t1.id", "name"), plan.schema().fieldNames());
    }

    @Test
    public void aggregatePlan() {
        LogicalPlan plan = plan("SELECT id % 3, count(id), sum(age) + 1, count(*) FROM t1 GROUP BY id % 3");
        Assert.assertEquals(Arrays.asList("id % 3", "count(id)", "sum(age) + 1", "count(*)"), plan.schema().fieldNames());
        Aggregate aggregate = (Aggregate) ((Project) plan).child;
        Assert.assertEquals(1, aggregate.groupingExpressions.size());
        Assert.assertEquals(3, aggregate.aggregateExpressions.size());
        Assert.assertEquals(Arrays.asList("id % 3", "count(id)", "sum(age)", "count(*)"), aggregate.schema().fieldNames());
    }

    @Test
    public void duplicateAggregatesAreComputedOnce() {
        LogicalPlan plan = plan("SELECT max(score), max(score) * 2 FROM t1");
        Aggregate aggregate = (Aggregate) ((Project) plan).child;
        Assert.assertEquals(1, aggregate.aggregateExpressions.size());
        Assert.assertTrue(aggregate.groupingExpressions.isEmpty());
    }

    @Test
    public void explainFlag() {
        Assert.assertTrue(planner.plan("EXPLAIN SELECT id FROM t1").explain);
        Assert.assertFalse(planner.plan("SELECT id FROM t1").explain);
    }

    @Test
    public void literals() {
        LogicalPlan plan = plan("SELECT -5, 'it''s', true, 99999999999999999999 FROM t1");
        Assert.assertEquals(Arrays.asList("-5", "it's", "true", "1.0E20"), plan.schema().fieldNames());
    }

    @Test
    public void parseErrors() {
        assertParseError(planner, "SELECT FROM t1");
        assertParseError(planner, "SELECT id FROM");
        assertParseError(planner, "SELECT id FROM t1 WHERE");
        assertParseError(planner, "SELECT id FROM t1 LIMIT x");
        assertParseError(planner, "DELETE FROM t1");
        assertParseError(planner, "SELECT id FROM t1 garbage");
        assertParseError(planner, "SELECT median(id) FROM t1");
        assertParseError(planner, "SELECT sum(*) FROM t1");
    }

    @Test
    public void parseErrorPosition() {
        try {
            planner.plan("SELECT id\nFROM t1 WHERE id = = 1");
            Assert.fail();
        } catch (SqlParseException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("2:"));
        }
    }
}
