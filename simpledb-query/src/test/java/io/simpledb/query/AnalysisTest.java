package io.simpledb.query;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

import io.simpledb.query.catalog.MemoryCatalog;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

public class AnalysisTest {
    private final QueryContext context = SampleTables.context();

    private static ErrorCode errorOf(QueryContext context, String sql) {
        try {
            context.executeSql(sql).collect();
        } catch (QueryException e) {
            return e.errorCode();
        }
        Assert.fail("expected failure of: " + sql);
        return null;
    }

    @Test
    public void tableNotFound() {
        Assert.assertEquals(ErrorCode.TABLE_NOT_FOUND, errorOf(context, "SELECT id FROM t2"));
        try {
            context.executeSql("SELECT id FROM missing");
            Assert.fail();
        } catch (AnalysisException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("missing"));
        }
    }

    @Test
    public void columnNotFound() {
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, errorOf(context, "SELECT nope FROM t1"));
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, errorOf(context, "SELECT id FROM t1 WHERE nope > 1"));
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, errorOf(context, "SELECT sum(nope) FROM t1"));
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, errorOf(context, "SELECT id FROM t1 GROUP BY nope"));
        // A qualifier naming another table.
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, errorOf(context, "SELECT t2.id FROM t1"));
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, errorOf(context, "SELECT nulls.name FROM t1"));
    }

    @Test
    public void columnNotGrouped() {
        // After aggregation only group keys and aggregates are visible.
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, errorOf(context, "SELECT name, count(id) FROM t1 GROUP BY age"));
        Assert.assertEquals(ErrorCode.COLUMN_NOT_FOUND, errorOf(context, "SELECT age, count(id) FROM t1"));
    }

    @Test
    public void qualifiedReferences() {
        Assert.assertEquals(16, context.executeSql("SELECT t1.id, t1.name FROM t1").collect().size());
        Assert.assertEquals(Arrays.asList("t1.id", "name"),
                context.executeSql("SELECT T1.ID, t1.NAME FROM t1").schema().fieldNames());
    }

    @Test
    public void ambiguousColumn() {
        MemoryCatalog catalog = new MemoryCatalog();
        StructType schema = StructType.of(
                new StructField("t", "a", DataType.LongType),
                new StructField("a", DataType.LongType),
                new StructField("b", DataType.LongType));
        catalog.registerTable("t", schema, Arrays.asList(
                Arrays.asList(Value.ofLong(1), Value.ofLong(2), Value.ofLong(3))));
        QueryContext context = new QueryContext(catalog);

        Assert.assertEquals(ErrorCode.AMBIGUOUS_COLUMN, errorOf(context, "SELECT a FROM t"));
        // The qualified field wins over the one that only matches through the scanned table.
        Assert.assertEquals(Arrays.asList(Arrays.asList(Value.ofLong(1))),
                context.executeSql("SELECT t.a FROM t").collect());
        Assert.assertEquals(ErrorCode.AMBIGUOUS_COLUMN, errorOf(context, "SELECT b, b FROM t"));
    }

    @Test
    public void duplicateSchemaFields() {
        try {
            StructType.of(new StructField("x", DataType.LongType), new StructField("x", DataType.StringType));
            Assert.fail();
        } catch (AnalysisException e) {
            Assert.assertEquals(ErrorCode.AMBIGUOUS_COLUMN, e.errorCode());
        }
    }

    @Test
    public void starInsideExpression() {
        Assert.assertEquals(ErrorCode.PARSE_ERROR, errorOf(context, "SELECT * + 1 FROM t1"));
    }
}
