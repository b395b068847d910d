package io.simpledb.query;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import io.simpledb.query.catalog.MemoryCatalog;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

import static io.simpledb.query.SampleTables.T1_AGES;
import static io.simpledb.query.SampleTables.T1_SCORES;
import static io.simpledb.query.SampleTables.column;
import static io.simpledb.query.SampleTables.longs;
import static io.simpledb.query.SampleTables.rows;

public class AggregateTest {
    private final QueryContext context = SampleTables.context();

    @Test
    public void globalAggregate() {
        QueryExecution execution = context.executeSql(
                "SELECT count(id), sum(age), sum(score), avg(score), max(score), min(score) FROM t1");
        Assert.assertEquals(
                Arrays.asList("count(id)", "sum(age)", "sum(score)", "avg(score)", "max(score)", "min(score)"),
                execution.schema().fieldNames());
        List<List<Value>> rows = execution.collect();
        Assert.assertEquals(1, rows.size());

        long ageSum = 0;
        double scoreSum = 0, max = Double.NEGATIVE_INFINITY, min = Double.POSITIVE_INFINITY;
        for (int i = 0; i < 16; i++) {
            ageSum += T1_AGES[i];
            scoreSum += T1_SCORES[i];
            max = Math.max(max, T1_SCORES[i]);
            min = Math.min(min, T1_SCORES[i]);
        }
        List<Value> row = rows.get(0);
        Assert.assertEquals(Value.ofLong(16), row.get(0));
        Assert.assertEquals(Value.ofLong(ageSum), row.get(1));
        Assert.assertEquals(Value.ofDouble(scoreSum), row.get(2));
        Assert.assertEquals(Value.ofDouble(scoreSum / 16), row.get(3));
        Assert.assertEquals(Value.ofDouble(max), row.get(4));
        Assert.assertEquals(Value.ofDouble(min), row.get(5));
    }

    @Test
    public void groupsInFirstSeenOrder() {
        List<List<Value>> rows = rows(context,
                "SELECT id % 3, count(id), sum(age), avg(score), max(age), min(score) FROM t1 WHERE id <= 8 GROUP BY id % 3");
        Assert.assertEquals(3, rows.size());
        Assert.assertEquals(longs(1, 2, 0), column(rows, 0));
        Assert.assertEquals(longs(3, 3, 2), column(rows, 1));

        long[] expectedKeys = {1, 2, 0};
        for (int g = 0; g < 3; g++) {
            long ageSum = 0, ageMax = Long.MIN_VALUE, count = 0;
            double scoreSum = 0, scoreMin = Double.POSITIVE_INFINITY;
            for (int id = 1; id <= 8; id++) {
                if (id % 3 != expectedKeys[g]) {
                    continue;
                }
                count++;
                ageSum += T1_AGES[id - 1];
                ageMax = Math.max(ageMax, T1_AGES[id - 1]);
                scoreSum += T1_SCORES[id - 1];
                scoreMin = Math.min(scoreMin, T1_SCORES[id - 1]);
            }
            List<Value> row = rows.get(g);
            Assert.assertEquals(Value.ofLong(ageSum), row.get(2));
            Assert.assertEquals(Value.ofDouble(scoreSum / count), row.get(3));
            Assert.assertEquals(Value.ofLong(ageMax), row.get(4));
            Assert.assertEquals(Value.ofDouble(scoreMin), row.get(5));
        }
    }

    @Test
    public void groupKeyInsideExpression() {
        List<List<Value>> rows = rows(context, "SELECT age / 10 * 10 AS decade, count(*) AS n FROM t1 GROUP BY age / 10 * 10");
        Assert.assertEquals(longs(20, 30, 40, 10), column(rows, 0));
        Assert.assertEquals(longs(8, 5, 2, 1), column(rows, 1));
    }

    @Test
    public void groupByMultipleKeys() {
        List<List<Value>> rows = rows(context,
                "SELECT id % 2, age > 30, count(*) FROM t1 GROUP BY id % 2, age > 30");
        long total = 0;
        for (List<Value> row : rows) {
            total += row.get(2).getLong();
        }
        Assert.assertEquals(16, total);
        Assert.assertEquals(Arrays.asList(Value.ofLong(1), Value.FALSE), rows.get(0).subList(0, 2));
    }

    @Test
    public void nullHandling() {
        // city: paris, NULL, oslo, paris, oslo; amount: 10, 5, NULL, 7, 3
        List<List<Value>> rows = rows(context,
                "SELECT city, count(amount), sum(amount), avg(amount), max(amount) FROM nulls GROUP BY city");
        Assert.assertEquals(Arrays.asList(Value.ofString("paris"), Value.NULL, Value.ofString("oslo")), column(rows, 0));
        // count counts every row, nulls included.
        Assert.assertEquals(longs(2, 1, 2), column(rows, 1));
        Assert.assertEquals(longs(17, 5, 3), column(rows, 2));
        Assert.assertEquals(Arrays.asList(Value.ofDouble(8.5), Value.ofDouble(5.0), Value.ofDouble(3.0)), column(rows, 3));
        Assert.assertEquals(longs(10, 5, 3), column(rows, 4));
    }

    @Test
    public void groupWithOnlyNulls() {
        List<List<Value>> rows = rows(context,
                "SELECT count(amount), sum(amount), avg(amount), max(amount), min(amount) FROM nulls WHERE id = 3");
        Assert.assertEquals(Arrays.asList(Arrays.asList(
                Value.ofLong(1), Value.ofLong(0), Value.NULL, Value.NULL, Value.NULL)), rows);
    }

    @Test
    public void globalAggregateOverNoRows() {
        QueryExecution execution = context.executeSql(
                "SELECT count(*), count(id), sum(age), sum(score), avg(score), max(name), min(age) FROM t1 WHERE id > 100");
        Assert.assertEquals(DataType.DoubleType, execution.schema().get(3).dataType);
        Assert.assertEquals(Arrays.asList(Arrays.asList(
                Value.ofLong(0), Value.ofLong(0), Value.ofLong(0), Value.ofDouble(0), Value.NULL, Value.NULL, Value.NULL)),
                execution.collect());
    }

    @Test
    public void groupedAggregateOverNoRows() {
        Assert.assertTrue(rows(context, "SELECT age, count(*) FROM t1 WHERE id > 100 GROUP BY age").isEmpty());
    }

    @Test
    public void stringExtremes() {
        Assert.assertEquals(Arrays.asList(Arrays.asList(Value.ofString("sybil"), Value.ofString("alice"))),
                rows(context, "SELECT max(name), min(name) FROM t1"));
    }

    @Test
    public void sumOfStringsIsTypeError() {
        try {
            rows(context, "SELECT sum(name) FROM t1");
            Assert.fail();
        } catch (ExecutionException e) {
            Assert.assertEquals(ErrorCode.EVALUATION_TYPE_ERROR, e.errorCode());
        }
    }

    @Test
    public void aggregatesAcrossBatches() {
        QueryContext small = new QueryContext(SampleTables.catalog(3));
        Assert.assertEquals(rows(context, "SELECT id % 4, sum(age), count(*) FROM t1 GROUP BY id % 4"),
                rows(small, "SELECT id % 4, sum(age), count(*) FROM t1 GROUP BY id % 4"));
    }

    @Test
    public void signedZeroAndNaNGroupTogether() {
        MemoryCatalog catalog = new MemoryCatalog();
        catalog.registerTable("d", StructType.of(new StructField("d", "v", DataType.DoubleType)), Arrays.asList(
                Arrays.asList(Value.ofDouble(0.0)),
                Arrays.asList(Value.ofDouble(-0.0)),
                Arrays.asList(Value.ofDouble(Double.NaN)),
                Arrays.asList(Value.ofDouble(0.0 / 0.0))));
        List<List<Value>> rows = rows(new QueryContext(catalog), "SELECT v, count(*) FROM d GROUP BY v");
        Assert.assertEquals(Arrays.asList(
                Arrays.asList(Value.ofDouble(0.0), Value.ofLong(2)),
                Arrays.asList(Value.ofDouble(Double.NaN), Value.ofLong(2))), rows);
    }
}
