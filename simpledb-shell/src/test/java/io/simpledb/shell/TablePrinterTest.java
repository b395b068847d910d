package io.simpledb.shell;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

public class TablePrinterTest {
    private static final StructType schema = StructType.of(
            new StructField("t1", "id", DataType.LongType),
            new StructField("name", DataType.StringType),
            new StructField("score", DataType.DoubleType));

    @Test
    public void bordered() {
        RecordBatch b1 = RecordBatch.fromRows(schema, Arrays.asList(
                Arrays.asList(Value.ofLong(1), Value.ofString("alice"), Value.ofDouble(85.5))));
        RecordBatch b2 = RecordBatch.fromRows(schema, Arrays.asList(
                Arrays.asList(Value.ofLong(10), Value.NULL, Value.ofDouble(0.1 + 0.2))));
        String expected = ""
                + "+-------+-------+---------------------+\n"
                + "| t1.id | name  | score               |\n"
                + "+-------+-------+---------------------+\n"
                + "| 1     | alice | 85.5                |\n"
                + "| 10    | NULL  | 0.30000000000000004 |\n"
                + "+-------+-------+---------------------+\n"
                + "(2 row(s))\n";
        Assert.assertEquals(expected, TablePrinter.format(schema, Arrays.asList(b1, b2)));
    }

    @Test
    public void noRows() {
        String expected = ""
                + "+-------+------+-------+\n"
                + "| t1.id | name | score |\n"
                + "+-------+------+-------+\n"
                + "(0 row(s))\n";
        Assert.assertEquals(expected, TablePrinter.format(schema, Collections.emptyList()));
    }
}
