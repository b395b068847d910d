package io.simpledb.query.batch;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

public class RecordBatchTest {
    private static final StructType schema = StructType.of(
            new StructField("t", "id", DataType.LongType),
            new StructField("name", DataType.StringType));

    private static RecordBatch batch() {
        return RecordBatch.fromRows(schema, Arrays.asList(
                Arrays.asList(Value.ofLong(1), Value.ofString("a")),
                Arrays.asList(Value.ofLong(2), Value.NULL),
                Arrays.asList(Value.ofLong(3), Value.ofString("c"))));
    }

    @Test
    public void fromRows() {
        RecordBatch batch = batch();
        Assert.assertEquals(3, batch.numRows());
        Assert.assertEquals(2, batch.numColumns());
        Assert.assertEquals(DataType.StringType, batch.column(1).dataType());
        Assert.assertEquals(Arrays.asList(Value.ofLong(2), Value.NULL), batch.row(1));
    }

    @Test
    public void filterAndSlice() {
        RecordBatch batch = batch();
        RecordBatch filtered = batch.filter(new boolean[]{true, false, true});
        Assert.assertEquals(2, filtered.numRows());
        Assert.assertEquals(Arrays.asList(Value.ofLong(3), Value.ofString("c")), filtered.row(1));
        Assert.assertSame(batch, batch.filter(new boolean[]{true, true, true}));

        RecordBatch sliced = batch.slice(1, 3);
        Assert.assertEquals(2, sliced.numRows());
        Assert.assertEquals(Value.ofLong(2), sliced.column(0).get(0));
        Assert.assertEquals(0, batch.slice(3, 3).numRows());
        // The source batch is untouched.
        Assert.assertEquals(3, batch.numRows());
    }

    @Test
    public void empty() {
        RecordBatch empty = RecordBatch.empty(schema);
        Assert.assertEquals(0, empty.numRows());
        Assert.assertEquals(2, empty.numColumns());
        Assert.assertTrue(empty.rows().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void columnLengthMismatch() {
        List<ColumnVector> columns = ImmutableList.of(
                ColumnVector.of(DataType.LongType, Arrays.asList(Value.ofLong(1), Value.ofLong(2))),
                ColumnVector.of(DataType.StringType, Arrays.asList(Value.ofString("a"))));
        new RecordBatch(schema, columns);
    }

    @Test(expected = IllegalArgumentException.class)
    public void valueTypeMismatch() {
        ColumnVector.of(DataType.LongType, Arrays.asList(Value.ofLong(1), Value.ofString("x")));
    }
}
