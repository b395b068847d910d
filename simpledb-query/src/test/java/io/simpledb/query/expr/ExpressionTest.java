package io.simpledb.query.expr;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.expr.agg.Count;
import io.simpledb.query.expr.agg.Sum;
import io.simpledb.query.expr.attr.Alias;
import io.simpledb.query.expr.attr.AttributeReference;
import io.simpledb.query.expr.attr.BoundReference;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

public class ExpressionTest {
    private static final AttributeReference a = new AttributeReference("t", "a", DataType.LongType);
    private static final AttributeReference b = new AttributeReference(null, "b", DataType.DoubleType);

    @Test
    public void prettyStrings() {
        Expression e = new BinaryExpression(BinaryOperator.AND,
                new BinaryExpression(BinaryOperator.GT_EQ, a, Literal.of(1L)),
                new BinaryExpression(BinaryOperator.fromSymbol("<>"), b, Literal.of(2.5)));
        Assert.assertEquals("a >= 1 and b != 2.5", e.prettyString());
        Assert.assertEquals("sum(a)", new Sum(a).prettyString());
        Assert.assertEquals("count(*)", Count.star().prettyString());
        Assert.assertEquals("total", new Alias(new Sum(a), "total").prettyString());
    }

    @Test
    public void semanticEquality() {
        Expression e1 = new BinaryExpression(BinaryOperator.MODULO, a, Literal.of(3L));
        Expression e2 = new BinaryExpression(BinaryOperator.MODULO,
                new AttributeReference("t", "a", DataType.LongType), Literal.of(3L));
        Assert.assertTrue(e1.semanticEquals(e2));
        Assert.assertFalse(e1.semanticEquals(new BinaryExpression(BinaryOperator.MODULO, a, Literal.of(4L))));
        Assert.assertFalse(new Sum(a).semanticEquals(new Count(a)));
        Assert.assertTrue(Count.star().semanticEquals(Count.star()));
        Assert.assertFalse(Count.star().semanticEquals(new Count(Literal.of(1L))));
    }

    @Test
    public void references() {
        Expression e = new BinaryExpression(BinaryOperator.PLUS, a,
                new BinaryExpression(BinaryOperator.MULTIPLY, b, a));
        Assert.assertEquals(2, e.references().size());
        Assert.assertTrue(e.references().get(0).sameRef(a));
        Assert.assertTrue(e.references().get(1).sameRef(b));
    }

    @Test
    public void columnarEvaluation() {
        StructType schema = StructType.of(a.toField(), new StructField("b", DataType.DoubleType));
        RecordBatch batch = RecordBatch.fromRows(schema, Arrays.asList(
                Arrays.asList(Value.ofLong(4), Value.ofDouble(0.5)),
                Arrays.asList(Value.NULL, Value.ofDouble(1.5)),
                Arrays.asList(Value.ofLong(-2), Value.NULL)));
        Expression sum = BoundReference.bindReference(new BinaryExpression(BinaryOperator.PLUS, a, b), schema);
        ColumnVector result = sum.evaluate(batch);
        Assert.assertEquals(DataType.DoubleType, result.dataType());
        Assert.assertEquals(Arrays.asList(Value.ofDouble(4.5), Value.NULL, Value.NULL), result.values());

        Expression less = BoundReference.bindReference(new BinaryExpression(BinaryOperator.LT, a, Literal.of(0L)), schema);
        Assert.assertEquals(Arrays.asList(Value.FALSE, Value.NULL, Value.TRUE), less.evaluate(batch).values());
    }

    @Test
    public void threeValuedLogic() {
        Value[] values = {Value.TRUE, Value.FALSE, Value.NULL};
        // Rows and columns follow the order of values.
        Value[][] and = {
                {Value.TRUE, Value.FALSE, Value.NULL},
                {Value.FALSE, Value.FALSE, Value.FALSE},
                {Value.NULL, Value.FALSE, Value.NULL}};
        Value[][] or = {
                {Value.TRUE, Value.TRUE, Value.TRUE},
                {Value.TRUE, Value.FALSE, Value.NULL},
                {Value.TRUE, Value.NULL, Value.NULL}};
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                Assert.assertEquals(and[i][j], BinaryOperator.AND.apply(values[i], values[j]));
                Assert.assertEquals(or[i][j], BinaryOperator.OR.apply(values[i], values[j]));
            }
        }
    }
}
