package io.simpledb.query.expr;

import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.types.DataType;

public interface Evaluable {

    DataType dataType();

    /**
     * Computes one output value per input row. The result has {@code input.numRows()} values.
     */
    ColumnVector evaluate(RecordBatch input);
}
