package io.simpledb.query.expr.agg;

import io.simpledb.query.types.Value;

/**
 * Running state of one aggregate function for one group.
 */
public interface Accumulator {
    /** Feeds the argument value of one member row. */
    void update(Value value);

    /** The final value, called once all members have been seen. */
    Value evaluate();
}
