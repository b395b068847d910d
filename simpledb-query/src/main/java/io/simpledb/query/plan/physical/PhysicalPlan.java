package io.simpledb.query.plan.physical;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.plan.QueryPlan;

/**
 * An executable operator. Expressions held by physical nodes are bound to the child's output, so
 * they address columns by position only.
 */
public abstract class PhysicalPlan extends QueryPlan<PhysicalPlan> {
    private static final Logger log = LoggerFactory.getLogger(PhysicalPlan.class);

    PhysicalPlan() {}

    /** Runs this operator and its children, returning the output batches in order. */
    public final List<RecordBatch> execute() {
        List<RecordBatch> result = doExecute();
        if (log.isTraceEnabled()) {
            long rows = 0;
            for (RecordBatch batch : result) {
                rows += batch.numRows();
            }
            log.trace("{} produced {} batches, {} rows", nodeName(), result.size(), rows);
        }
        return result;
    }

    protected abstract List<RecordBatch> doExecute();

    @Override
    public String nodeName() {
        return "physical." + getClass().getSimpleName();
    }
}
