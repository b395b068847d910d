package io.simpledb.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.plan.physical.PhysicalPlan;

/**
 * Runs physical plans to completion. The first error aborts the whole plan.
 */
public class Executor {
    private static final Logger logger = LoggerFactory.getLogger(Executor.class);

    public List<RecordBatch> execute(PhysicalPlan plan) {
        long start = System.currentTimeMillis();
        List<RecordBatch> result = plan.execute();
        logger.debug("Executed {} in {} ms", plan.nodeName(), System.currentTimeMillis() - start);
        return result;
    }
}
