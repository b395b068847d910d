package io.simpledb.query;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;

import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.plan.logical.LogicalPlan;
import io.simpledb.query.plan.physical.PhysicalPlan;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

/**
 * The stages of one statement. Each stage is computed on first access and then kept.
 * <p>
 * An {@code EXPLAIN} statement is never executed, its result is the plan text, one line per row.
 */
public class QueryExecution {
    private static final StructType EXPLAIN_SCHEMA = StructType.of(new StructField("plan", DataType.StringType));

    private final QueryContext queryContext;
    private final LogicalPlan logicalPlan;
    private final boolean explain;

    private LogicalPlan optimizedPlan;
    private PhysicalPlan physicalPlan;
    private List<RecordBatch> result;

    public QueryExecution(QueryContext queryContext, LogicalPlan logicalPlan, boolean explain) {
        this.queryContext = queryContext;
        this.logicalPlan = logicalPlan;
        this.explain = explain;
    }

    public QueryExecution(QueryContext queryContext, LogicalPlan logicalPlan) {
        this(queryContext, logicalPlan, false);
    }

    public boolean isExplain() {
        return explain;
    }

    public LogicalPlan logicalPlan() {
        return logicalPlan;
    }

    public LogicalPlan optimizedPlan() {
        if (optimizedPlan == null) {
            optimizedPlan = queryContext.optimizer().execute(logicalPlan);
        }
        return optimizedPlan;
    }

    public PhysicalPlan physicalPlan() {
        if (physicalPlan == null) {
            physicalPlan = queryContext.planner().createPhysicalPlan(optimizedPlan());
        }
        return physicalPlan;
    }

    public StructType schema() {
        return explain ? EXPLAIN_SCHEMA : logicalPlan.schema();
    }

    public List<RecordBatch> result() {
        if (result == null) {
            if (explain) {
                List<List<Value>> rows = new ArrayList<>();
                for (String line : Splitter.on('\n').omitEmptyStrings().split(explain())) {
                    rows.add(Lists.newArrayList(Value.ofString(line)));
                }
                result = Lists.newArrayList(RecordBatch.fromRows(EXPLAIN_SCHEMA, rows));
            } else {
                result = queryContext.executor().execute(physicalPlan());
            }
        }
        return result;
    }

    /** All rows of the result, in order. */
    public List<List<Value>> collect() {
        List<List<Value>> rows = new ArrayList<>();
        for (RecordBatch batch : result()) {
            rows.addAll(batch.rows());
        }
        return rows;
    }

    public String explain() {
        return "== Logical Plan ==\n" + logicalPlan.treeString()
                + "== Optimized Logical Plan ==\n" + optimizedPlan().treeString()
                + "== Physical Plan ==\n" + physicalPlan().treeString();
    }
}
