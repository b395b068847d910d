package io.simpledb.query.plan.physical;

import com.google.common.collect.Lists;

import java.util.List;

import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.catalog.TableSource;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.StructType;

/**
 * Emits the batches of a table as they are stored.
 */
public class TableScan extends PPLeafNode {
    public final TableSource source;

    public TableScan(TableSource source) {
        this.source = source;
    }

    @Override
    public PlanKind kind() {return PlanKind.SCAN;}

    @Override
    public StructType schema() {return source.schema();}

    @Override
    protected List<RecordBatch> doExecute() {
        return source.batches();
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(source.name(), source.schema().fieldNames());}
}
