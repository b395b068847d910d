package io.simpledb.query.catalog;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.types.StructType;

/**
 * A registered table: its schema and the in-memory batches holding its rows.
 */
public class TableSource {
    private final String name;
    private final StructType schema;
    private final List<RecordBatch> batches;

    public TableSource(String name, StructType schema, List<RecordBatch> batches) {
        for (RecordBatch batch : batches) {
            Preconditions.checkArgument(batch.schema().equals(schema),
                    "batch schema %s does not match table schema %s", batch.schema(), schema);
        }
        this.name = name;
        this.schema = schema;
        this.batches = ImmutableList.copyOf(batches);
    }

    public String name() {
        return name;
    }

    public StructType schema() {
        return schema;
    }

    public List<RecordBatch> batches() {
        return batches;
    }

    public long numRows() {
        long rows = 0;
        for (RecordBatch batch : batches) {
            rows += batch.numRows();
        }
        return rows;
    }

    @Override
    public String toString() {
        return name + schema;
    }
}
