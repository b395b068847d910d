package io.simpledb.query.plan.logical;

import com.google.common.collect.Lists;

import java.util.List;

import io.simpledb.query.catalog.TableSource;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.StructType;

/**
 * Reads every column of a catalog table.
 */
public class Scan extends LPLeafNode {
    public final TableSource source;

    public Scan(TableSource source) {
        this.source = source;
    }

    public String tableName() {return source.name();}

    @Override
    public PlanKind kind() {return PlanKind.SCAN;}

    @Override
    public StructType schema() {return source.schema();}

    @Override
    public List<Object> args() {return Lists.newArrayList(source.name(), source.schema().fieldNames());}
}
