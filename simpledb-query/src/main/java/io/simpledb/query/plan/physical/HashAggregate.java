package io.simpledb.query.plan.physical;

import com.google.common.collect.Lists;

import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.simpledb.query.batch.ColumnVector;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.expr.Expression;
import io.simpledb.query.expr.agg.Accumulator;
import io.simpledb.query.expr.agg.AggregateFunction;
import io.simpledb.query.plan.PlanKind;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

/**
 * Groups every input row by the grouping values and folds each group through one accumulator per
 * aggregate function. Groups are emitted in the order their first row was seen, as a single batch.
 * <p>
 * Without grouping expressions there is exactly one group, which exists even if the input is empty.
 */
public class HashAggregate extends PPUnaryNode {
    public final List<Expression> groupingExpressions;
    public final List<AggregateFunction> aggregateExpressions;
    private final StructType schema;

    public HashAggregate(List<Expression> groupingExpressions,
                         List<AggregateFunction> aggregateExpressions,
                         StructType schema,
                         PhysicalPlan child) {
        super(child);
        this.groupingExpressions = groupingExpressions;
        this.aggregateExpressions = aggregateExpressions;
        this.schema = schema;
    }

    @Override
    public PlanKind kind() {return PlanKind.AGGREGATE;}

    @Override
    public StructType schema() {return schema;}

    private Accumulator[] newAccumulators() {
        Accumulator[] accumulators = new Accumulator[aggregateExpressions.size()];
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i] = aggregateExpressions.get(i).newAccumulator();
        }
        return accumulators;
    }

    @Override
    protected List<RecordBatch> doExecute() {
        Map<List<Value>, Accumulator[]> groups = new LinkedHashMap<>();
        if (groupingExpressions.isEmpty()) {
            groups.put(new ArrayList<>(), newAccumulators());
        }
        for (RecordBatch batch : child.execute()) {
            List<ColumnVector> keyColumns = new ArrayList<>(groupingExpressions.size());
            for (Expression e : groupingExpressions) {
                keyColumns.add(e.evaluate(batch));
            }
            List<ColumnVector> argColumns = new ArrayList<>(aggregateExpressions.size());
            for (AggregateFunction f : aggregateExpressions) {
                argColumns.add(f.child.evaluate(batch));
            }
            for (int row = 0; row < batch.numRows(); row++) {
                List<Value> key = new ArrayList<>(keyColumns.size());
                for (ColumnVector c : keyColumns) {
                    key.add(c.get(row));
                }
                Accumulator[] accumulators = groups.computeIfAbsent(key, k -> newAccumulators());
                for (int i = 0; i < accumulators.length; i++) {
                    accumulators[i].update(argColumns.get(i).get(row));
                }
            }
        }

        List<ColumnVector.Builder> builders = new ArrayList<>(schema.size());
        for (StructField f : schema.fields()) {
            builders.add(new ColumnVector.Builder(f.dataType, groups.size()));
        }
        int keySize = groupingExpressions.size();
        for (Map.Entry<List<Value>, Accumulator[]> group : groups.entrySet()) {
            List<Value> key = group.getKey();
            for (int i = 0; i < keySize; i++) {
                builders.get(i).add(key.get(i));
            }
            Accumulator[] accumulators = group.getValue();
            for (int i = 0; i < accumulators.length; i++) {
                builders.get(keySize + i).add(accumulators[i].evaluate());
            }
        }
        List<ColumnVector> columns = new ArrayList<>(builders.size());
        for (ColumnVector.Builder b : builders) {
            columns.add(b.build());
        }
        return Lists.newArrayList(new RecordBatch(schema, columns, groups.size()));
    }

    @Override
    public PhysicalPlan withNewChildren(List<PhysicalPlan> newChildren) {
        assert newChildren.size() == 1;
        return new HashAggregate(groupingExpressions, aggregateExpressions, schema, newChildren.get(0));
    }

    @Override
    public List<Object> args() {return Lists.newArrayList(groupingExpressions, aggregateExpressions, child);}

    @Override
    public String simpleString() {
        String keyString = "[" + StringUtils.join(groupingExpressions, ", ") + "]";
        String functionString = "[" + StringUtils.join(aggregateExpressions, ", ") + "]";
        return String.format("%s(key=%s, functions=%s, output=%s)", nodeName(), keyString, functionString, schema);
    }
}
