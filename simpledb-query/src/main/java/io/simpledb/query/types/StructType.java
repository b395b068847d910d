package io.simpledb.query.types;

import com.google.common.collect.ImmutableList;

import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.List;

import io.simpledb.query.AnalysisException;

import static io.simpledb.util.Trick.indexWhere;
import static io.simpledb.util.Trick.mapToList;

/**
 * An ordered list of fields. The position of a field is the column index used by every operator
 * reading batches of this schema. No two fields share the same qualifier and name.
 */
public class StructType {
    private final List<StructField> fields;

    public StructType(List<StructField> fields) {
        this.fields = ImmutableList.copyOf(fields);
        for (int i = 0; i < this.fields.size(); i++) {
            StructField f = this.fields.get(i);
            for (int j = 0; j < i; j++) {
                if (this.fields.get(j).sameColumn(f)) {
                    throw AnalysisException.ambiguousColumn(f.qualifiedName(), fieldNames());
                }
            }
        }
    }

    public static StructType of(StructField... fields) {
        return new StructType(ImmutableList.copyOf(fields));
    }

    public int size() {
        return fields.size();
    }

    public StructField get(int ordinal) {
        return fields.get(ordinal);
    }

    public List<StructField> fields() {
        return fields;
    }

    /** Returns all field display names. */
    public List<String> fieldNames() {
        return mapToList(fields, StructField::qualifiedName);
    }

    public int indexOf(StructField field) {
        return indexWhere(fields, f -> f.sameColumn(field));
    }

    public StructType select(List<Integer> ordinals) {
        List<StructField> selected = new ArrayList<>(ordinals.size());
        for (int o : ordinals) {
            selected.add(fields.get(o));
        }
        return new StructType(selected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((StructType) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "[" + StringUtils.join(fields, ", ") + "]";
    }
}
