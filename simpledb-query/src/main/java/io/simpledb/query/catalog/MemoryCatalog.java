package io.simpledb.query.catalog;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

import io.simpledb.query.AnalysisException;
import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

/**
 * Keeps tables in memory, keyed by their lower cased name.
 */
public class MemoryCatalog implements Catalog {
    private static final Logger logger = LoggerFactory.getLogger(MemoryCatalog.class);

    private final ConcurrentHashMap<String, TableSource> tables = new ConcurrentHashMap<>();

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public void registerTable(TableSource table) {
        Preconditions.checkNotNull(table.name());
        TableSource old = tables.put(key(table.name()), table);
        if (old != null) {
            logger.info("Replaced table {}", table.name());
        }
        logger.debug("Registered table {} with {} rows", table, table.numRows());
    }

    /** Registers {@code rows} as a single batch. */
    public TableSource registerTable(String name, StructType schema, List<? extends List<Value>> rows) {
        TableSource table = new TableSource(name, schema, Collections.singletonList(RecordBatch.fromRows(schema, rows)));
        registerTable(table);
        return table;
    }

    public boolean removeTable(String name) {
        return tables.remove(key(name)) != null;
    }

    @Override
    public boolean tableExists(String name) {
        return tables.containsKey(key(name));
    }

    @Override
    public TableSource lookupTable(String name) {
        TableSource table = tables.get(key(name));
        if (table == null) {
            throw AnalysisException.tableNotFound(name);
        }
        return table;
    }

    @Override
    public List<String> tableNames() {
        List<String> names = new ArrayList<>();
        for (TableSource t : tables.values()) {
            names.add(t.name());
        }
        Collections.sort(names);
        return names;
    }
}
