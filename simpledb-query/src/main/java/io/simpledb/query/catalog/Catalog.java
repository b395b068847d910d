package io.simpledb.query.catalog;

import java.util.List;

import io.simpledb.query.AnalysisException;

/**
 * Read-only lookup of tables by name, used while planning.
 */
public interface Catalog {
    default boolean tableExists(String name) {
        return tableNames().stream().anyMatch(name::equalsIgnoreCase);
    }

    /**
     * @throws AnalysisException with {@code TABLE_NOT_FOUND} if there is no such table.
     */
    TableSource lookupTable(String name);

    List<String> tableNames();
}
