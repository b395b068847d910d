package io.simpledb.query;

import io.simpledb.query.catalog.Catalog;
import io.simpledb.query.sql.SqlPlanner;

/**
 * Entry point of the engine. Statements are independent of each other, the only shared state is the
 * catalog, which is read-only while planning.
 */
public class QueryContext {
    private final Catalog catalog;
    private final Analyzer analyzer;
    private final Optimizer optimizer;
    private final PhysicalPlanner planner;
    private final Executor executor;

    public QueryContext(Catalog catalog) {
        this.catalog = catalog;
        this.analyzer = new Analyzer();
        this.optimizer = new Optimizer();
        this.planner = new PhysicalPlanner();
        this.executor = new Executor();
    }

    public Catalog catalog() {
        return catalog;
    }

    public Analyzer analyzer() {
        return analyzer;
    }

    public Optimizer optimizer() {
        return optimizer;
    }

    public PhysicalPlanner planner() {
        return planner;
    }

    public Executor executor() {
        return executor;
    }

    /**
     * Parses and plans {@code sql}. Parse and name errors are thrown here, the remaining stages run
     * lazily through the returned {@link QueryExecution}.
     */
    public QueryExecution executeSql(String sql) {
        SqlPlanner.Statement statement = new SqlPlanner(catalog, analyzer).plan(sql);
        return new QueryExecution(this, statement.plan, statement.explain);
    }
}
