package io.simpledb.shell;

import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.locks.ReentrantLock;

import io.simpledb.query.QueryContext;
import io.simpledb.query.QueryException;
import io.simpledb.query.QueryExecution;
import io.simpledb.query.catalog.MemoryCatalog;
import io.simpledb.query.source.CsvTableLoader;
import io.simpledb.util.JsonUtil;
import io.simpledb.util.RuntimeUtil;

/**
 * Command line front end. Reads one statement per line and prints the result as a table.
 */
public class SimpleDBShell {
    private static final Logger logger = LoggerFactory.getLogger(SimpleDBShell.class);

    static final String PROMPT = "Enter SQL query (or 'exit' to quit): ";

    private final QueryContext context;
    private final PrintStream out;
    // Statements from the same shell run one at a time.
    private final ReentrantLock lock = new ReentrantLock();

    public SimpleDBShell(QueryContext context, PrintStream out) {
        this.context = context;
        this.out = out;
    }

    /**
     * Registers every table of the config, relative paths are resolved against the config file's directory.
     */
    public static MemoryCatalog loadCatalog(Path configPath) throws IOException {
        TablesConfig config = JsonUtil.loadConfig(configPath, TablesConfig.class);
        MemoryCatalog catalog = new MemoryCatalog();
        Path dir = configPath.toAbsolutePath().getParent();
        for (TablesConfig.TableConfig table : config.tables) {
            Preconditions.checkArgument(table.name != null && table.path != null,
                    "table config needs both name and path: %s", JsonUtil.toJsonPretty(table));
            Path path = Paths.get(table.path);
            if (!path.isAbsolute() && dir != null) {
                path = dir.resolve(path);
            }
            catalog.registerTable(new CsvTableLoader(table.csvOptions()).load(table.name, path));
        }
        return catalog;
    }

    /**
     * Runs one statement and prints its result, or the error message if it fails.
     *
     * @return whether the statement succeeded.
     */
    public boolean execute(String sql) {
        lock.lock();
        try {
            QueryExecution execution = context.executeSql(sql);
            TablePrinter.print(execution.schema(), execution.result(), out);
            return true;
        } catch (QueryException e) {
            logger.debug("Query failed: {}", sql, e);
            out.printf("Error executing query '%s': %s%n", sql, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure of query: {}", sql, e);
            out.printf("Error executing query '%s': %s%n", sql, e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** Reads statements until {@code exit} or the end of input. */
    public void repl(BufferedReader reader) throws IOException {
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            String sql = line.trim();
            if (sql.isEmpty()) {
                continue;
            }
            if ("exit".equalsIgnoreCase(StringUtils.removeEnd(sql, ";").trim())) {
                break;
            }
            execute(sql);
        }
    }

    private static class MyOptions {
        @Option(name = "-h", aliases = "--help", usage = "print this help")
        boolean help;
        @Option(name = "-c", aliases = "--config", metaVar = "path", usage = "tables config file, json")
        String configPath;
        @Option(name = "-e", aliases = "--execute", metaVar = "sql", usage = "run one statement and exit")
        String sql;
    }

    public static void main(String[] args) throws Exception {
        MyOptions options = new MyOptions();
        CmdLineParser parser = RuntimeUtil.parseArgs(args, options);
        if (options.help) {
            RuntimeUtil.printUsage(parser, "simpledb");
            return;
        }

        MemoryCatalog catalog;
        try {
            catalog = options.configPath == null ? new MemoryCatalog() : loadCatalog(Paths.get(options.configPath));
        } catch (IOException e) {
            System.err.printf("Load tables from [%s] failed: %s%n", options.configPath, e.getMessage());
            logger.debug("Load tables failed", e);
            System.exit(1);
            return;
        }
        logger.info("Registered tables: {}", catalog.tableNames());

        SimpleDBShell shell = new SimpleDBShell(new QueryContext(catalog), System.out);
        if (options.sql != null) {
            System.exit(shell.execute(options.sql) ? 0 : 1);
            return;
        }
        shell.repl(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }
}
