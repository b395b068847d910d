package io.simpledb.query.source;

import com.google.common.collect.Lists;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.catalog.TableSource;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.StructField;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

/**
 * Reads a whole CSV file into memory as a table.
 * <p>
 * Column types are inferred from the leading records: a column is bigint if every non-empty cell is
 * an integer, else double if every cell is a number, else bool if every cell is true or false, else
 * varchar. Empty cells are null. The first column is qualified with the table name, the others are not.
 */
public class CsvTableLoader {
    private static final Logger logger = LoggerFactory.getLogger(CsvTableLoader.class);

    private final CsvOptions options;
    private final Pattern splitter;

    public CsvTableLoader(CsvOptions options) {
        this.options = options;
        this.splitter = Pattern.compile(Pattern.quote(options.delimiter));
    }

    public CsvTableLoader() {
        this(CsvOptions.DEFAULT);
    }

    public TableSource load(String tableName, Path path) throws IOException {
        try (InputStream in = new FileInputStream(path.toFile())) {
            return load(tableName, in, path.toString());
        }
    }

    public TableSource load(String tableName, InputStream in, String sourceName) throws IOException {
        List<String> header = null;
        List<String[]> records = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (StringUtils.isBlank(line)) {
                continue;
            }
            String[] cells = splitter.split(line, -1);
            for (int i = 0; i < cells.length; i++) {
                cells[i] = cells[i].trim();
            }
            if (header == null && options.hasHeader) {
                header = new ArrayList<>(cells.length);
                for (String name : cells) {
                    header.add(name.toLowerCase());
                }
                continue;
            }
            int width = header != null ? header.size() : records.isEmpty() ? cells.length : records.get(0).length;
            if (cells.length > width) {
                throw new IOException(String.format("%s line %d: expected %d cells, found %d",
                        sourceName, lineNo, width, cells.length));
            }
            records.add(cells);
        }
        if (header == null) {
            int width = records.isEmpty() ? 0 : records.get(0).length;
            header = new ArrayList<>(width);
            for (int i = 1; i <= width; i++) {
                header.add("column_" + i);
            }
        }
        if (header.isEmpty()) {
            throw new IOException(sourceName + " has no columns");
        }

        StructType schema = inferSchema(tableName, header, records);
        List<RecordBatch> batches = new ArrayList<>();
        for (List<String[]> part : Lists.partition(records, options.batchSize)) {
            List<List<Value>> rows = new ArrayList<>(part.size());
            for (String[] cells : part) {
                rows.add(toRow(schema, cells, sourceName));
            }
            batches.add(RecordBatch.fromRows(schema, rows));
        }
        logger.info("Loaded table {} from {}: {} rows in {} batches, schema {}",
                tableName, sourceName, records.size(), batches.size(), schema);
        return new TableSource(tableName, schema, batches);
    }

    private StructType inferSchema(String tableName, List<String> header, List<String[]> records) {
        List<StructField> fields = new ArrayList<>(header.size());
        int sampled = Math.min(records.size(), options.inferRows);
        for (int col = 0; col < header.size(); col++) {
            DataType type = DataType.NullType;
            for (int r = 0; r < sampled; r++) {
                String cell = cell(records.get(r), col);
                if (cell != null) {
                    type = widen(type, cell);
                }
            }
            if (type == DataType.NullType) {
                type = DataType.StringType;
            }
            String qualifier = col == 0 ? tableName : null;
            fields.add(new StructField(qualifier, header.get(col), type));
        }
        return new StructType(fields);
    }

    private static DataType widen(DataType current, String cell) {
        switch (current) {
            case NullType:
                if (isLong(cell)) {
                    return DataType.LongType;
                }
                if (isDouble(cell)) {
                    return DataType.DoubleType;
                }
                return isBoolean(cell) ? DataType.BooleanType : DataType.StringType;
            case LongType:
                if (isLong(cell)) {
                    return DataType.LongType;
                }
                return isDouble(cell) ? DataType.DoubleType : DataType.StringType;
            case DoubleType:
                return isDouble(cell) ? DataType.DoubleType : DataType.StringType;
            case BooleanType:
                return isBoolean(cell) ? DataType.BooleanType : DataType.StringType;
            default:
                return DataType.StringType;
        }
    }

    private static boolean isLong(String s) {
        try {
            Long.parseLong(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDouble(String s) {
        try {
            Double.parseDouble(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isBoolean(String s) {
        return "true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s);
    }

    private static String cell(String[] cells, int col) {
        return col < cells.length && !cells[col].isEmpty() ? cells[col] : null;
    }

    private static List<Value> toRow(StructType schema, String[] cells, String sourceName) throws IOException {
        List<Value> row = new ArrayList<>(schema.size());
        for (int col = 0; col < schema.size(); col++) {
            String cell = cell(cells, col);
            DataType type = schema.get(col).dataType;
            if (cell == null) {
                row.add(Value.NULL);
                continue;
            }
            try {
                switch (type) {
                    case LongType:
                        row.add(Value.ofLong(Long.parseLong(cell)));
                        break;
                    case DoubleType:
                        row.add(Value.ofDouble(Double.parseDouble(cell)));
                        break;
                    case BooleanType:
                        if (!isBoolean(cell)) {
                            throw new NumberFormatException(cell);
                        }
                        row.add(Value.ofBoolean(Boolean.parseBoolean(cell)));
                        break;
                    default:
                        row.add(Value.ofString(cell));
                }
            } catch (NumberFormatException e) {
                throw new IOException(String.format("%s: cannot read '%s' as %s for column %s",
                        sourceName, cell, type.typeName(), schema.get(col).qualifiedName()), e);
            }
        }
        return row;
    }
}
