package io.simpledb.query.source;

import com.google.common.base.Preconditions;

/**
 * How a CSV file is read into a table.
 */
public class CsvOptions {
    public static final CsvOptions DEFAULT = new CsvOptions();

    /** Whether the first line holds the column names. */
    public boolean hasHeader = true;
    /** Separator between cells, taken literally. */
    public String delimiter = ",";
    /** Number of records looked at when inferring column types. */
    public int inferRows = 100;
    /** Rows per batch of the loaded table. */
    public int batchSize = 1024;

    public CsvOptions hasHeader(boolean hasHeader) {
        this.hasHeader = hasHeader;
        return this;
    }

    public CsvOptions delimiter(String delimiter) {
        Preconditions.checkArgument(delimiter != null && !delimiter.isEmpty(), "empty delimiter");
        this.delimiter = delimiter;
        return this;
    }

    public CsvOptions inferRows(int inferRows) {
        Preconditions.checkArgument(inferRows > 0, "inferRows must be positive: %s", inferRows);
        this.inferRows = inferRows;
        return this;
    }

    public CsvOptions batchSize(int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive: %s", batchSize);
        this.batchSize = batchSize;
        return this;
    }

    @Override
    public String toString() {
        return String.format("CsvOptions{hasHeader=%s, delimiter='%s', inferRows=%d, batchSize=%d}",
                hasHeader, delimiter, inferRows, batchSize);
    }
}
