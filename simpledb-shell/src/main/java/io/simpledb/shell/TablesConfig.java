package io.simpledb.shell;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

import io.simpledb.query.source.CsvOptions;

/**
 * The tables registered when the shell starts.
 * <pre>
 * {"tables": [{"name": "t1", "path": "data/t1.csv", "delimiter": ",", "hasHeader": true}]}
 * </pre>
 */
public class TablesConfig {
    @JsonProperty("tables")
    public final List<TableConfig> tables;

    public TablesConfig(@JsonProperty("tables") List<TableConfig> tables) {
        this.tables = tables == null ? Collections.emptyList() : tables;
    }

    public static class TableConfig {
        @JsonProperty("name")
        public final String name;
        @JsonProperty("path")
        public final String path;
        @JsonProperty("delimiter")
        public final String delimiter;
        @JsonProperty("hasHeader")
        public final boolean hasHeader;

        public TableConfig(@JsonProperty("name") String name,
                           @JsonProperty("path") String path,
                           @JsonProperty("delimiter") String delimiter,
                           @JsonProperty("hasHeader") Boolean hasHeader) {
            this.name = name;
            this.path = path;
            this.delimiter = delimiter == null ? "," : delimiter;
            this.hasHeader = hasHeader == null || hasHeader;
        }

        public CsvOptions csvOptions() {
            return new CsvOptions().delimiter(delimiter).hasHeader(hasHeader);
        }
    }
}
