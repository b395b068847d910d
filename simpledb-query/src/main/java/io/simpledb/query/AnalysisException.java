package io.simpledb.query;

/**
 * Thrown while building the logical plan, when a table or column name can not be resolved.
 */
public class AnalysisException extends QueryException {
    public AnalysisException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static AnalysisException tableNotFound(String table) {
        return new AnalysisException(ErrorCode.TABLE_NOT_FOUND, "No table name: " + table);
    }

    public static AnalysisException columnNotFound(String column, Object candidates) {
        return new AnalysisException(ErrorCode.COLUMN_NOT_FOUND,
                String.format("Cannot resolve column '%s' given input columns %s", column, candidates));
    }

    public static AnalysisException ambiguousColumn(String column, Object candidates) {
        return new AnalysisException(ErrorCode.AMBIGUOUS_COLUMN,
                String.format("Column reference '%s' is ambiguous, could be: %s", column, candidates));
    }
}
