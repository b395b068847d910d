package io.simpledb.query.sql;

import io.simpledb.query.ErrorCode;
import io.simpledb.query.QueryException;

/**
 * Malformed statement text.
 */
public class SqlParseException extends QueryException {
    public SqlParseException(String message) {
        super(ErrorCode.PARSE_ERROR, message);
    }

    public SqlParseException(int line, int charPositionInLine, String message) {
        super(ErrorCode.PARSE_ERROR, String.format("line %d:%d %s", line, charPositionInLine, message));
    }
}
