package io.simpledb.query;

import com.google.common.base.Preconditions;

/**
 * Base of all errors surfaced by statement execution.
 */
public class QueryException extends RuntimeException {
    private final ErrorCode errorCode;

    public QueryException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public QueryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Preconditions.checkNotNull(errorCode);
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
