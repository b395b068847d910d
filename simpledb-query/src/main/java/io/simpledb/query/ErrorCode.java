package io.simpledb.query;

/**
 * Every failure a statement can end with. The first error raised by any stage aborts the statement.
 */
public enum ErrorCode {
    PARSE_ERROR,
    TABLE_NOT_FOUND,
    COLUMN_NOT_FOUND,
    AMBIGUOUS_COLUMN,
    UNSUPPORTED_PLAN_NODE,
    UNSUPPORTED_EXPRESSION,
    EVALUATION_TYPE_ERROR,
    ARITHMETIC_ERROR,
}
