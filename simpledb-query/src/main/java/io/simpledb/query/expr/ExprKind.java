package io.simpledb.query.expr;

/**
 * The closed set of expression kinds.
 */
public enum ExprKind {
    /** A column, unresolved by name, resolved by name, or bound to a position. */
    COLUMN,
    LITERAL,
    BINARY,
    AGGREGATE,
    ALIAS,
    STAR,
}
