package io.simpledb.query.plan;

/**
 * The closed set of operators. Logical and physical trees share it, each logical node compiles to the
 * physical node of the same kind.
 */
public enum PlanKind {
    SCAN,
    PROJECT,
    FILTER,
    AGGREGATE,
    LIMIT,
}
