package io.simpledb.query;

/**
 * Thrown while compiling a logical plan into a physical plan.
 */
public class PlanningException extends QueryException {
    public PlanningException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static PlanningException unsupportedPlanNode(TreeNode<?> node) {
        return new PlanningException(ErrorCode.UNSUPPORTED_PLAN_NODE,
                "Unsupported plan node: " + node.simpleString());
    }

    public static PlanningException unsupportedExpression(String expr, String reason) {
        return new PlanningException(ErrorCode.UNSUPPORTED_EXPRESSION,
                String.format("Unsupported expression '%s': %s", expr, reason));
    }
}
