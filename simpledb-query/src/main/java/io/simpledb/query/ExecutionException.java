package io.simpledb.query;

/**
 * Thrown while evaluating expressions over batches.
 */
public class ExecutionException extends QueryException {
    public ExecutionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static ExecutionException typeError(String message) {
        return new ExecutionException(ErrorCode.EVALUATION_TYPE_ERROR, message);
    }

    public static ExecutionException arithmeticError(String message) {
        return new ExecutionException(ErrorCode.ARITHMETIC_ERROR, message);
    }
}
