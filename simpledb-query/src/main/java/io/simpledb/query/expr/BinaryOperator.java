package io.simpledb.query.expr;

import io.simpledb.query.ExecutionException;
import io.simpledb.query.types.DataType;
import io.simpledb.query.types.Value;

/**
 * Operators of {@link BinaryExpression}. Any null operand of an arithmetic or comparison operator
 * produces null, {@code and}/{@code or} follow three-valued logic.
 */
public enum BinaryOperator {
    // @formatter:off
    EQ("=", Category.COMPARISON),
    NOT_EQ("!=", Category.COMPARISON),
    LT("<", Category.COMPARISON),
    LT_EQ("<=", Category.COMPARISON),
    GT(">", Category.COMPARISON),
    GT_EQ(">=", Category.COMPARISON),
    PLUS("+", Category.ARITHMETIC),
    MINUS("-", Category.ARITHMETIC),
    MULTIPLY("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC),
    MODULO("%", Category.ARITHMETIC),
    AND("and", Category.LOGICAL),
    OR("or", Category.LOGICAL),
    ;
    // @formatter:on

    public enum Category {
        ARITHMETIC, COMPARISON, LOGICAL
    }

    public final String symbol;
    public final Category category;

    BinaryOperator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        if ("<>".equals(symbol)) {
            return NOT_EQ;
        }
        for (BinaryOperator op : values()) {
            if (op.symbol.equalsIgnoreCase(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol);
    }

    public DataType resultType(DataType left, DataType right) {
        return category == Category.ARITHMETIC ? DataType.calType(left, right) : DataType.BooleanType;
    }

    public Value apply(Value left, Value right) {
        switch (category) {
            case ARITHMETIC:
                return arithmetic(left, right);
            case COMPARISON:
                return compare(left, right);
            case LOGICAL:
                return logical(left, right);
            default:
                throw new IllegalStateException(category.name());
        }
    }

    private Value arithmetic(Value left, Value right) {
        if (left.isNull() || right.isNull()) {
            return Value.NULL;
        }
        if (!left.isNumeric() || !right.isNumeric()) {
            throw typeError(left, right);
        }
        if (left.dataType() == DataType.LongType && right.dataType() == DataType.LongType) {
            long l = left.getLong(), r = right.getLong();
            switch (this) {
                case PLUS:
                    return Value.ofLong(l + r);
                case MINUS:
                    return Value.ofLong(l - r);
                case MULTIPLY:
                    return Value.ofLong(l * r);
                case DIVIDE:
                    checkDivisor(r);
                    return Value.ofLong(l / r);
                case MODULO:
                    checkDivisor(r);
                    return Value.ofLong(l % r);
                default:
                    throw new IllegalStateException(name());
            }
        }
        double l = left.getDouble(), r = right.getDouble();
        switch (this) {
            case PLUS:
                return Value.ofDouble(l + r);
            case MINUS:
                return Value.ofDouble(l - r);
            case MULTIPLY:
                return Value.ofDouble(l * r);
            case DIVIDE:
                return Value.ofDouble(l / r);
            case MODULO:
                return Value.ofDouble(l % r);
            default:
                throw new IllegalStateException(name());
        }
    }

    private void checkDivisor(long r) {
        if (r == 0) {
            throw ExecutionException.arithmeticError(String.format("Integer %s by zero", this == DIVIDE ? "division" : "modulo"));
        }
    }

    private Value compare(Value left, Value right) {
        if (left.isNull() || right.isNull()) {
            return Value.NULL;
        }
        int c;
        try {
            c = Value.compare(left, right);
        } catch (ExecutionException e) {
            throw typeError(left, right);
        }
        switch (this) {
            case EQ:
                return Value.ofBoolean(c == 0);
            case NOT_EQ:
                return Value.ofBoolean(c != 0);
            case LT:
                return Value.ofBoolean(c < 0);
            case LT_EQ:
                return Value.ofBoolean(c <= 0);
            case GT:
                return Value.ofBoolean(c > 0);
            case GT_EQ:
                return Value.ofBoolean(c >= 0);
            default:
                throw new IllegalStateException(name());
        }
    }

    private Value logical(Value left, Value right) {
        checkLogicalOperand(left, right);
        checkLogicalOperand(right, left);
        // The dominant value decides regardless of the other side: false for and, true for or.
        boolean dominant = this == OR;
        if ((!left.isNull() && left.getBoolean() == dominant) || (!right.isNull() && right.getBoolean() == dominant)) {
            return Value.ofBoolean(dominant);
        }
        if (left.isNull() || right.isNull()) {
            return Value.NULL;
        }
        return Value.ofBoolean(!dominant);
    }

    private void checkLogicalOperand(Value v, Value other) {
        if (!v.isNull() && v.dataType() != DataType.BooleanType) {
            throw typeError(v, other);
        }
    }

    private ExecutionException typeError(Value left, Value right) {
        return ExecutionException.typeError(String.format("Cannot apply '%s' to %s and %s",
                symbol, left.dataType().typeName(), right.dataType().typeName()));
    }
}
