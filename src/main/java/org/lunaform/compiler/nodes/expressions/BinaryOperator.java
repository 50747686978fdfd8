package org.lunaform.compiler.nodes.expressions;

/**
 * Operators of a {@link BinaryExpression}.
 */
public enum BinaryOperator {
    AND("and", 1),
    OR("or", 0),
    EQUAL("==", 2),
    NOT_EQUAL("~=", 2),
    LOWER_THAN("<", 2),
    LOWER_OR_EQUAL_THAN("<=", 2),
    GREATER_THAN(">", 2),
    GREATER_OR_EQUAL_THAN(">=", 2),
    PLUS("+", 4),
    MINUS("-", 4),
    ASTERISK("*", 5),
    SLASH("/", 5),
    DOUBLE_SLASH("//", 5),
    PERCENT("%", 5),
    CARET("^", 7),
    CONCAT("..", 3);

    /**
     * The precedence of unary operators, between multiplicative operators and {@code ^}.
     */
    public static final int UNARY_PRECEDENCE = 6;

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == CARET || this == CONCAT;
    }

    /**
     * @param operand A binary operator found as a direct operand of this one.
     * @param left Whether the operand is on the left side.
     * @return true when the operand must be parenthesized to keep its grouping.
     */
    public boolean needsParentheses(BinaryOperator operand, boolean left) {
        if (operand.precedence != precedence) {
            return operand.precedence < precedence;
        }
        return isRightAssociative() == left;
    }
}
