package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.expressions.BinaryOperator;

/**
 * Operators of a {@link CompoundAssignStatement}, like {@code +=}.
 */
public enum CompoundOperator {
    PLUS("+=", BinaryOperator.PLUS),
    MINUS("-=", BinaryOperator.MINUS),
    ASTERISK("*=", BinaryOperator.ASTERISK),
    SLASH("/=", BinaryOperator.SLASH),
    DOUBLE_SLASH("//=", BinaryOperator.DOUBLE_SLASH),
    PERCENT("%=", BinaryOperator.PERCENT),
    CARET("^=", BinaryOperator.CARET),
    CONCAT("..=", BinaryOperator.CONCAT);

    private final String symbol;
    private final BinaryOperator binaryOperator;

    CompoundOperator(String symbol, BinaryOperator binaryOperator) {
        this.symbol = symbol;
        this.binaryOperator = binaryOperator;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return the operator applied by the assignment, {@code +} for {@code +=}.
     */
    public BinaryOperator toBinaryOperator() {
        return binaryOperator;
    }
}
