package org.lunaform.compiler.nodes.expressions;

public enum UnaryOperator {
    MINUS("-"),
    NOT("not"),
    LENGTH("#");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
