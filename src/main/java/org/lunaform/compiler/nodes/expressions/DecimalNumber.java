package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

import java.util.OptionalInt;

/**
 * A decimal number such as {@code 1}, {@code 0.5} or {@code 1e10}.
 */
public class DecimalNumber extends TokenNode implements NumberExpression {

    private double value;
    private Integer exponent;
    private boolean uppercaseExponent;

    public DecimalNumber(double value) {
        this.value = value;
    }

    public DecimalNumber(double value, Token token) {
        super(token);
        this.value = value;
    }

    /**
     * Records that the literal was written with an exponent, e.g. {@code 1e10} has exponent 10.
     * The value stays the full value of the literal.
     */
    public DecimalNumber withExponent(int exponent, boolean uppercase) {
        this.exponent = exponent;
        this.uppercaseExponent = uppercase;
        return this;
    }

    public DecimalNumber withToken(Token token) {
        setToken(token);
        return this;
    }

    public OptionalInt getExponent() {
        return exponent == null ? OptionalInt.empty() : OptionalInt.of(exponent);
    }

    public boolean isUppercaseExponent() {
        return uppercaseExponent;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    @Override
    public double computeValue() {
        return value;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDecimalNumber(this);
    }
}
