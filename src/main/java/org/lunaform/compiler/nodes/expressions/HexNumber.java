package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

import java.util.OptionalInt;

/**
 * A hexadecimal number such as {@code 0xFF}, with an optional binary exponent ({@code 0x1p4}).
 * The value is an unsigned 64-bit integer.
 */
public class HexNumber extends TokenNode implements NumberExpression {

    private long value;
    private boolean uppercase;
    private Integer exponent;

    public HexNumber(long value, boolean uppercase) {
        this.value = value;
        this.uppercase = uppercase;
    }

    public HexNumber withExponent(int exponent) {
        this.exponent = exponent;
        return this;
    }

    public HexNumber withToken(Token token) {
        setToken(token);
        return this;
    }

    public long getValue() {
        return value;
    }

    public void setValue(long value) {
        this.value = value;
    }

    /**
     * @return true when written with {@code 0X}.
     */
    public boolean isUppercase() {
        return uppercase;
    }

    public OptionalInt getExponent() {
        return exponent == null ? OptionalInt.empty() : OptionalInt.of(exponent);
    }

    @Override
    public double computeValue() {
        double base = value < 0 ? (double) (value >>> 1) * 2.0 + (value & 1) : value;
        return exponent == null ? base : base * Math.pow(2, exponent);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHexNumber(this);
    }
}
