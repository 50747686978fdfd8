package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

/**
 * A Luau binary number such as {@code 0b1010}.
 */
public class BinaryNumber extends TokenNode implements NumberExpression {

    private long value;
    private boolean uppercase;

    public BinaryNumber(long value, boolean uppercase) {
        this.value = value;
        this.uppercase = uppercase;
    }

    public BinaryNumber withToken(Token token) {
        setToken(token);
        return this;
    }

    public long getValue() {
        return value;
    }

    public void setValue(long value) {
        this.value = value;
    }

    public boolean isUppercase() {
        return uppercase;
    }

    @Override
    public double computeValue() {
        return value < 0 ? (double) (value >>> 1) * 2.0 + (value & 1) : value;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryNumber(this);
    }
}
