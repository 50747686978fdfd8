package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

import java.util.Objects;

/**
 * Literal text inside an interpolated string, escapes resolved.
 */
public class StringSegment extends TokenNode implements InterpolationSegment {

    private String value;

    public StringSegment(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public StringSegment(String value, Token token) {
        super(token);
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStringSegment(this);
    }
}
