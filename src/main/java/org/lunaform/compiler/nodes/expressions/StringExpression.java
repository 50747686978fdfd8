package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

import java.util.Objects;

/**
 * A string literal. The value is the decoded content, escapes resolved and delimiters removed.
 */
public class StringExpression extends TokenNode implements Expression, Arguments {

    private String value;

    public StringExpression(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public StringExpression(String value, Token token) {
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
        return visitor.visitStringExpression(this);
    }
}
