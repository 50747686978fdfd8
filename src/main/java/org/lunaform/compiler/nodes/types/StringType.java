package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

import java.util.Objects;

/**
 * A string singleton type, {@code "on" | "off"}.
 */
public class StringType extends TokenNode implements Type {

    private String value;

    public StringType(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public StringType(String value, Token token) {
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
        return visitor.visitStringType(this);
    }
}
