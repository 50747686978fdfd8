package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

import java.util.Objects;

/**
 * A name, used as a variable, a field name, a method name or a type name.
 */
public class Identifier extends TokenNode implements Variable {

    private String name;

    public Identifier(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Identifier(String name, Token token) {
        super(token);
        this.name = Objects.requireNonNull(name, "name");
    }

    public Identifier withToken(Token token) {
        setToken(token);
        return this;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return "Identifier(" + name + ")";
    }
}
