package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code prefix.field}
 */
public class FieldExpression implements Variable {

    private Prefix prefix;
    private Identifier field;
    private Token token;

    public FieldExpression(Prefix prefix, Identifier field) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.field = Objects.requireNonNull(field, "field");
    }

    public FieldExpression withToken(Token token) {
        this.token = token;
        return this;
    }

    public Prefix getPrefix() {
        return prefix;
    }

    public void setPrefix(Prefix prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public Identifier getField() {
        return field;
    }

    public void setField(Identifier field) {
        this.field = Objects.requireNonNull(field, "field");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
    }

    public void setToken(Token token) {
        this.token = token;
    }

    @Override
    public List<Node> children() {
        return List.of(prefix, field);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (token != null) {
            action.accept(token);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFieldExpression(this);
    }
}
