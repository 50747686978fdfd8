package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An expression embedded in an interpolated string between braces.
 */
public class ValueSegment implements InterpolationSegment {

    private Expression value;
    private Tokens tokens;

    public ValueSegment(Expression value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public ValueSegment withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public List<Node> children() {
        return List.of(value);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingBrace());
            action.accept(tokens.closingBrace());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitValueSegment(this);
    }

    public record Tokens(Token openingBrace, Token closingBrace) {
    }
}
