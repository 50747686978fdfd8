package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code {T}}
 */
public class ArrayType implements Type {

    private Type elementType;
    private Tokens tokens;

    public ArrayType(Type elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    public ArrayType withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Type getElementType() {
        return elementType;
    }

    public void setElementType(Type elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        return List.of(elementType);
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
        return visitor.visitArrayType(this);
    }

    public record Tokens(Token openingBrace, Token closingBrace) {
    }
}
