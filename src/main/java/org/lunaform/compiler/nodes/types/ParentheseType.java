package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

public class ParentheseType implements Type {

    private Type innerType;
    private Tokens tokens;

    public ParentheseType(Type innerType) {
        this.innerType = Objects.requireNonNull(innerType, "innerType");
    }

    public ParentheseType withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Type getInnerType() {
        return innerType;
    }

    public void setInnerType(Type innerType) {
        this.innerType = Objects.requireNonNull(innerType, "innerType");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        return List.of(innerType);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingParenthese());
            action.accept(tokens.closingParenthese());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParentheseType(this);
    }

    public record Tokens(Token openingParenthese, Token closingParenthese) {
    }
}
