package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code prefix[index]}
 */
public class IndexExpression implements Variable {

    private Prefix prefix;
    private Expression index;
    private Tokens tokens;

    public IndexExpression(Prefix prefix, Expression index) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.index = Objects.requireNonNull(index, "index");
    }

    public IndexExpression withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Prefix getPrefix() {
        return prefix;
    }

    public void setPrefix(Prefix prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public Expression getIndex() {
        return index;
    }

    public void setIndex(Expression index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public List<Node> children() {
        return List.of(prefix, index);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingBracket());
            action.accept(tokens.closingBracket());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIndexExpression(this);
    }

    public record Tokens(Token openingBracket, Token closingBracket) {
    }
}
