package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An expression wrapped in parentheses. Besides grouping, this truncates a multiple-value
 * expression to its first value.
 */
public class ParentheseExpression implements Prefix {

    private Expression inner;
    private Tokens tokens;

    public ParentheseExpression(Expression inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    public ParentheseExpression withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Expression getInnerExpression() {
        return inner;
    }

    public void setInnerExpression(Expression inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public List<Node> children() {
        return List.of(inner);
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
        return visitor.visitParentheseExpression(this);
    }

    public record Tokens(Token openingParenthese, Token closingParenthese) {
    }
}
