package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code typeof(expression)}
 */
public class ExpressionType implements Type {

    private Expression expression;
    private Tokens tokens;

    public ExpressionType(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public ExpressionType withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        return List.of(expression);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.typeofToken());
            action.accept(tokens.openingParenthese());
            action.accept(tokens.closingParenthese());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitExpressionType(this);
    }

    public record Tokens(Token typeofToken, Token openingParenthese, Token closingParenthese) {
    }
}
