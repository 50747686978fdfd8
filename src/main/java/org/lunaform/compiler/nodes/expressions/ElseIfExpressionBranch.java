package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

public class ElseIfExpressionBranch implements Node {

    private Expression condition;
    private Expression result;
    private Tokens tokens;

    public ElseIfExpressionBranch(Expression condition, Expression result) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.result = Objects.requireNonNull(result, "result");
    }

    public ElseIfExpressionBranch withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public Expression getResult() {
        return result;
    }

    public void setResult(Expression result) {
        this.result = Objects.requireNonNull(result, "result");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public List<Node> children() {
        return List.of(condition, result);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.elseIf());
            action.accept(tokens.then());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitElseIfExpressionBranch(this);
    }

    public record Tokens(Token elseIf, Token then) {
    }
}
