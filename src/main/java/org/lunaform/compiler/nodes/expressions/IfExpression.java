package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code if condition then result elseif ... else elseResult}
 */
public class IfExpression implements Expression {

    private Expression condition;
    private Expression result;
    private Expression elseResult;
    private final List<ElseIfExpressionBranch> branches = new ArrayList<>();
    private Tokens tokens;

    public IfExpression(Expression condition, Expression result, Expression elseResult) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.result = Objects.requireNonNull(result, "result");
        this.elseResult = Objects.requireNonNull(elseResult, "elseResult");
    }

    public IfExpression withBranch(ElseIfExpressionBranch branch) {
        branches.add(branch);
        return this;
    }

    public IfExpression withTokens(Tokens tokens) {
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

    public Expression getElseResult() {
        return elseResult;
    }

    public void setElseResult(Expression elseResult) {
        this.elseResult = Objects.requireNonNull(elseResult, "elseResult");
    }

    public List<ElseIfExpressionBranch> getBranches() {
        return branches;
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(3 + branches.size());
        children.add(condition);
        children.add(result);
        children.addAll(branches);
        children.add(elseResult);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.ifToken());
            action.accept(tokens.then());
            action.accept(tokens.elseToken());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIfExpression(this);
    }

    public record Tokens(Token ifToken, Token then, Token elseToken) {
    }
}
