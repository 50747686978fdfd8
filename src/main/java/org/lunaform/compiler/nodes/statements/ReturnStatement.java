package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Separators;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code return a, b}. The comma list is kept in sync with the expressions.
 */
public class ReturnStatement implements LastStatement {

    private final List<Expression> expressions = new ArrayList<>();
    private Tokens tokens;

    public ReturnStatement() {
    }

    public ReturnStatement(List<? extends Expression> expressions) {
        this.expressions.addAll(expressions);
    }

    public ReturnStatement withExpression(Expression expression) {
        pushExpression(expression);
        return this;
    }

    public ReturnStatement withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public List<Expression> getExpressions() {
        return Collections.unmodifiableList(expressions);
    }

    public int size() {
        return expressions.size();
    }

    public void pushExpression(Expression expression) {
        insertExpression(expressions.size(), expression);
    }

    public void insertExpression(int index, Expression expression) {
        int position = Math.min(index, expressions.size());
        expressions.add(position, expression);
        if (tokens != null) {
            Separators.insertAt(tokens.commas(), position, expressions.size(), ",");
        }
    }

    public Expression replaceExpression(int index, Expression expression) {
        return expressions.set(index, expression);
    }

    public Expression removeExpression(int index) {
        Expression removed = expressions.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.commas(), index);
        }
        return removed;
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public List<Node> children() {
        return new ArrayList<>(expressions);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.returnToken());
            tokens.commas().forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }

    public record Tokens(Token returnToken, List<Token> commas) {
    }
}
