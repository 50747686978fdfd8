package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

public class UnaryExpression implements Expression {

    private UnaryOperator operator;
    private Expression expression;
    private Token token;

    public UnaryExpression(UnaryOperator operator, Expression expression) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public UnaryExpression withToken(Token token) {
        this.token = token;
        return this;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public void setOperator(UnaryOperator operator) {
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
    }

    public void setToken(Token token) {
        this.token = token;
    }

    @Override
    public List<Node> children() {
        return List.of(expression);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (token != null) {
            action.accept(token);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnaryExpression(this);
    }
}
