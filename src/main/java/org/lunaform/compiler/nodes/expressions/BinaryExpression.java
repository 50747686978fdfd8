package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code left <operator> right}. Only the operator token is held.
 */
public class BinaryExpression implements Expression {

    private BinaryOperator operator;
    private Expression left;
    private Expression right;
    private Token token;

    public BinaryExpression(BinaryOperator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryExpression withToken(Token token) {
        this.token = token;
        return this;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public void setOperator(BinaryOperator operator) {
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public Expression getLeft() {
        return left;
    }

    public void setLeft(Expression left) {
        this.left = Objects.requireNonNull(left, "left");
    }

    public Expression getRight() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = Objects.requireNonNull(right, "right");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
    }

    public void setToken(Token token) {
        this.token = token;
    }

    @Override
    public List<Node> children() {
        return List.of(left, right);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (token != null) {
            action.accept(token);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }
}
