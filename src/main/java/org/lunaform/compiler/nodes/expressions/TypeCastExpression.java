package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.types.Type;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code expression :: Type}
 */
public class TypeCastExpression implements Expression {

    private Expression expression;
    private Type type;
    private Token token;

    public TypeCastExpression(Expression expression, Type type) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.type = Objects.requireNonNull(type, "type");
    }

    public TypeCastExpression withToken(Token token) {
        this.token = token;
        return this;
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
    }

    public void setToken(Token token) {
        this.token = token;
    }

    @Override
    public List<Node> children() {
        return List.of(expression, type);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (token != null) {
            action.accept(token);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTypeCastExpression(this);
    }
}
