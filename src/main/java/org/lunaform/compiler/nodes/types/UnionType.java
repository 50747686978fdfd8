package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code Left | Right}
 */
public class UnionType implements Type {

    private Type left;
    private Type right;
    private Token token;

    public UnionType(Type left, Type right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public UnionType withToken(Token token) {
        this.token = token;
        return this;
    }

    public Type getLeft() {
        return left;
    }

    public void setLeft(Type left) {
        this.left = Objects.requireNonNull(left, "left");
    }

    public Type getRight() {
        return right;
    }

    public void setRight(Type right) {
        this.right = Objects.requireNonNull(right, "right");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
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
        return visitor.visitUnionType(this);
    }
}
