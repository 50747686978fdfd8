package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code T?}
 */
public class OptionalType implements Type {

    private Type innerType;
    private Token question;

    public OptionalType(Type innerType) {
        this.innerType = Objects.requireNonNull(innerType, "innerType");
    }

    public OptionalType withToken(Token question) {
        this.question = question;
        return this;
    }

    public Type getInnerType() {
        return innerType;
    }

    public void setInnerType(Type innerType) {
        this.innerType = Objects.requireNonNull(innerType, "innerType");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(question);
    }

    @Override
    public List<Node> children() {
        return List.of(innerType);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (question != null) {
            action.accept(question);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOptionalType(this);
    }
}
