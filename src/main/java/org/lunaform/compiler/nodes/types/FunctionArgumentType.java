package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Identifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An argument of a {@link FunctionType}, optionally named: {@code (name: string) -> ()}.
 */
public class FunctionArgumentType implements Node {

    private Identifier name;
    private Type type;
    private Token colon;

    public FunctionArgumentType(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public FunctionArgumentType withName(Identifier name, Token colon) {
        this.name = name;
        this.colon = colon;
        return this;
    }

    public Optional<Identifier> getName() {
        return Optional.ofNullable(name);
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public Optional<Token> getColonToken() {
        return Optional.ofNullable(colon);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(2);
        if (name != null) {
            children.add(name);
        }
        children.add(type);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (colon != null) {
            action.accept(colon);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionArgumentType(this);
    }
}
