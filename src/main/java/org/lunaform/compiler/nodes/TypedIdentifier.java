package org.lunaform.compiler.nodes;

import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A declared name with an optional type annotation, as in {@code local count: number}.
 */
public class TypedIdentifier implements Node {

    private Identifier name;
    private Type type;
    private Token colon;

    public TypedIdentifier(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public TypedIdentifier(String name) {
        this(new Identifier(name));
    }

    public TypedIdentifier withType(Type type) {
        this.type = type;
        return this;
    }

    public TypedIdentifier withColonToken(Token colon) {
        this.colon = colon;
        return this;
    }

    public Identifier getIdentifier() {
        return name;
    }

    public String getName() {
        return name.getName();
    }

    public void setIdentifier(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Optional<Type> getType() {
        return Optional.ofNullable(type);
    }

    /**
     * @param type The annotation, or null to remove it together with its colon.
     */
    public void setType(Type type) {
        this.type = type;
        if (type == null) {
            colon = null;
        }
    }

    public Optional<Token> getColonToken() {
        return Optional.ofNullable(colon);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(2);
        children.add(name);
        if (type != null) {
            children.add(type);
        }
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
        return visitor.visitTypedIdentifier(this);
    }
}
