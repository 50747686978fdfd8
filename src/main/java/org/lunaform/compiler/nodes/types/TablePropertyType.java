package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Identifier;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code name: Type} inside a table type.
 */
public class TablePropertyType implements TableEntryType {

    private Identifier property;
    private Type type;
    private Token colon;

    public TablePropertyType(Identifier property, Type type) {
        this.property = Objects.requireNonNull(property, "property");
        this.type = Objects.requireNonNull(type, "type");
    }

    public TablePropertyType withToken(Token colon) {
        this.colon = colon;
        return this;
    }

    public Identifier getProperty() {
        return property;
    }

    public void setProperty(Identifier property) {
        this.property = Objects.requireNonNull(property, "property");
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(colon);
    }

    @Override
    public List<Node> children() {
        return List.of(property, type);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (colon != null) {
            action.accept(colon);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTablePropertyType(this);
    }
}
