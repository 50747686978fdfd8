package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code field = value} inside a table constructor.
 */
public class TableFieldEntry implements TableEntry {

    private Identifier field;
    private Expression value;
    private Token equal;

    public TableFieldEntry(Identifier field, Expression value) {
        this.field = Objects.requireNonNull(field, "field");
        this.value = Objects.requireNonNull(value, "value");
    }

    public TableFieldEntry withToken(Token equal) {
        this.equal = equal;
        return this;
    }

    public Identifier getField() {
        return field;
    }

    public void setField(Identifier field) {
        this.field = Objects.requireNonNull(field, "field");
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(equal);
    }

    public void setToken(Token equal) {
        this.equal = equal;
    }

    @Override
    public List<Node> children() {
        return List.of(field, value);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (equal != null) {
            action.accept(equal);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableFieldEntry(this);
    }
}
