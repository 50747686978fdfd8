package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A positional table entry.
 */
public class TableValueEntry implements TableEntry {

    private Expression value;

    public TableValueEntry(Expression value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public List<Node> children() {
        return List.of(value);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableValueEntry(this);
    }
}
