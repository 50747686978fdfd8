package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code [key] = value} inside a table constructor.
 */
public class TableIndexEntry implements TableEntry {

    private Expression key;
    private Expression value;
    private Tokens tokens;

    public TableIndexEntry(Expression key, Expression value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    public TableIndexEntry withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Expression getKey() {
        return key;
    }

    public void setKey(Expression key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public List<Node> children() {
        return List.of(key, value);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingBracket());
            action.accept(tokens.closingBracket());
            action.accept(tokens.equal());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableIndexEntry(this);
    }

    public record Tokens(Token openingBracket, Token closingBracket, Token equal) {
    }
}
