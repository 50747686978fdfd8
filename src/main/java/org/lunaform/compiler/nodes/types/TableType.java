package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A table type made of named properties and at most one indexer, in source order.
 */
public class TableType implements Type {

    private final List<TableEntryType> entries = new ArrayList<>();
    private Tokens tokens;

    public TableType() {
    }

    public TableType withEntry(TableEntryType entry) {
        entries.add(entry);
        return this;
    }

    public TableType withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    /**
     * @return the live entry list.
     */
    public List<TableEntryType> getEntries() {
        return entries;
    }

    public Optional<TableIndexerType> getIndexer() {
        for (TableEntryType entry : entries) {
            if (entry instanceof TableIndexerType) {
                return Optional.of((TableIndexerType) entry);
            }
        }
        return Optional.empty();
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        return new ArrayList<>(entries);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingBrace());
            action.accept(tokens.closingBrace());
            tokens.separators().forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableType(this);
    }

    public record Tokens(Token openingBrace, Token closingBrace, List<Token> separators) {
    }
}
