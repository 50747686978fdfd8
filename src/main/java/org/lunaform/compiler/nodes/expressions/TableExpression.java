package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Separators;
import org.lunaform.compiler.nodes.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A table constructor. Separators may be commas or semicolons, and there may be one trailing
 * separator, so the separator list holds either one entry less than the entries or as many.
 */
public class TableExpression implements Expression, Arguments {

    private final List<TableEntry> entries = new ArrayList<>();
    private Tokens tokens;

    public TableExpression() {
    }

    public TableExpression(List<? extends TableEntry> entries) {
        this.entries.addAll(entries);
    }

    public TableExpression withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public TableExpression withEntry(TableEntry entry) {
        pushEntry(entry);
        return this;
    }

    public List<TableEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void pushEntry(TableEntry entry) {
        insertEntry(entries.size(), entry);
    }

    public void insertEntry(int index, TableEntry entry) {
        int position = Math.min(index, entries.size());
        entries.add(position, entry);
        if (tokens != null) {
            Separators.insertAt(tokens.separators(), position, entries.size(), ",");
        }
    }

    public TableEntry replaceEntry(int index, TableEntry entry) {
        return entries.set(index, entry);
    }

    public TableEntry removeEntry(int index) {
        TableEntry removed = entries.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.separators(), index);
        }
        return removed;
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
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
        return visitor.visitTableExpression(this);
    }

    public record Tokens(Token openingBrace, Token closingBrace, List<Token> separators) {
    }
}
