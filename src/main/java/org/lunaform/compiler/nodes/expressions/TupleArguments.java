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
 * Parenthesized call arguments. The comma list is kept in sync with the values.
 */
public class TupleArguments implements Arguments {

    private final List<Expression> values = new ArrayList<>();
    private Tokens tokens;

    public TupleArguments() {
    }

    public TupleArguments(List<? extends Expression> values) {
        this.values.addAll(values);
    }

    public TupleArguments withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public List<Expression> getValues() {
        return Collections.unmodifiableList(values);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void pushValue(Expression value) {
        insertValue(values.size(), value);
    }

    public void insertValue(int index, Expression value) {
        int position = Math.min(index, values.size());
        values.add(position, value);
        if (tokens != null) {
            Separators.insertAt(tokens.commas(), position, values.size(), ",");
        }
    }

    public Expression replaceValue(int index, Expression value) {
        return values.set(index, value);
    }

    public Expression removeValue(int index) {
        Expression removed = values.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.commas(), index);
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
        return new ArrayList<>(values);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingParenthese());
            action.accept(tokens.closingParenthese());
            tokens.commas().forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTupleArguments(this);
    }

    public record Tokens(Token openingParenthese, Token closingParenthese, List<Token> commas) {
    }
}
