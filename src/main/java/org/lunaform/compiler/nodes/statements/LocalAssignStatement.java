package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Separators;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TypedIdentifier;
import org.lunaform.compiler.nodes.expressions.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code local a, b = 1, 2}. There may be no value at all, in which case there is no equal token.
 */
public class LocalAssignStatement implements Statement {

    private final List<TypedIdentifier> variables = new ArrayList<>();
    private final List<Expression> values = new ArrayList<>();
    private Tokens tokens;

    public LocalAssignStatement(List<TypedIdentifier> variables, List<? extends Expression> values) {
        this.variables.addAll(variables);
        this.values.addAll(values);
    }

    public static LocalAssignStatement fromVariable(String name) {
        return new LocalAssignStatement(List.of(new TypedIdentifier(name)), List.of());
    }

    public LocalAssignStatement withValue(Expression value) {
        pushValue(value);
        return this;
    }

    public LocalAssignStatement withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public List<TypedIdentifier> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public void pushVariable(TypedIdentifier variable) {
        variables.add(variable);
        if (tokens != null) {
            Separators.insertAt(tokens.variableCommas(), variables.size() - 1, variables.size(), ",");
        }
    }

    public TypedIdentifier removeVariable(int index) {
        TypedIdentifier removed = variables.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.variableCommas(), index);
        }
        return removed;
    }

    public List<Expression> getValues() {
        return Collections.unmodifiableList(values);
    }

    public void pushValue(Expression value) {
        insertValue(values.size(), value);
    }

    public void insertValue(int index, Expression value) {
        int position = Math.min(index, values.size());
        values.add(position, value);
        if (tokens != null) {
            Separators.insertAt(tokens.valueCommas(), position, values.size(), ",");
        }
    }

    public Expression replaceValue(int index, Expression value) {
        return values.set(index, value);
    }

    /**
     * Removes a value. Removing the last value also drops the equal token.
     */
    public Expression removeValue(int index) {
        Expression removed = values.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.valueCommas(), index);
            if (values.isEmpty()) {
                tokens = new Tokens(tokens.local(), Optional.empty(), tokens.variableCommas(), tokens.valueCommas());
            }
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
        List<Node> children = new ArrayList<>(variables.size() + values.size());
        children.addAll(variables);
        children.addAll(values);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.local());
            tokens.equal().ifPresent(action);
            tokens.variableCommas().forEach(action);
            tokens.valueCommas().forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLocalAssignStatement(this);
    }

    public record Tokens(Token local, Optional<Token> equal, List<Token> variableCommas, List<Token> valueCommas) {
    }
}
