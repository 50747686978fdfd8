package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Separators;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Expression;
import org.lunaform.compiler.nodes.expressions.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code a, b.c = 1, 2}
 */
public class AssignStatement implements Statement {

    private final List<Variable> variables = new ArrayList<>();
    private final List<Expression> values = new ArrayList<>();
    private Tokens tokens;

    public AssignStatement(List<? extends Variable> variables, List<? extends Expression> values) {
        this.variables.addAll(variables);
        this.values.addAll(values);
    }

    public static AssignStatement fromVariable(Variable variable, Expression value) {
        return new AssignStatement(List.of(variable), List.of(value));
    }

    public AssignStatement withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<Expression> getValues() {
        return Collections.unmodifiableList(values);
    }

    public void pushVariable(Variable variable) {
        variables.add(variable);
        if (tokens != null) {
            Separators.insertAt(tokens.variableCommas(), variables.size() - 1, variables.size(), ",");
        }
    }

    public Variable removeVariable(int index) {
        Variable removed = variables.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.variableCommas(), index);
        }
        return removed;
    }

    public Variable replaceVariable(int index, Variable variable) {
        return variables.set(index, variable);
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

    public Expression removeValue(int index) {
        Expression removed = values.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.valueCommas(), index);
        }
        return removed;
    }

    public Expression replaceValue(int index, Expression value) {
        return values.set(index, value);
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
            action.accept(tokens.equal());
            tokens.variableCommas().forEach(action);
            tokens.valueCommas().forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAssignStatement(this);
    }

    public record Tokens(Token equal, List<Token> variableCommas, List<Token> valueCommas) {
    }
}
