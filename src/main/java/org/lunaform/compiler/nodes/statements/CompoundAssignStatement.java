package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Expression;
import org.lunaform.compiler.nodes.expressions.Variable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code counter += 1}
 */
public class CompoundAssignStatement implements Statement {

    private CompoundOperator operator;
    private Variable variable;
    private Expression value;
    private Token token;

    public CompoundAssignStatement(CompoundOperator operator, Variable variable, Expression value) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.variable = Objects.requireNonNull(variable, "variable");
        this.value = Objects.requireNonNull(value, "value");
    }

    public CompoundAssignStatement withToken(Token token) {
        this.token = token;
        return this;
    }

    public CompoundOperator getOperator() {
        return operator;
    }

    public Variable getVariable() {
        return variable;
    }

    public void setVariable(Variable variable) {
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
    }

    @Override
    public List<Node> children() {
        return List.of(variable, value);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (token != null) {
            action.accept(token);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCompoundAssignStatement(this);
    }
}
