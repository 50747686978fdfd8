package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

/**
 * The {@code ...} expression, giving the extra arguments of the enclosing variadic function.
 */
public class VariableArgumentsExpression extends TokenNode implements Expression {

    public VariableArgumentsExpression() {
    }

    public VariableArgumentsExpression(Token token) {
        super(token);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariableArgumentsExpression(this);
    }
}
