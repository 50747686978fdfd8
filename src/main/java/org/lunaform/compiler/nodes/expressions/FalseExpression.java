package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

/**
 * The {@code false} expression.
 */
public class FalseExpression extends TokenNode implements Expression {

    public FalseExpression() {
    }

    public FalseExpression(Token token) {
        super(token);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFalseExpression(this);
    }
}
