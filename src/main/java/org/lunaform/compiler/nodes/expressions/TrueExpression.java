package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

/**
 * The {@code true} expression.
 */
public class TrueExpression extends TokenNode implements Expression {

    public TrueExpression() {
    }

    public TrueExpression(Token token) {
        super(token);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTrueExpression(this);
    }
}
