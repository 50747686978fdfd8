package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

/**
 * The {@code nil} expression.
 */
public class NilExpression extends TokenNode implements Expression {

    public NilExpression() {
    }

    public NilExpression(Token token) {
        super(token);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNilExpression(this);
    }
}
