package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

public class BreakStatement extends TokenNode implements LastStatement {

    public BreakStatement() {
    }

    public BreakStatement(Token token) {
        super(token);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBreakStatement(this);
    }
}
