package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

public class FalseType extends TokenNode implements Type {

    public FalseType() {
    }

    public FalseType(Token token) {
        super(token);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFalseType(this);
    }
}
