package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenNode;

public class TrueType extends TokenNode implements Type {

    public TrueType() {
    }

    public TrueType(Token token) {
        super(token);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTrueType(this);
    }
}
