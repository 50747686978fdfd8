package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.FunctionBody;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An anonymous function, {@code function(a, b) ... end}.
 */
public class FunctionExpression implements Expression {

    private FunctionBody body;

    public FunctionExpression(FunctionBody body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    public FunctionBody getBody() {
        return body;
    }

    public void setBody(FunctionBody body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public List<Node> children() {
        return List.of(body);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionExpression(this);
    }
}
