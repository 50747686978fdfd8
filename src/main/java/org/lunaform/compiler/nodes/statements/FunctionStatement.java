package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.FunctionBody;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@code function name.field:method(...) ... end}
 */
public class FunctionStatement implements Statement {

    private FunctionName name;
    private FunctionBody body;

    public FunctionStatement(FunctionName name, FunctionBody body) {
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
    }

    public FunctionName getName() {
        return name;
    }

    public void setName(FunctionName name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public FunctionBody getBody() {
        return body;
    }

    public void setBody(FunctionBody body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public List<Node> children() {
        return List.of(name, body);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionStatement(this);
    }
}
