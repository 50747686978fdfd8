package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.FunctionBody;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Identifier;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code local function name(...) ... end}
 */
public class LocalFunctionStatement implements Statement {

    private Identifier name;
    private FunctionBody body;
    private Token local;

    public LocalFunctionStatement(Identifier name, FunctionBody body) {
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
    }

    public LocalFunctionStatement withLocalToken(Token local) {
        this.local = local;
        return this;
    }

    public Identifier getIdentifier() {
        return name;
    }

    public String getName() {
        return name.getName();
    }

    public void setIdentifier(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public FunctionBody getBody() {
        return body;
    }

    public void setBody(FunctionBody body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    public Optional<Token> getLocalToken() {
        return Optional.ofNullable(local);
    }

    @Override
    public List<Node> children() {
        return List.of(name, body);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (local != null) {
            action.accept(local);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLocalFunctionStatement(this);
    }
}
