package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Identifier;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code T...}
 */
public class GenericTypePack implements FunctionReturnType, TypeParameter, FunctionVariadicType,
        VariadicArgumentType, GenericTypePackDefault {

    private Identifier name;
    private Token ellipsis;

    public GenericTypePack(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public GenericTypePack(String name) {
        this(new Identifier(name));
    }

    public GenericTypePack withToken(Token ellipsis) {
        this.ellipsis = ellipsis;
        return this;
    }

    public Identifier getName() {
        return name;
    }

    public void setName(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(ellipsis);
    }

    @Override
    public List<Node> children() {
        return List.of(name);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (ellipsis != null) {
            action.accept(ellipsis);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGenericTypePack(this);
    }
}
