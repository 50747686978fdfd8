package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code ...T}
 */
public class VariadicTypePack implements FunctionReturnType, TypeParameter, VariadicArgumentType,
        GenericTypePackDefault {

    private Type type;
    private Token ellipsis;

    public VariadicTypePack(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public VariadicTypePack withToken(Token ellipsis) {
        this.ellipsis = ellipsis;
        return this;
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(ellipsis);
    }

    @Override
    public List<Node> children() {
        return List.of(type);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (ellipsis != null) {
            action.accept(ellipsis);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariadicTypePack(this);
    }
}
