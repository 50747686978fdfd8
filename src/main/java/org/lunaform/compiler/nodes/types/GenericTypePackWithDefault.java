package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code T... = Default}
 */
public class GenericTypePackWithDefault implements Node {

    private GenericTypePack genericTypePack;
    private GenericTypePackDefault defaultType;
    private Token equal;

    public GenericTypePackWithDefault(GenericTypePack genericTypePack, GenericTypePackDefault defaultType) {
        this.genericTypePack = Objects.requireNonNull(genericTypePack, "genericTypePack");
        this.defaultType = Objects.requireNonNull(defaultType, "defaultType");
    }

    public GenericTypePackWithDefault withToken(Token equal) {
        this.equal = equal;
        return this;
    }

    public GenericTypePack getGenericTypePack() {
        return genericTypePack;
    }

    public GenericTypePackDefault getDefaultType() {
        return defaultType;
    }

    public void setDefaultType(GenericTypePackDefault defaultType) {
        this.defaultType = Objects.requireNonNull(defaultType, "defaultType");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(equal);
    }

    @Override
    public List<Node> children() {
        return List.of(genericTypePack, defaultType);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (equal != null) {
            action.accept(equal);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGenericTypePackWithDefault(this);
    }
}
