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
 * {@code T = Default}
 */
public class TypeVariableWithDefault implements Node {

    private Identifier variable;
    private Type defaultType;
    private Token equal;

    public TypeVariableWithDefault(Identifier variable, Type defaultType) {
        this.variable = Objects.requireNonNull(variable, "variable");
        this.defaultType = Objects.requireNonNull(defaultType, "defaultType");
    }

    public TypeVariableWithDefault withToken(Token equal) {
        this.equal = equal;
        return this;
    }

    public Identifier getTypeVariable() {
        return variable;
    }

    public Type getDefaultType() {
        return defaultType;
    }

    public void setDefaultType(Type defaultType) {
        this.defaultType = Objects.requireNonNull(defaultType, "defaultType");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(equal);
    }

    @Override
    public List<Node> children() {
        return List.of(variable, defaultType);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (equal != null) {
            action.accept(equal);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTypeVariableWithDefault(this);
    }
}
