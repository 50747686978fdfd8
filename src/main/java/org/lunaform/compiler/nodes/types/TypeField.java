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
 * A type exported by a module, {@code Module.Type}.
 */
public class TypeField implements Type {

    private Identifier namespace;
    private TypeName name;
    private Token dot;

    public TypeField(Identifier namespace, TypeName name) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.name = Objects.requireNonNull(name, "name");
    }

    public TypeField withToken(Token dot) {
        this.dot = dot;
        return this;
    }

    public Identifier getNamespace() {
        return namespace;
    }

    public void setNamespace(Identifier namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    public TypeName getTypeName() {
        return name;
    }

    public void setTypeName(TypeName name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(dot);
    }

    @Override
    public List<Node> children() {
        return List.of(namespace, name);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (dot != null) {
            action.accept(dot);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTypeField(this);
    }
}
