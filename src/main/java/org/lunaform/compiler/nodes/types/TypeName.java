package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Identifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A named type, optionally generic: {@code number}, {@code Map<string, T>}.
 */
public class TypeName implements Type {

    private Identifier name;
    private TypeParameters parameters;

    public TypeName(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public TypeName(String name) {
        this(new Identifier(name));
    }

    public TypeName withParameters(TypeParameters parameters) {
        this.parameters = parameters;
        return this;
    }

    public Identifier getTypeName() {
        return name;
    }

    public void setTypeName(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Optional<TypeParameters> getParameters() {
        return Optional.ofNullable(parameters);
    }

    public void setParameters(TypeParameters parameters) {
        this.parameters = parameters;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(2);
        children.add(name);
        if (parameters != null) {
            children.add(parameters);
        }
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTypeName(this);
    }
}
