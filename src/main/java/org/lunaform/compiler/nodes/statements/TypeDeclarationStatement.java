package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.types.GenericParameters;
import org.lunaform.compiler.nodes.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code export type Name<T> = Type}
 */
public class TypeDeclarationStatement implements Statement {

    private Identifier name;
    private Type type;
    private GenericParameters genericParameters;
    private boolean exported;
    private Tokens tokens;

    public TypeDeclarationStatement(Identifier name, Type type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public TypeDeclarationStatement withGenericParameters(GenericParameters genericParameters) {
        this.genericParameters = genericParameters;
        return this;
    }

    public TypeDeclarationStatement export() {
        this.exported = true;
        return this;
    }

    public TypeDeclarationStatement withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Identifier getName() {
        return name;
    }

    public void setName(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public Optional<GenericParameters> getGenericParameters() {
        return Optional.ofNullable(genericParameters);
    }

    public boolean isExported() {
        return exported;
    }

    /**
     * Un-exporting also drops the {@code export} token.
     */
    public void setExported(boolean exported) {
        this.exported = exported;
        if (!exported && tokens != null) {
            tokens = new Tokens(tokens.type(), tokens.equal(), Optional.empty());
        }
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(3);
        children.add(name);
        if (genericParameters != null) {
            children.add(genericParameters);
        }
        children.add(type);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            tokens.export().ifPresent(action);
            action.accept(tokens.type());
            action.accept(tokens.equal());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTypeDeclarationStatement(this);
    }

    public record Tokens(Token type, Token equal, Optional<Token> export) {
    }
}
