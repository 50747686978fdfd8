package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Identifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The generic parameters of a function or a type declaration, {@code <T, U = string, V...>}.
 * <p>
 * Parameters are stored by group and written back in group order: type variables, type variables
 * with a default, generic packs, then generic packs with a default. Defaults are only valid on
 * type declarations.
 */
public class GenericParameters implements Node {

    private final List<Identifier> typeVariables = new ArrayList<>();
    private final List<TypeVariableWithDefault> typeVariablesWithDefault = new ArrayList<>();
    private final List<GenericTypePack> genericTypePacks = new ArrayList<>();
    private final List<GenericTypePackWithDefault> genericTypePacksWithDefault = new ArrayList<>();
    private Tokens tokens;

    public GenericParameters withTypeVariable(Identifier variable) {
        typeVariables.add(variable);
        return this;
    }

    public GenericParameters withTypeVariableWithDefault(TypeVariableWithDefault variable) {
        typeVariablesWithDefault.add(variable);
        return this;
    }

    public GenericParameters withGenericTypePack(GenericTypePack pack) {
        genericTypePacks.add(pack);
        return this;
    }

    public GenericParameters withGenericTypePackWithDefault(GenericTypePackWithDefault pack) {
        genericTypePacksWithDefault.add(pack);
        return this;
    }

    public GenericParameters withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public List<Identifier> getTypeVariables() {
        return typeVariables;
    }

    public List<TypeVariableWithDefault> getTypeVariablesWithDefault() {
        return typeVariablesWithDefault;
    }

    public List<GenericTypePack> getGenericTypePacks() {
        return genericTypePacks;
    }

    public List<GenericTypePackWithDefault> getGenericTypePacksWithDefault() {
        return genericTypePacksWithDefault;
    }

    public int size() {
        return typeVariables.size() + typeVariablesWithDefault.size()
                + genericTypePacks.size() + genericTypePacksWithDefault.size();
    }

    public boolean hasDefaults() {
        return !typeVariablesWithDefault.isEmpty() || !genericTypePacksWithDefault.isEmpty();
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    /**
     * @return every parameter in the order it is written.
     */
    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(size());
        children.addAll(typeVariables);
        children.addAll(typeVariablesWithDefault);
        children.addAll(genericTypePacks);
        children.addAll(genericTypePacksWithDefault);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.opening());
            action.accept(tokens.closing());
            tokens.commas().forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGenericParameters(this);
    }

    public record Tokens(Token opening, Token closing, List<Token> commas) {
    }
}
