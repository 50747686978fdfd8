package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A parenthesized list of types, {@code (string, number, ...boolean)}, used for multiple return
 * values and pack parameters.
 */
public class TypePack implements FunctionReturnType, TypeParameter, GenericTypePackDefault {

    private final List<Type> types = new ArrayList<>();
    private VariadicArgumentType variadicType;
    private Tokens tokens;

    public TypePack() {
    }

    public TypePack withType(Type type) {
        types.add(type);
        return this;
    }

    public TypePack withVariadicType(VariadicArgumentType variadicType) {
        this.variadicType = variadicType;
        return this;
    }

    public TypePack withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    /**
     * @return the live type list.
     */
    public List<Type> getTypes() {
        return types;
    }

    public Optional<VariadicArgumentType> getVariadicType() {
        return Optional.ofNullable(variadicType);
    }

    public void setVariadicType(VariadicArgumentType variadicType) {
        this.variadicType = variadicType;
    }

    public boolean isEmpty() {
        return types.isEmpty() && variadicType == null;
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(types);
        if (variadicType != null) {
            children.add(variadicType);
        }
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingParenthese());
            action.accept(tokens.closingParenthese());
            tokens.commas().forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTypePack(this);
    }

    public record Tokens(Token openingParenthese, Token closingParenthese, List<Token> commas) {
    }
}
