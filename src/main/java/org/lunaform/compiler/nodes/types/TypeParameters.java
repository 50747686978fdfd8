package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The angle bracketed parameters of a {@link TypeName}.
 */
public class TypeParameters implements Node {

    private final List<TypeParameter> parameters = new ArrayList<>();
    private Tokens tokens;

    public TypeParameters() {
    }

    public TypeParameters(List<? extends TypeParameter> parameters) {
        this.parameters.addAll(parameters);
    }

    public TypeParameters withParameter(TypeParameter parameter) {
        parameters.add(parameter);
        return this;
    }

    public TypeParameters withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    /**
     * @return the live parameter list.
     */
    public List<TypeParameter> getParameters() {
        return parameters;
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        return new ArrayList<>(parameters);
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
        return visitor.visitTypeParameters(this);
    }

    public record Tokens(Token opening, Token closing, List<Token> commas) {
    }
}
