package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code <T>(a: T, ...string) -> R}
 */
public class FunctionType implements Type {

    private final List<FunctionArgumentType> arguments = new ArrayList<>();
    private VariadicArgumentType variadicArgumentType;
    private FunctionReturnType returnType;
    private GenericParameters genericParameters;
    private Tokens tokens;

    public FunctionType(FunctionReturnType returnType) {
        this.returnType = Objects.requireNonNull(returnType, "returnType");
    }

    public FunctionType withArgument(FunctionArgumentType argument) {
        arguments.add(argument);
        return this;
    }

    public FunctionType withVariadicArgumentType(VariadicArgumentType type) {
        this.variadicArgumentType = type;
        return this;
    }

    public FunctionType withGenericParameters(GenericParameters genericParameters) {
        this.genericParameters = genericParameters;
        return this;
    }

    public FunctionType withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    /**
     * @return the live argument list.
     */
    public List<FunctionArgumentType> getArguments() {
        return arguments;
    }

    public Optional<VariadicArgumentType> getVariadicArgumentType() {
        return Optional.ofNullable(variadicArgumentType);
    }

    public void setVariadicArgumentType(VariadicArgumentType variadicArgumentType) {
        this.variadicArgumentType = variadicArgumentType;
    }

    public FunctionReturnType getReturnType() {
        return returnType;
    }

    public void setReturnType(FunctionReturnType returnType) {
        this.returnType = Objects.requireNonNull(returnType, "returnType");
    }

    public Optional<GenericParameters> getGenericParameters() {
        return Optional.ofNullable(genericParameters);
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(arguments.size() + 3);
        if (genericParameters != null) {
            children.add(genericParameters);
        }
        children.addAll(arguments);
        if (variadicArgumentType != null) {
            children.add(variadicArgumentType);
        }
        children.add(returnType);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingParenthese());
            action.accept(tokens.closingParenthese());
            action.accept(tokens.arrow());
            tokens.commas().forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionType(this);
    }

    /**
     * @param commas The commas between arguments, including the one before the variadic argument.
     */
    public record Tokens(Token openingParenthese, Token closingParenthese, Token arrow, List<Token> commas) {
    }
}
