package org.lunaform.compiler.nodes;

import org.lunaform.compiler.nodes.types.FunctionReturnType;
import org.lunaform.compiler.nodes.types.FunctionVariadicType;
import org.lunaform.compiler.nodes.types.GenericParameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The part shared by function statements, local functions and function expressions: generic
 * parameters, parameters, return type and body block.
 * <p>
 * The parameter comma list covers the named parameters plus the trailing {@code ...} and is kept
 * in sync by the mutating methods.
 */
public class FunctionBody implements Node {

    private Block block;
    private final List<TypedIdentifier> parameters = new ArrayList<>();
    private boolean variadic;
    private FunctionVariadicType variadicType;
    private FunctionReturnType returnType;
    private GenericParameters genericParameters;
    private Tokens tokens;

    public FunctionBody(Block block) {
        this.block = Objects.requireNonNull(block, "block");
    }

    public FunctionBody(Block block, List<TypedIdentifier> parameters, boolean variadic) {
        this(block);
        this.parameters.addAll(parameters);
        this.variadic = variadic;
    }

    public FunctionBody withParameter(TypedIdentifier parameter) {
        pushParameter(parameter);
        return this;
    }

    public FunctionBody variadic() {
        this.variadic = true;
        return this;
    }

    public FunctionBody withVariadicType(FunctionVariadicType type) {
        this.variadic = true;
        this.variadicType = type;
        return this;
    }

    public FunctionBody withReturnType(FunctionReturnType returnType) {
        this.returnType = returnType;
        return this;
    }

    public FunctionBody withGenericParameters(GenericParameters genericParameters) {
        this.genericParameters = genericParameters;
        return this;
    }

    public FunctionBody withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Block getBlock() {
        return block;
    }

    public void setBlock(Block block) {
        this.block = Objects.requireNonNull(block, "block");
    }

    public List<TypedIdentifier> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public int parametersCount() {
        return parameters.size();
    }

    public void pushParameter(TypedIdentifier parameter) {
        insertParameter(parameters.size(), parameter);
    }

    public void insertParameter(int index, TypedIdentifier parameter) {
        int position = Math.min(index, parameters.size());
        parameters.add(position, parameter);
        if (tokens != null) {
            Separators.insertAt(tokens.parameterCommas(), position, separatedCount(), ",");
        }
    }

    public TypedIdentifier removeParameter(int index) {
        TypedIdentifier removed = parameters.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.parameterCommas(), index);
        }
        return removed;
    }

    public boolean isVariadic() {
        return variadic;
    }

    /**
     * @param variadic Whether the function ends with {@code ...}. Removing it also removes its type.
     */
    public void setVariadic(boolean variadic) {
        if (this.variadic == variadic) {
            return;
        }
        this.variadic = variadic;
        if (!variadic) {
            variadicType = null;
            if (tokens != null) {
                Separators.removeAt(tokens.parameterCommas(), parameters.size());
                tokens = tokens.withoutVariableArguments();
            }
        } else if (tokens != null) {
            Separators.insertAt(tokens.parameterCommas(), parameters.size(), separatedCount(), ",");
        }
    }

    public Optional<FunctionVariadicType> getVariadicType() {
        return Optional.ofNullable(variadicType);
    }

    public void setVariadicType(FunctionVariadicType variadicType) {
        this.variadicType = variadicType;
    }

    public Optional<FunctionReturnType> getReturnType() {
        return Optional.ofNullable(returnType);
    }

    public void setReturnType(FunctionReturnType returnType) {
        this.returnType = returnType;
    }

    public Optional<GenericParameters> getGenericParameters() {
        return Optional.ofNullable(genericParameters);
    }

    public void setGenericParameters(GenericParameters genericParameters) {
        this.genericParameters = genericParameters;
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    private int separatedCount() {
        return parameters.size() + (variadic ? 1 : 0);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(parameters.size() + 4);
        if (genericParameters != null) {
            children.add(genericParameters);
        }
        children.addAll(parameters);
        if (variadicType != null) {
            children.add(variadicType);
        }
        if (returnType != null) {
            children.add(returnType);
        }
        children.add(block);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            tokens.forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionBody(this);
    }

    /**
     * @param function The {@code function} keyword.
     * @param variableArguments The {@code ...} of a variadic function.
     * @param variableArgumentsColon The colon before the type of {@code ...}.
     * @param returnTypeColon The colon before the return type.
     */
    public record Tokens(Token function,
                         Token openingParenthese,
                         Token closingParenthese,
                         Token end,
                         List<Token> parameterCommas,
                         Optional<Token> variableArguments,
                         Optional<Token> variableArgumentsColon,
                         Optional<Token> returnTypeColon) {

        Tokens withoutVariableArguments() {
            return new Tokens(function, openingParenthese, closingParenthese, end, parameterCommas,
                    Optional.empty(), Optional.empty(), returnTypeColon);
        }

        void forEach(Consumer<Token> action) {
            action.accept(function);
            action.accept(openingParenthese);
            action.accept(closingParenthese);
            action.accept(end);
            parameterCommas.forEach(action);
            variableArguments.ifPresent(action);
            variableArgumentsColon.ifPresent(action);
            returnTypeColon.ifPresent(action);
        }
    }
}
