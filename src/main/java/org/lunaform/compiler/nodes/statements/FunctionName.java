package org.lunaform.compiler.nodes.statements;

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
 * The name of a function statement, {@code module.sub:method}.
 */
public class FunctionName implements Node {

    private Identifier name;
    private final List<Identifier> fieldNames = new ArrayList<>();
    private Identifier method;
    private Tokens tokens;

    public FunctionName(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public FunctionName(String name) {
        this(new Identifier(name));
    }

    public FunctionName withField(Identifier field) {
        fieldNames.add(field);
        return this;
    }

    public FunctionName withMethod(Identifier method) {
        this.method = method;
        return this;
    }

    public FunctionName withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Identifier getName() {
        return name;
    }

    public void setName(Identifier name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * @return the live list of the names after the dots.
     */
    public List<Identifier> getFieldNames() {
        return fieldNames;
    }

    public Optional<Identifier> getMethod() {
        return Optional.ofNullable(method);
    }

    public void setMethod(Identifier method) {
        this.method = method;
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(fieldNames.size() + 2);
        children.add(name);
        children.addAll(fieldNames);
        if (method != null) {
            children.add(method);
        }
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            tokens.periods().forEach(action);
            tokens.colon().ifPresent(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionName(this);
    }

    public record Tokens(List<Token> periods, Optional<Token> colon) {
    }
}
