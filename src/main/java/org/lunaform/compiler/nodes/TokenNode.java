package org.lunaform.compiler.nodes;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Base class for leaf nodes made of a single keyword or symbol, like {@code nil} or {@code break}.
 */
public abstract class TokenNode implements Node {

    private Token token;

    protected TokenNode() {
    }

    protected TokenNode(Token token) {
        this.token = token;
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
    }

    public void setToken(Token token) {
        this.token = token;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (token != null) {
            action.accept(token);
        }
    }
}
