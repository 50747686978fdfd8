package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code [KeyType]: ValueType} inside a table type.
 */
public class TableIndexerType implements TableEntryType {

    private Type keyType;
    private Type valueType;
    private Tokens tokens;

    public TableIndexerType(Type keyType, Type valueType) {
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    public TableIndexerType withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Type getKeyType() {
        return keyType;
    }

    public void setKeyType(Type keyType) {
        this.keyType = Objects.requireNonNull(keyType, "keyType");
    }

    public Type getValueType() {
        return valueType;
    }

    public void setValueType(Type valueType) {
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        return List.of(keyType, valueType);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingBracket());
            action.accept(tokens.closingBracket());
            action.accept(tokens.colon());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableIndexerType(this);
    }

    public record Tokens(Token openingBracket, Token closingBracket, Token colon) {
    }
}
