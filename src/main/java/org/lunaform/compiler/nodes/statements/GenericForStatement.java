package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Separators;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TypedIdentifier;
import org.lunaform.compiler.nodes.expressions.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code for key, value in pairs(t) do ... end}
 */
public class GenericForStatement implements Statement {

    private final List<TypedIdentifier> identifiers = new ArrayList<>();
    private final List<Expression> expressions = new ArrayList<>();
    private Block block;
    private Tokens tokens;

    public GenericForStatement(List<TypedIdentifier> identifiers, List<? extends Expression> expressions, Block block) {
        this.identifiers.addAll(identifiers);
        this.expressions.addAll(expressions);
        this.block = Objects.requireNonNull(block, "block");
    }

    public GenericForStatement withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public List<TypedIdentifier> getIdentifiers() {
        return Collections.unmodifiableList(identifiers);
    }

    public void pushIdentifier(TypedIdentifier identifier) {
        identifiers.add(identifier);
        if (tokens != null) {
            Separators.insertAt(tokens.identifierCommas(), identifiers.size() - 1, identifiers.size(), ",");
        }
    }

    public TypedIdentifier removeIdentifier(int index) {
        TypedIdentifier removed = identifiers.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.identifierCommas(), index);
        }
        return removed;
    }

    public List<Expression> getExpressions() {
        return Collections.unmodifiableList(expressions);
    }

    public void pushExpression(Expression expression) {
        expressions.add(expression);
        if (tokens != null) {
            Separators.insertAt(tokens.valueCommas(), expressions.size() - 1, expressions.size(), ",");
        }
    }

    public Expression replaceExpression(int index, Expression expression) {
        return expressions.set(index, expression);
    }

    public Expression removeExpression(int index) {
        Expression removed = expressions.remove(index);
        if (tokens != null) {
            Separators.removeAt(tokens.valueCommas(), index);
        }
        return removed;
    }

    public Block getBlock() {
        return block;
    }

    public void setBlock(Block block) {
        this.block = Objects.requireNonNull(block, "block");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(identifiers.size() + expressions.size() + 1);
        children.addAll(identifiers);
        children.addAll(expressions);
        children.add(block);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.forToken());
            action.accept(tokens.in());
            action.accept(tokens.doToken());
            action.accept(tokens.end());
            tokens.identifierCommas().forEach(action);
            tokens.valueCommas().forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGenericForStatement(this);
    }

    public record Tokens(Token forToken, Token in, Token doToken, Token end,
                         List<Token> identifierCommas, List<Token> valueCommas) {
    }
}
