package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TypedIdentifier;
import org.lunaform.compiler.nodes.expressions.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code for i = start, end, step do ... end}
 */
public class NumericForStatement implements Statement {

    private TypedIdentifier identifier;
    private Expression start;
    private Expression end;
    private Expression step;
    private Block block;
    private Tokens tokens;

    public NumericForStatement(TypedIdentifier identifier, Expression start, Expression end, Expression step, Block block) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.step = step;
        this.block = Objects.requireNonNull(block, "block");
    }

    public NumericForStatement withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public TypedIdentifier getIdentifier() {
        return identifier;
    }

    public void setIdentifier(TypedIdentifier identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
    }

    public Expression getStart() {
        return start;
    }

    public void setStart(Expression start) {
        this.start = Objects.requireNonNull(start, "start");
    }

    public Expression getEnd() {
        return end;
    }

    public void setEnd(Expression end) {
        this.end = Objects.requireNonNull(end, "end");
    }

    public Optional<Expression> getStep() {
        return Optional.ofNullable(step);
    }

    /**
     * @param step The step, or null to remove it together with its comma.
     */
    public void setStep(Expression step) {
        this.step = step;
        if (step == null && tokens != null) {
            tokens = new Tokens(tokens.forToken(), tokens.equal(), tokens.endComma(), Optional.empty(),
                    tokens.doToken(), tokens.end());
        }
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
        List<Node> children = new ArrayList<>(5);
        children.add(identifier);
        children.add(start);
        children.add(end);
        if (step != null) {
            children.add(step);
        }
        children.add(block);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.forToken());
            action.accept(tokens.equal());
            action.accept(tokens.endComma());
            tokens.stepComma().ifPresent(action);
            action.accept(tokens.doToken());
            action.accept(tokens.end());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumericForStatement(this);
    }

    public record Tokens(Token forToken, Token equal, Token endComma, Optional<Token> stepComma, Token doToken, Token end) {
    }
}
