package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A condition and its block inside an {@link IfStatement}. The tokens are only set for
 * {@code elseif} branches: the first branch uses the tokens of the statement.
 */
public class IfBranch implements Node {

    private Expression condition;
    private Block block;
    private Tokens tokens;

    public IfBranch(Expression condition, Block block) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.block = Objects.requireNonNull(block, "block");
    }

    public IfBranch withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
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
        return List.of(condition, block);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.elseIf());
            action.accept(tokens.then());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIfBranch(this);
    }

    public record Tokens(Token elseIf, Token then) {
    }
}
