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
 * {@code repeat ... until condition}. The condition can see the locals of the block.
 */
public class RepeatStatement implements Statement {

    private Block block;
    private Expression condition;
    private Tokens tokens;

    public RepeatStatement(Block block, Expression condition) {
        this.block = Objects.requireNonNull(block, "block");
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public RepeatStatement withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Block getBlock() {
        return block;
    }

    public void setBlock(Block block) {
        this.block = Objects.requireNonNull(block, "block");
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        return List.of(block, condition);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.repeat());
            action.accept(tokens.until());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRepeatStatement(this);
    }

    public record Tokens(Token repeat, Token until) {
    }
}
