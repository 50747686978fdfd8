package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.expressions.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@code if a then ... elseif b then ... else ... end}. There is always at least one branch.
 */
public class IfStatement implements Statement {

    private final List<IfBranch> branches = new ArrayList<>();
    private Block elseBlock;
    private Tokens tokens;

    public IfStatement(List<IfBranch> branches, Block elseBlock) {
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("an if statement needs at least one branch");
        }
        this.branches.addAll(branches);
        this.elseBlock = elseBlock;
    }

    public static IfStatement create(Expression condition, Block block) {
        return new IfStatement(List.of(new IfBranch(condition, block)), null);
    }

    public IfStatement withBranch(Expression condition, Block block) {
        branches.add(new IfBranch(condition, block));
        return this;
    }

    public IfStatement withElseBlock(Block elseBlock) {
        this.elseBlock = elseBlock;
        return this;
    }

    public IfStatement withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    /**
     * @return the live branch list. It must not be left empty.
     */
    public List<IfBranch> getBranches() {
        return branches;
    }

    public Optional<Block> getElseBlock() {
        return Optional.ofNullable(elseBlock);
    }

    /**
     * @param elseBlock The else block, or null to remove it together with its token.
     */
    public void setElseBlock(Block elseBlock) {
        this.elseBlock = elseBlock;
        if (elseBlock == null && tokens != null) {
            tokens = new Tokens(tokens.ifToken(), tokens.then(), tokens.end(), Optional.empty());
        }
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(branches);
        if (elseBlock != null) {
            children.add(elseBlock);
        }
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.ifToken());
            action.accept(tokens.then());
            action.accept(tokens.end());
            tokens.elseToken().ifPresent(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }

    public record Tokens(Token ifToken, Token then, Token end, Optional<Token> elseToken) {
    }
}
