package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

public class DoStatement implements Statement {

    private Block block;
    private Tokens tokens;

    public DoStatement(Block block) {
        this.block = Objects.requireNonNull(block, "block");
    }

    public DoStatement withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
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
        return List.of(block);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.doToken());
            action.accept(tokens.end());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDoStatement(this);
    }

    public record Tokens(Token doToken, Token end) {
    }
}
