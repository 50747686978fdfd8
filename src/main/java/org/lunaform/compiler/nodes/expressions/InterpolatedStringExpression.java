package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A Luau interpolated string, {@code `hello {name}!`}, made of alternating string and value
 * segments.
 */
public class InterpolatedStringExpression implements Expression {

    private final List<InterpolationSegment> segments = new ArrayList<>();
    private Tokens tokens;

    public InterpolatedStringExpression() {
    }

    public InterpolatedStringExpression(List<? extends InterpolationSegment> segments) {
        this.segments.addAll(segments);
    }

    public InterpolatedStringExpression withSegment(InterpolationSegment segment) {
        segments.add(segment);
        return this;
    }

    public InterpolatedStringExpression withTokens(Tokens tokens) {
        this.tokens = tokens;
        return this;
    }

    /**
     * @return the live segment list.
     */
    public List<InterpolationSegment> getSegments() {
        return segments;
    }

    public Optional<Tokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public List<Node> children() {
        return new ArrayList<>(segments);
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            action.accept(tokens.openingTick());
            action.accept(tokens.closingTick());
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInterpolatedStringExpression(this);
    }

    public record Tokens(Token openingTick, Token closingTick) {
    }
}
