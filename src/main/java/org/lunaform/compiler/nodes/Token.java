package org.lunaform.compiler.nodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Predicate;

/**
 * The source fidelity data of one lexical unit: where its text comes from plus the ordered
 * trivia before and after it.
 * <p>
 * A token is owned by exactly one node and its trivia by exactly one token. Trivia order is
 * source order and none of the operations below reorder it.
 */
public final class Token {

    private TokenPosition position;
    private final List<Trivia> leadingTrivia = new ArrayList<>();
    private final List<Trivia> trailingTrivia = new ArrayList<>();

    private Token(TokenPosition position) {
        this.position = position;
    }

    /**
     * Creates a token referencing a range of the original source.
     * @param start The offset of the first character.
     * @param end The offset after the last character.
     * @param line The line the token starts on.
     * @return the new token.
     */
    public static Token fromPosition(int start, int end, int line) {
        return new Token(new TokenPosition.Referenced(start, end, line));
    }

    /**
     * Creates a self-contained token, e.g. {@code Token.fromContent("end")}.
     * @param content The token text.
     * @return the new token.
     */
    public static Token fromContent(String content) {
        return new Token(new TokenPosition.Owned(content, OptionalInt.empty()));
    }

    public Token withLeadingTrivia(Trivia trivia) {
        leadingTrivia.add(trivia);
        return this;
    }

    public Token withTrailingTrivia(Trivia trivia) {
        trailingTrivia.add(trivia);
        return this;
    }

    public void pushLeadingTrivia(Trivia trivia) {
        leadingTrivia.add(trivia);
    }

    public void pushTrailingTrivia(Trivia trivia) {
        trailingTrivia.add(trivia);
    }

    public TokenPosition getPosition() {
        return position;
    }

    public boolean isReferenced() {
        return position instanceof TokenPosition.Referenced;
    }

    /**
     * @param source The original source, only needed while the token is referenced.
     * @return the token text, without trivia.
     */
    public String read(String source) {
        return position.read(source);
    }

    public OptionalInt getLineNumber() {
        return position.getLineNumber();
    }

    public List<Trivia> getLeadingTrivia() {
        return Collections.unmodifiableList(leadingTrivia);
    }

    public List<Trivia> getTrailingTrivia() {
        return Collections.unmodifiableList(trailingTrivia);
    }

    public boolean hasTrivia() {
        return !leadingTrivia.isEmpty() || !trailingTrivia.isEmpty();
    }

    public void clearComments() {
        leadingTrivia.removeIf(Trivia::isComment);
        trailingTrivia.removeIf(Trivia::isComment);
    }

    public void clearWhitespaces() {
        leadingTrivia.removeIf(Trivia::isWhitespace);
        trailingTrivia.removeIf(Trivia::isWhitespace);
    }

    /**
     * Removes the comments rejected by the filter. Whitespace is left untouched.
     * @param keep Returns true for the comments to keep.
     */
    public void filterComments(Predicate<Trivia> keep) {
        leadingTrivia.removeIf(trivia -> trivia.isComment() && !keep.test(trivia));
        trailingTrivia.removeIf(trivia -> trivia.isComment() && !keep.test(trivia));
    }

    /**
     * Turns the token and its trivia into owned content, so it no longer needs the source.
     * @param source The original source.
     */
    public void replaceReferencedTokens(String source) {
        position = position.toOwned(source);
        leadingTrivia.replaceAll(trivia -> trivia.toOwned(source));
        trailingTrivia.replaceAll(trivia -> trivia.toOwned(source));
    }

    /**
     * Adds {@code amount} to the line of the token and of its trivia. Offsets are not touched.
     * @param amount The number of lines to shift by, may be negative.
     */
    public void shiftTokenLine(int amount) {
        position = position.shiftLine(amount);
        leadingTrivia.replaceAll(trivia -> trivia.shiftLine(amount));
        trailingTrivia.replaceAll(trivia -> trivia.shiftLine(amount));
    }
}
