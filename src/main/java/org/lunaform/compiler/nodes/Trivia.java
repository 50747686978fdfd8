package org.lunaform.compiler.nodes;

import java.util.OptionalInt;

/**
 * Non-semantic source text attached to a {@link Token}.
 *
 * @param kind Whether this is a comment or whitespace.
 * @param position Where the text comes from.
 */
public record Trivia(TriviaKind kind, TokenPosition position) {

    public static Trivia whitespace(String content) {
        return new Trivia(TriviaKind.WHITESPACE, new TokenPosition.Owned(content, OptionalInt.empty()));
    }

    public static Trivia comment(String content) {
        return new Trivia(TriviaKind.COMMENT, new TokenPosition.Owned(content, OptionalInt.empty()));
    }

    /**
     * @param source The original source, only needed for referenced trivia.
     * @return the trivia text.
     */
    public String read(String source) {
        return position.read(source);
    }

    public OptionalInt getLineNumber() {
        return position.getLineNumber();
    }

    public boolean isComment() {
        return kind == TriviaKind.COMMENT;
    }

    public boolean isWhitespace() {
        return kind == TriviaKind.WHITESPACE;
    }

    Trivia shiftLine(int amount) {
        return new Trivia(kind, position.shiftLine(amount));
    }

    Trivia toOwned(String source) {
        return new Trivia(kind, position.toOwned(source));
    }
}
