package org.lunaform.compiler.nodes;

import java.util.OptionalInt;

/**
 * Where the text of a token or trivia comes from: a range of the original source, or content
 * owned by the token itself.
 */
public sealed interface TokenPosition {

    /**
     * @param source The original source, only needed for referenced positions.
     * @return the text at this position.
     * @throws IllegalStateException if the position is referenced and no source was given.
     */
    String read(String source);

    OptionalInt getLineNumber();

    TokenPosition shiftLine(int amount);

    /**
     * @param source The original source.
     * @return an owned position with the same text and line.
     */
    Owned toOwned(String source);

    /**
     * A range of the original source. Reading it requires the source to be supplied again.
     *
     * @param start The offset of the first character.
     * @param end The offset after the last character.
     * @param lineNumber The line the range starts on.
     */
    record Referenced(int start, int end, int lineNumber) implements TokenPosition {

        public Referenced {
            if (start > end) {
                throw new IllegalArgumentException("start " + start + " is after end " + end);
            }
        }

        @Override
        public String read(String source) {
            if (source == null) {
                throw new IllegalStateException("a referenced token can only be read from the original source");
            }
            return source.substring(start, end);
        }

        @Override
        public OptionalInt getLineNumber() {
            return OptionalInt.of(lineNumber);
        }

        @Override
        public TokenPosition shiftLine(int amount) {
            return new Referenced(start, end, lineNumber + amount);
        }

        @Override
        public Owned toOwned(String source) {
            return new Owned(read(source), OptionalInt.of(lineNumber));
        }
    }

    /**
     * Literal content, for tokens synthesized by code that injects new nodes.
     *
     * @param content The token text.
     * @param lineNumber The line, when the content was read from a referenced position.
     */
    record Owned(String content, OptionalInt lineNumber) implements TokenPosition {

        @Override
        public String read(String source) {
            return content;
        }

        @Override
        public OptionalInt getLineNumber() {
            return lineNumber;
        }

        @Override
        public TokenPosition shiftLine(int amount) {
            if (lineNumber.isEmpty()) {
                return this;
            }
            return new Owned(content, OptionalInt.of(lineNumber.getAsInt() + amount));
        }

        @Override
        public Owned toOwned(String source) {
            return this;
        }
    }
}
