package org.lunaform.compiler.frontend.lexer;

/**
 * A single lexeme extracted from the source code by the {@link Lexer}.
 *
 * @param type The kind of the lexeme.
 * @param text The exact text of the lexeme.
 * @param start The offset of the first character in the source string.
 * @param end The offset after the last character in the source string.
 * @param line The 1-based line the lexeme starts on.
 */
public record Lexeme(
        TokenType type,
        String text,
        int start,
        int end,
        int line
) {
    /**
     * @return the number of line breaks contained in the lexeme text.
     */
    public int lineBreaks() {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
