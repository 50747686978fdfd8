package org.lunaform.compiler.frontend.syntax;

/**
 * A half-open range {@code [start, end)} of offsets into the parsed source string.
 *
 * @param start The offset of the first character.
 * @param end The offset after the last character.
 */
public record Span(int start, int end) {

    /**
     * @param source The source the span points into.
     * @return the covered text.
     */
    public String read(String source) {
        return source.substring(start, end);
    }
}
