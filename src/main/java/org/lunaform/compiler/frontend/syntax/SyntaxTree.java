package org.lunaform.compiler.frontend.syntax;

/**
 * The result of parsing one source unit.
 *
 * @param source The complete source text every span and lexeme points into.
 * @param block The root block.
 * @param endOfFile The end-of-file token, holding the trivia after the last significant token.
 */
public record SyntaxTree(String source, SyntaxBlock block, TokenReference endOfFile) {
}
