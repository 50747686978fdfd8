package org.lunaform.compiler.frontend.syntax;

/**
 * A pair of enclosing tokens, such as parentheses, brackets, braces or angle brackets.
 *
 * @param open The opening token.
 * @param close The closing token.
 */
public record ContainedSpan(TokenReference open, TokenReference close) {
}
