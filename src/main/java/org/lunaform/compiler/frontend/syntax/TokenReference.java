package org.lunaform.compiler.frontend.syntax;

import org.lunaform.compiler.frontend.lexer.Lexeme;
import org.lunaform.compiler.frontend.lexer.TokenType;

import java.util.List;

/**
 * A significant lexeme together with the trivia attached to it.
 *
 * @param token The significant lexeme.
 * @param leadingTrivia The trivia lexemes before the token, in source order.
 * @param trailingTrivia The trivia lexemes after the token on the same line, in source order.
 */
public record TokenReference(
        Lexeme token,
        List<Lexeme> leadingTrivia,
        List<Lexeme> trailingTrivia
) implements SyntaxNode {

    /**
     * Compact constructor to ensure trivia lists are never null.
     */
    public TokenReference {
        leadingTrivia = leadingTrivia == null ? List.of() : List.copyOf(leadingTrivia);
        trailingTrivia = trailingTrivia == null ? List.of() : List.copyOf(trailingTrivia);
    }

    /**
     * Creates a reference without any trivia.
     * @param token The significant lexeme.
     */
    public TokenReference(Lexeme token) {
        this(token, List.of(), List.of());
    }

    public TokenType type() {
        return token.type();
    }

    public String text() {
        return token.text();
    }

    public int line() {
        return token.line();
    }

    @Override
    public Span span() {
        return new Span(token.start(), token.end());
    }
}
