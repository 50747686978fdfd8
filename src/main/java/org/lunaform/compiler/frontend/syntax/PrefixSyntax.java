package org.lunaform.compiler.frontend.syntax;

/**
 * The head of a call or variable chain.
 */
public interface PrefixSyntax extends SyntaxNode {

    record Name(Span span, TokenReference token) implements PrefixSyntax {
    }

    /** A parenthesized expression used as prefix, e.g. {@code (f or g)()}. */
    record Expression(Span span, Expr expression) implements PrefixSyntax {
    }
}
