package org.lunaform.compiler.frontend.syntax;

/**
 * The arguments of a call: a parenthesized list, a single string or a single table constructor.
 */
public interface Args extends SyntaxNode {

    record Parenthesized(Span span, ContainedSpan parentheses, Punctuated<Expr> arguments) implements Args {
    }
}
