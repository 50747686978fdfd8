package org.lunaform.compiler.frontend.syntax;

/**
 * A parameter of a function body.
 */
public interface Parameter extends SyntaxNode {

    record Name(Span span, TokenReference token) implements Parameter {
    }

    record Ellipsis(Span span, TokenReference token) implements Parameter {
    }
}
