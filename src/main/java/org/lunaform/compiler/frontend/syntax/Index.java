package org.lunaform.compiler.frontend.syntax;

/**
 * An index suffix.
 */
public interface Index extends SyntaxNode {

    record Brackets(Span span, ContainedSpan brackets, Expr expression) implements Index {
    }

    record Dot(Span span, TokenReference dot, TokenReference name) implements Index {
    }
}
