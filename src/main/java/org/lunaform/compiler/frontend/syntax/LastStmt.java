package org.lunaform.compiler.frontend.syntax;

/**
 * A statement that can only appear at the end of a block.
 */
public interface LastStmt extends SyntaxNode {

    record Return(Span span, TokenReference returnToken, Punctuated<Expr> values) implements LastStmt {
    }

    record Break(Span span, TokenReference token) implements LastStmt {
    }

    /** The contextual Luau {@code continue} keyword. */
    record Continue(Span span, TokenReference token) implements LastStmt {
    }
}
