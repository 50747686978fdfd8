package org.lunaform.compiler.frontend.syntax;

/**
 * A field of a table constructor.
 */
public interface TableField extends SyntaxNode {

    record NoKey(Span span, Expr value) implements TableField {
    }

    record NameKey(Span span, TokenReference name, TokenReference equal, Expr value) implements TableField {
    }

    record ExpressionKey(Span span, ContainedSpan brackets, Expr key, TokenReference equal,
                         Expr value) implements TableField {
    }
}
