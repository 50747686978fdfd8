package org.lunaform.compiler.frontend.syntax;

/**
 * A table constructor. Also usable as call arguments.
 */
public record TableConstructor(Span span, ContainedSpan braces, Punctuated<TableField> fields) implements Expr, Args {
}
