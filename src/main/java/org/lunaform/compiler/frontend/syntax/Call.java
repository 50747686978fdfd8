package org.lunaform.compiler.frontend.syntax;

/**
 * A call suffix.
 */
public interface Call extends SyntaxNode {

    record Anonymous(Span span, Args arguments) implements Call {
    }

    record Method(Span span, TokenReference colon, TokenReference name, Args arguments) implements Call {
    }
}
