package org.lunaform.compiler.frontend.syntax;

/**
 * The base interface for all nodes of the parse tree produced by the front-end.
 * <p>
 * The parse tree is a concrete syntax tree: it keeps every token with its trivia, so that the
 * converter can carry the exact source layout into the node model.
 */
public interface SyntaxNode {
    /**
     * @return the source range covered by this node, trivia excluded.
     */
    Span span();
}
