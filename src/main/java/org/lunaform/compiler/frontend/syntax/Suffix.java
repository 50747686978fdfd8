package org.lunaform.compiler.frontend.syntax;

/**
 * One link of a call or variable chain.
 */
public interface Suffix extends SyntaxNode {

    record CallSuffix(Span span, Call call) implements Suffix {
    }

    record IndexSuffix(Span span, Index index) implements Suffix {
    }
}
