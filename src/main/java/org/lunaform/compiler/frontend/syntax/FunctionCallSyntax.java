package org.lunaform.compiler.frontend.syntax;

import java.util.List;

/**
 * A prefix followed by suffixes, the last of which is a call.
 * Used both as a statement and as an expression.
 */
public record FunctionCallSyntax(Span span, PrefixSyntax prefix, List<Suffix> suffixes) implements Stmt, Expr {

    public FunctionCallSyntax {
        suffixes = List.copyOf(suffixes);
    }
}
