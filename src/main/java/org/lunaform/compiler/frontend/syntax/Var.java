package org.lunaform.compiler.frontend.syntax;

import java.util.List;

/**
 * Something that can be assigned to: a plain name or a prefix followed by suffixes.
 * In expression position the same records are used as values.
 */
public interface Var extends SyntaxNode {

    record Name(Span span, TokenReference token) implements Var, Expr {
    }

    record Suffixed(Span span, PrefixSyntax prefix, List<Suffix> suffixes) implements Var, Expr {

        public Suffixed {
            suffixes = List.copyOf(suffixes);
        }
    }
}
