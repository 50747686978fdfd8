package org.lunaform.compiler.frontend.syntax;

import java.util.Optional;

/**
 * The name of a function declaration: dot separated names plus an optional method name.
 */
public record FunctionNameSyntax(
        Span span,
        Punctuated<TokenReference> names,
        Optional<TokenReference> colon,
        Optional<TokenReference> method
) implements SyntaxNode {
}
