package org.lunaform.compiler.frontend.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Everything of a function after the {@code function} keyword and the name.
 *
 * @param span The covered source range.
 * @param generics The generic declaration before the parameters.
 * @param parentheses The parentheses around the parameters.
 * @param parameters The parameters.
 * @param typeSpecifiers The optional type annotation of each parameter, aligned with {@code parameters}.
 * @param returnType The return type annotation.
 * @param block The body.
 * @param end The closing {@code end} keyword.
 */
public record FunctionBodySyntax(
        Span span,
        Optional<GenericDeclaration> generics,
        ContainedSpan parentheses,
        Punctuated<Parameter> parameters,
        List<Optional<TypeSpecifier>> typeSpecifiers,
        Optional<TypeSpecifier> returnType,
        SyntaxBlock block,
        TokenReference end
) implements SyntaxNode {

    public FunctionBodySyntax {
        typeSpecifiers = List.copyOf(typeSpecifiers);
    }
}
