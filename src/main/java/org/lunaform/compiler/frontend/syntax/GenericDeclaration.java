package org.lunaform.compiler.frontend.syntax;

import java.util.Optional;

/**
 * The angle bracketed generic parameters of a type declaration, a function or a function type.
 *
 * @param arrows The angle brackets.
 * @param parameters The declared parameters.
 */
public record GenericDeclaration(ContainedSpan arrows, Punctuated<GenericParameter> parameters) {

    /**
     * A declared generic parameter, with its optional default.
     */
    public record GenericParameter(Span span, GenericParameterInfo info, Optional<TokenReference> equal,
                            Optional<TypeInfo> defaultType) implements SyntaxNode {
    }

    /**
     * Either a type variable {@code T} or a generic pack {@code T...}.
     */
    public interface GenericParameterInfo {
    }

    public record Name(TokenReference name) implements GenericParameterInfo {
    }

    public record Pack(TokenReference name, TokenReference ellipsis) implements GenericParameterInfo {
    }
}
