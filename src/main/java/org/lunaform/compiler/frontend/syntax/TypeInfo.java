package org.lunaform.compiler.frontend.syntax;

import java.util.Optional;

/**
 * A Luau type annotation.
 */
public interface TypeInfo extends SyntaxNode {

    /** {@code {T}} */
    record Array(Span span, ContainedSpan braces, TypeInfo element) implements TypeInfo {
    }

    /** A single name, or {@code nil}. */
    record Basic(Span span, TokenReference token) implements TypeInfo {
    }

    /** The {@code true} or {@code false} singleton type. */
    record Boolean(Span span, TokenReference token) implements TypeInfo {
    }

    /** A string singleton type. */
    record StringLiteral(Span span, TokenReference token) implements TypeInfo {
    }

    /** {@code <T>(a: T, ...U) -> R} */
    record Callback(Span span, Optional<GenericDeclaration> generics, ContainedSpan parentheses,
                    Punctuated<TypeArgument> arguments, TokenReference arrow,
                    TypeInfo returnType) implements TypeInfo {
    }

    /** An argument of a callback type, optionally named. */
    record TypeArgument(Span span, Optional<TokenReference> name, Optional<TokenReference> colon,
                        TypeInfo type) implements SyntaxNode {
    }

    /** {@code Name<A, B>} */
    record Generic(Span span, TokenReference base, ContainedSpan arrows,
                   Punctuated<TypeInfo> generics) implements TypeInfo {
    }

    /** {@code T...} */
    record GenericPack(Span span, TokenReference name, TokenReference ellipsis) implements TypeInfo {
    }

    record Intersection(Span span, TypeInfo left, TokenReference ampersand, TypeInfo right) implements TypeInfo {
    }

    record Union(Span span, TypeInfo left, TokenReference pipe, TypeInfo right) implements TypeInfo {
    }

    /** {@code module.Name} or {@code module.Name<T>}; {@code type} is a {@link Basic} or a {@link Generic}. */
    record Module(Span span, TokenReference module, TokenReference dot, TypeInfo type) implements TypeInfo {
    }

    /** {@code T?} */
    record OptionalType(Span span, TypeInfo base, TokenReference questionMark) implements TypeInfo {
    }

    record Table(Span span, ContainedSpan braces, Punctuated<TypeField> fields) implements TypeInfo {
    }

    /** {@code typeof(expression)} */
    record Typeof(Span span, TokenReference typeofToken, ContainedSpan parentheses,
                  Expr inner) implements TypeInfo {
    }

    /** A parenthesized list of types, {@code (T)} included. */
    record Tuple(Span span, ContainedSpan parentheses, Punctuated<TypeInfo> types) implements TypeInfo {
    }

    /** {@code ...T} */
    record Variadic(Span span, TokenReference ellipsis, TypeInfo type) implements TypeInfo {
    }
}
