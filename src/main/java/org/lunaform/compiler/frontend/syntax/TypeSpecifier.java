package org.lunaform.compiler.frontend.syntax;

/**
 * A type annotation: the {@code :} (or {@code ->}) punctuation followed by the type.
 */
public record TypeSpecifier(TokenReference punctuation, TypeInfo type) {
}
