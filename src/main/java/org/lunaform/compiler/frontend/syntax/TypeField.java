package org.lunaform.compiler.frontend.syntax;

/**
 * A field of a table type.
 *
 * @param span The covered source range.
 * @param key The property name or the indexer signature.
 * @param colon The colon between key and value.
 * @param value The value type.
 */
public record TypeField(Span span, Key key, TokenReference colon, TypeInfo value) implements SyntaxNode {

    /**
     * The key of a table type field.
     */
    public interface Key {
    }

    public record NameKey(TokenReference name) implements Key {
    }

    /** {@code [KeyType]: ValueType} */
    public record IndexSignature(ContainedSpan brackets, TypeInfo inner) implements Key {
    }
}
