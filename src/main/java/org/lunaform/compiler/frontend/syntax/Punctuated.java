package org.lunaform.compiler.frontend.syntax;

import java.util.List;

/**
 * A sequence of values separated by punctuation, like the comma separated list of call arguments.
 * There is one separator between each pair of values, plus an optional trailing one.
 *
 * @param values The values in source order.
 * @param separators The separators in source order.
 * @param <T> The type of the values.
 */
public record Punctuated<T>(List<T> values, List<TokenReference> separators) {

    public Punctuated {
        values = List.copyOf(values);
        separators = List.copyOf(separators);
    }

    /**
     * @param <T> The type of the values.
     * @return an empty sequence.
     */
    public static <T> Punctuated<T> empty() {
        return new Punctuated<>(List.of(), List.of());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
