package org.lunaform.compiler.nodes;

import java.util.List;

/**
 * Keeps separator token lists (commas, semicolons) in step with the element list they punctuate.
 */
public final class Separators {

    private Separators() {
    }

    /**
     * Removes the separator that belonged to the element removed at {@code index}: the one after
     * it, or the last one when the element was the last.
     */
    public static void removeAt(List<Token> separators, int index) {
        if (separators.isEmpty()) {
            return;
        }
        if (index < separators.size()) {
            separators.remove(index);
        } else {
            separators.remove(separators.size() - 1);
        }
    }

    /**
     * Adds a separator for an element inserted at {@code index} when the list now needs one more.
     * @param separators The separators, one less than the element count.
     * @param index The index the element was inserted at.
     * @param elementCount The element count after the insertion.
     * @param content The separator text.
     */
    public static void insertAt(List<Token> separators, int index, int elementCount, String content) {
        if (separators.size() + 1 >= elementCount) {
            return;
        }
        separators.add(Math.min(index, separators.size()), Token.fromContent(content));
    }
}
