package org.lunaform.compiler.frontend.converter;

import org.lunaform.compiler.api.InternalStackException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A LIFO buffer of converted nodes of one category, waiting for the assembly step of their parent.
 *
 * @param <T> The node category.
 */
final class ValueStack<T> {

    private final String category;
    private final Deque<T> items = new ArrayDeque<>();

    ValueStack(String category) {
        this.category = category;
    }

    void push(T item) {
        items.push(item);
    }

    T pop() throws InternalStackException {
        T item = items.poll();
        if (item == null) {
            throw new InternalStackException(category);
        }
        return item;
    }

    /**
     * Pops {@code count} items. The first popped item comes first in the returned list.
     */
    List<T> pop(int count) throws InternalStackException {
        List<T> popped = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            popped.add(pop());
        }
        return popped;
    }

    int size() {
        return items.size();
    }

    void clear() {
        items.clear();
    }

    String category() {
        return category;
    }
}
