package org.lunaform.compiler.process.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An address of a statement, expression or block inside a root block, made of typed indexes.
 * <p>
 * A path is immutable and carries no reference to a tree. What each component designates depends
 * on the node reached so far, see {@link NodePathResolver}. Paths must be resolved again after the
 * tree is mutated.
 * <p>
 * The text form writes every index followed by the delimiter of its kind: {@code /} for a
 * statement, {@code :} for an expression and {@code #} for a block. The root path is the empty
 * string and {@code "4/1:0/"} is statement 4, then expression 1, then statement 0.
 */
public final class NodePath {

    private static final NodePath ROOT = new NodePath(List.of());

    private final List<Component> components;

    private NodePath(List<Component> components) {
        this.components = components;
    }

    public static NodePath root() {
        return ROOT;
    }

    /**
     * Builds a path from its components.
     * @param components The components, from the root down.
     * @return The path.
     */
    public static NodePath of(List<Component> components) {
        return components.isEmpty() ? ROOT : new NodePath(List.copyOf(components));
    }

    public NodePath withStatement(int index) {
        return with(new Component(ComponentKind.STATEMENT, index));
    }

    public NodePath withExpression(int index) {
        return with(new Component(ComponentKind.EXPRESSION, index));
    }

    public NodePath withBlock(int index) {
        return with(new Component(ComponentKind.BLOCK, index));
    }

    private NodePath with(Component component) {
        List<Component> extended = new ArrayList<>(components.size() + 1);
        extended.addAll(components);
        extended.add(component);
        return new NodePath(Collections.unmodifiableList(extended));
    }

    /**
     * @return the path without its last component, or empty for the root path.
     */
    public Optional<NodePath> parent() {
        if (components.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(of(components.subList(0, components.size() - 1)));
    }

    public List<Component> components() {
        return components;
    }

    public boolean isRoot() {
        return components.isEmpty();
    }

    public Optional<Component> last() {
        return components.isEmpty() ? Optional.empty() : Optional.of(components.get(components.size() - 1));
    }

    /**
     * Parses the text form produced by {@link #toString()}.
     * @param input The text to parse.
     * @return The parsed path.
     * @throws NodePathParseException If the text contains a non-ASCII character, an unknown
     *         character, a delimiter without index, an index that does not fit an int or a
     *         trailing index without delimiter.
     */
    public static NodePath parse(String input) throws NodePathParseException {
        for (int i = 0; i < input.length(); i++) {
            if (input.charAt(i) > 0x7F) {
                throw new NodePathParseException(input, "non-ascii character at position " + i);
            }
        }
        List<Component> parsed = new ArrayList<>();
        int digitsStart = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c >= '0' && c <= '9') {
                continue;
            }
            ComponentKind kind = ComponentKind.fromDelimiter(c)
                    .orElseThrow(() -> new NodePathParseException(input, "unexpected character `" + c + "`"));
            if (digitsStart == i) {
                throw new NodePathParseException(input, "missing index before `" + c + "`");
            }
            parsed.add(new Component(kind, parseIndex(input, input.substring(digitsStart, i))));
            digitsStart = i + 1;
        }
        if (digitsStart != input.length()) {
            throw new NodePathParseException(input,
                    "index `" + input.substring(digitsStart) + "` is not followed by a delimiter");
        }
        return of(parsed);
    }

    private static int parseIndex(String input, String digits) throws NodePathParseException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new NodePathParseException(input, "invalid index `" + digits + "`");
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Component component : components) {
            builder.append(component.index()).append(component.kind().delimiter());
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof NodePath)) {
            return false;
        }
        return components.equals(((NodePath) other).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    public enum ComponentKind {
        STATEMENT('/'),
        EXPRESSION(':'),
        BLOCK('#');

        private final char delimiter;

        ComponentKind(char delimiter) {
            this.delimiter = delimiter;
        }

        public char delimiter() {
            return delimiter;
        }

        static Optional<ComponentKind> fromDelimiter(char c) {
            for (ComponentKind kind : values()) {
                if (kind.delimiter == c) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * @param kind What the index designates.
     * @param index A non-negative index.
     */
    public record Component(ComponentKind kind, int index) {
        public Component {
            if (index < 0) {
                throw new IllegalArgumentException("path index must not be negative: " + index);
            }
        }
    }
}
