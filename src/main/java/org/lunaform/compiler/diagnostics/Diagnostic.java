package org.lunaform.compiler.diagnostics;

/**
 * A single message reported by the lexer or the parser.
 *
 * @param severity How serious the problem is.
 * @param message The message text.
 * @param sourceName The logical name of the parsed source (a file name, or {@code <memory>}).
 * @param line The 1-based line the problem was found on.
 */
public record Diagnostic(
        Severity severity,
        String message,
        String sourceName,
        int line
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Severity {
        /** Parsing cannot produce a tree. */
        ERROR,
        /** Parsing continues, the tree is still usable. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", severity, sourceName, line, message);
    }
}
