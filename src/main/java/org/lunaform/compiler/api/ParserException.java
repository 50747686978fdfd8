package org.lunaform.compiler.api;

/**
 * An exception thrown when source code cannot be turned into a block, either because the
 * front-end reported syntax errors or because the conversion into the node model failed.
 * <p>
 * It is part of the public API and hides the internal exception types of the front-end.
 */
public class ParserException extends Exception {

    /**
     * Constructs a new parser exception with the specified detail message.
     * @param message The detail message, usually the diagnostics summary.
     */
    public ParserException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new parser exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause, typically a {@link ConversionException}.
     */
    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
