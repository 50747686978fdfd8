package org.lunaform.compiler.nodes;

/**
 * The kind of a {@link Trivia}.
 */
public enum TriviaKind {
    COMMENT,
    WHITESPACE
}
