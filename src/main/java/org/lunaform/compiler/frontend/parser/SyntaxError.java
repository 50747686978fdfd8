package org.lunaform.compiler.frontend.parser;

/**
 * Unwinds the parser after a syntax error was reported to the diagnostics engine.
 */
class SyntaxError extends RuntimeException {

    SyntaxError(String message) {
        super(message);
    }
}
