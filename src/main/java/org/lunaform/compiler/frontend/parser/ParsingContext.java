package org.lunaform.compiler.frontend.parser;

import org.lunaform.compiler.diagnostics.DiagnosticsEngine;
import org.lunaform.compiler.frontend.lexer.TokenType;
import org.lunaform.compiler.frontend.syntax.Expr;
import org.lunaform.compiler.frontend.syntax.Span;
import org.lunaform.compiler.frontend.syntax.TokenReference;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It gives sub-parsers such as the {@link TypeParser} access to the token stream
 * without coupling them to the statement parser.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type.
     */
    boolean checkNext(TokenType type);

    /**
     * Checks if the current token is an identifier with the given text. Used for contextual
     * keywords like {@code type}, {@code typeof} or {@code continue}.
     * @param text The expected identifier.
     * @return true on a match.
     */
    boolean checkIdentifier(String text);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    TokenReference advance();

    /**
     * @return the current token without consuming it.
     */
    TokenReference peek();

    /**
     * @return the previously consumed token.
     */
    TokenReference previous();

    /**
     * Consumes the current token if it is of the expected type, otherwise reports an error
     * and aborts parsing.
     * @param type The expected token type.
     * @param errorMessage The error message to report if the token type does not match.
     * @return The consumed token.
     */
    TokenReference consume(TokenType type, String errorMessage);

    /**
     * Consumes a closing angle bracket, splitting a {@code >>} token when needed.
     * @return The consumed {@code >} token.
     */
    TokenReference consumeClosingAngle();

    /**
     * Reports an error at the current token and aborts parsing.
     * @param message The error message.
     * @return never returns normally; declared for use in {@code throw} statements.
     */
    RuntimeException error(String message);

    /**
     * @param start The start offset of the node.
     * @return the span from {@code start} to the end of the previously consumed token.
     */
    Span spanFrom(int start);

    /**
     * Parses an expression. Used by type annotations such as {@code typeof(...)}.
     * @return The parsed expression.
     */
    Expr expression();

    DiagnosticsEngine getDiagnostics();

    boolean isAtEnd();
}
