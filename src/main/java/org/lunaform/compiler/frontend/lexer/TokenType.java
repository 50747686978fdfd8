package org.lunaform.compiler.frontend.lexer;

/**
 * Defines the kinds of lexemes the {@link Lexer} can produce.
 * Trivia kinds are produced as lexemes too and attached to their neighbouring tokens later.
 */
public enum TokenType {
    // Trivia
    WHITESPACE, SINGLE_LINE_COMMENT, MULTI_LINE_COMMENT, SHEBANG,

    // Literals
    IDENTIFIER, NUMBER, STRING,
    /** A complete interpolated string without embedded expressions, backtick to backtick. */
    INTERPOLATED_SIMPLE,
    /** From the opening backtick through the first opening brace. */
    INTERPOLATED_BEGIN,
    /** From a closing brace through the next opening brace. */
    INTERPOLATED_MIDDLE,
    /** From the last closing brace through the closing backtick. */
    INTERPOLATED_END,

    // Keywords
    AND, BREAK, DO, ELSE, ELSEIF, END, FALSE, FOR, FUNCTION, IF, IN, LOCAL, NIL, NOT, OR,
    REPEAT, RETURN, THEN, TRUE, UNTIL, WHILE,

    // Arithmetic and comparison symbols
    PLUS, MINUS, STAR, SLASH, DOUBLE_SLASH, PERCENT, CARET, HASH,
    TWO_EQUAL, TILDE_EQUAL, LESS_EQUAL, GREATER_EQUAL, LESS_THAN, GREATER_THAN,
    TWO_DOTS,

    // Bitwise symbols
    AMPERSAND, PIPE, TILDE, DOUBLE_LESS_THAN, DOUBLE_GREATER_THAN,

    // Compound assignment symbols
    PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, DOUBLE_SLASH_EQUAL, PERCENT_EQUAL,
    CARET_EQUAL, TWO_DOTS_EQUAL,

    // Punctuation
    EQUAL, LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    SEMICOLON, COLON, DOUBLE_COLON, COMMA, DOT, ELLIPSIS, ARROW, QUESTION,

    END_OF_FILE;

    /**
     * @return true for whitespace, comments and the shebang line.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == SINGLE_LINE_COMMENT || this == MULTI_LINE_COMMENT || this == SHEBANG;
    }
}
