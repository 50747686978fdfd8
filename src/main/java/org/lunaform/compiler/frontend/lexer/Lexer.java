package org.lunaform.compiler.frontend.lexer;

import org.lunaform.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of lexemes.
 * <p>
 * Unlike a classic scanner it keeps whitespace and comments as trivia lexemes, so that every
 * character of the source belongs to exactly one lexeme. A whitespace lexeme never spans more
 * than one line break, and when it contains one the break is its last character.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("and", TokenType.AND),
            Map.entry("break", TokenType.BREAK),
            Map.entry("do", TokenType.DO),
            Map.entry("else", TokenType.ELSE),
            Map.entry("elseif", TokenType.ELSEIF),
            Map.entry("end", TokenType.END),
            Map.entry("false", TokenType.FALSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("function", TokenType.FUNCTION),
            Map.entry("if", TokenType.IF),
            Map.entry("in", TokenType.IN),
            Map.entry("local", TokenType.LOCAL),
            Map.entry("nil", TokenType.NIL),
            Map.entry("not", TokenType.NOT),
            Map.entry("or", TokenType.OR),
            Map.entry("repeat", TokenType.REPEAT),
            Map.entry("return", TokenType.RETURN),
            Map.entry("then", TokenType.THEN),
            Map.entry("true", TokenType.TRUE),
            Map.entry("until", TokenType.UNTIL),
            Map.entry("while", TokenType.WHILE)
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Lexeme> lexemes = new ArrayList<>();
    // One entry per open interpolated string: the depth of plain braces opened inside the current expression.
    private final Deque<Integer> interpolationBraces = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int startLine = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return All lexemes including trivia, terminated by an {@link TokenType#END_OF_FILE} lexeme.
     */
    public List<Lexeme> scanTokens() {
        if (source.startsWith("#!")) {
            while (!isAtEnd() && peek() != '\n') advance();
            addLexeme(TokenType.SHEBANG);
        }
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            scanToken();
        }
        if (!interpolationBraces.isEmpty()) {
            diagnostics.reportError("Unterminated interpolated string.", line);
        }
        lexemes.add(new Lexeme(TokenType.END_OF_FILE, "", source.length(), source.length(), line));
        return lexemes;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\f', '\u000B', '\n' -> whitespace(c);
            case '-' -> {
                if (match('-')) {
                    comment();
                } else if (match('=')) {
                    addLexeme(TokenType.MINUS_EQUAL);
                } else if (match('>')) {
                    addLexeme(TokenType.ARROW);
                } else {
                    addLexeme(TokenType.MINUS);
                }
            }
            case '"', '\'' -> quotedString(c);
            case '`' -> interpolatedString(true);
            case '[' -> {
                int level = longBracketLevel();
                if (level >= 0) {
                    if (longBracket(level)) {
                        addLexeme(TokenType.STRING);
                    }
                } else {
                    addLexeme(TokenType.LEFT_BRACKET);
                }
            }
            case ']' -> addLexeme(TokenType.RIGHT_BRACKET);
            case '{' -> {
                if (!interpolationBraces.isEmpty()) {
                    interpolationBraces.push(interpolationBraces.pop() + 1);
                }
                addLexeme(TokenType.LEFT_BRACE);
            }
            case '}' -> {
                if (!interpolationBraces.isEmpty() && interpolationBraces.peek() == 0) {
                    interpolationBraces.pop();
                    interpolatedString(false);
                } else {
                    if (!interpolationBraces.isEmpty()) {
                        interpolationBraces.push(interpolationBraces.pop() - 1);
                    }
                    addLexeme(TokenType.RIGHT_BRACE);
                }
            }
            case '(' -> addLexeme(TokenType.LEFT_PAREN);
            case ')' -> addLexeme(TokenType.RIGHT_PAREN);
            case ';' -> addLexeme(TokenType.SEMICOLON);
            case ',' -> addLexeme(TokenType.COMMA);
            case '?' -> addLexeme(TokenType.QUESTION);
            case '#' -> addLexeme(TokenType.HASH);
            case '&' -> addLexeme(TokenType.AMPERSAND);
            case '|' -> addLexeme(TokenType.PIPE);
            case ':' -> addLexeme(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
            case '+' -> addLexeme(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS);
            case '*' -> addLexeme(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR);
            case '%' -> addLexeme(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT);
            case '^' -> addLexeme(match('=') ? TokenType.CARET_EQUAL : TokenType.CARET);
            case '=' -> addLexeme(match('=') ? TokenType.TWO_EQUAL : TokenType.EQUAL);
            case '~' -> addLexeme(match('=') ? TokenType.TILDE_EQUAL : TokenType.TILDE);
            case '/' -> {
                if (match('/')) {
                    addLexeme(match('=') ? TokenType.DOUBLE_SLASH_EQUAL : TokenType.DOUBLE_SLASH);
                } else {
                    addLexeme(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                }
            }
            case '<' -> {
                if (match('<')) {
                    addLexeme(TokenType.DOUBLE_LESS_THAN);
                } else {
                    addLexeme(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS_THAN);
                }
            }
            case '>' -> {
                if (match('>')) {
                    addLexeme(TokenType.DOUBLE_GREATER_THAN);
                } else {
                    addLexeme(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER_THAN);
                }
            }
            case '.' -> {
                if (isDigit(peek())) {
                    number();
                } else if (match('.')) {
                    if (match('.')) {
                        addLexeme(TokenType.ELLIPSIS);
                    } else {
                        addLexeme(match('=') ? TokenType.TWO_DOTS_EQUAL : TokenType.TWO_DOTS);
                    }
                } else {
                    addLexeme(TokenType.DOT);
                }
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, line);
                }
            }
        }
    }

    private void whitespace(char first) {
        if (first != '\n') {
            while (!isAtEnd() && isHorizontalSpace(peek())) advance();
            match('\n');
        }
        addLexeme(TokenType.WHITESPACE);
    }

    private void comment() {
        if (peek() == '[') {
            int save = current;
            advance();
            int level = longBracketLevel();
            if (level >= 0) {
                if (longBracket(level)) {
                    addLexeme(TokenType.MULTI_LINE_COMMENT);
                }
                return;
            }
            current = save;
        }
        while (!isAtEnd() && peek() != '\n' && !(peek() == '\r' && peekNext() == '\n')) advance();
        addLexeme(TokenType.SINGLE_LINE_COMMENT);
    }

    /**
     * Called right after an opening '['. Consumes {@code =*[} when it forms a long bracket opener.
     * @return the number of equal signs, or -1 (nothing consumed) when this is not a long bracket.
     */
    private int longBracketLevel() {
        int lookahead = current;
        int level = 0;
        while (lookahead < source.length() && source.charAt(lookahead) == '=') {
            lookahead++;
            level++;
        }
        if (lookahead < source.length() && source.charAt(lookahead) == '[') {
            while (current <= lookahead) advance();
            return level;
        }
        return -1;
    }

    private boolean longBracket(int level) {
        String closing = "]" + "=".repeat(level) + "]";
        int closeAt = source.indexOf(closing, current);
        if (closeAt < 0) {
            diagnostics.reportError("Unterminated long bracket.", startLine);
            while (!isAtEnd()) advance();
            return false;
        }
        while (current < closeAt + closing.length()) advance();
        return true;
    }

    private void quotedString(char quote) {
        while (!isAtEnd() && peek() != quote) {
            char c = peek();
            if (c == '\n') {
                diagnostics.reportError("Unterminated string.", startLine);
                return;
            }
            if (c == '\\') {
                advance();
                if (isAtEnd()) break;
                if (peek() == 'z') {
                    advance();
                    while (!isAtEnd() && (isHorizontalSpace(peek()) || peek() == '\n')) advance();
                    continue;
                }
                if (peek() == '\r' && peekNext() == '\n') advance();
            }
            advance();
        }
        if (isAtEnd()) {
            diagnostics.reportError("Unterminated string.", startLine);
            return;
        }
        advance();
        addLexeme(TokenType.STRING);
    }

    /**
     * Scans the literal part of an interpolated string up to the next opening brace or the
     * closing backtick. The opening backtick or closing brace was already consumed.
     */
    private void interpolatedString(boolean atBeginning) {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                advance();
                if (!isAtEnd()) advance();
                continue;
            }
            if (c == '`') {
                advance();
                addLexeme(atBeginning ? TokenType.INTERPOLATED_SIMPLE : TokenType.INTERPOLATED_END);
                return;
            }
            if (c == '{') {
                advance();
                interpolationBraces.push(0);
                addLexeme(atBeginning ? TokenType.INTERPOLATED_BEGIN : TokenType.INTERPOLATED_MIDDLE);
                return;
            }
            advance();
        }
        diagnostics.reportError("Unterminated interpolated string.", startLine);
    }

    private void number() {
        char first = source.charAt(start);
        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (isHexDigit(peek()) || peek() == '_') advance();
            if (peek() == 'p' || peek() == 'P') exponent();
        } else if (first == '0' && (peek() == 'b' || peek() == 'B')) {
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        } else {
            while (isDigit(peek()) || peek() == '_') advance();
            if (first != '.' && peek() == '.' && peekNext() != '.') {
                advance();
                while (isDigit(peek()) || peek() == '_') advance();
            }
            if (peek() == 'e' || peek() == 'E') exponent();
        }
        // Trailing letters belong to the literal, the converter reports them as a malformed number.
        while (isAlphaNumeric(peek())) advance();
        addLexeme(TokenType.NUMBER);
    }

    private void exponent() {
        advance();
        if (peek() == '+' || peek() == '-') advance();
        while (isDigit(peek())) advance();
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addLexeme(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void addLexeme(TokenType type) {
        lexemes.add(new Lexeme(type, source.substring(start, current), start, current, startLine));
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isHorizontalSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
