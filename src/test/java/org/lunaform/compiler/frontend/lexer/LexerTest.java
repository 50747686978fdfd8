package org.lunaform.compiler.frontend.lexer;

import org.lunaform.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LexerTest {

    private static List<Lexeme> scan(String source, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics).scanTokens();
    }

    private static List<TokenType> types(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<TokenType> types = scan(source, diagnostics).stream().map(Lexeme::type).toList();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return types;
    }

    /**
     * Every lexeme records its half-open offsets and start line; together the lexemes cover the
     * whole source.
     */
    @Test
    void lexemesCoverTheSourceWithOffsetsAndLines() {
        // Arrange
        String source = "local a = 1 -- one\nreturn a";

        // Act
        List<Lexeme> lexemes = scan(source, new DiagnosticsEngine());

        // Assert
        StringBuilder rebuilt = new StringBuilder();
        int offset = 0;
        for (Lexeme lexeme : lexemes) {
            assertThat(lexeme.start()).isEqualTo(offset);
            assertThat(source.substring(lexeme.start(), lexeme.end())).isEqualTo(lexeme.text());
            rebuilt.append(lexeme.text());
            offset = lexeme.end();
        }
        assertThat(rebuilt.toString()).isEqualTo(source);
        Lexeme returnKeyword = lexemes.stream().filter(l -> l.type() == TokenType.RETURN).findFirst().orElseThrow();
        assertThat(returnKeyword.line()).isEqualTo(2);
        assertThat(lexemes.get(lexemes.size() - 1).type()).isEqualTo(TokenType.END_OF_FILE);
    }

    @Test
    void scansKeywordsSymbolsAndCompoundOperators() {
        assertThat(types("x += 1 .. y //= 2"))
                .containsExactly(TokenType.IDENTIFIER, TokenType.WHITESPACE, TokenType.PLUS_EQUAL,
                        TokenType.WHITESPACE, TokenType.NUMBER, TokenType.WHITESPACE, TokenType.TWO_DOTS,
                        TokenType.WHITESPACE, TokenType.IDENTIFIER, TokenType.WHITESPACE,
                        TokenType.DOUBLE_SLASH_EQUAL, TokenType.WHITESPACE, TokenType.NUMBER,
                        TokenType.END_OF_FILE);
    }

    /**
     * Bitwise operators are lexed so the converter can report them instead of failing here.
     */
    @Test
    void scansBitwiseOperators() {
        assertThat(types("a&b|c~d<<e>>f"))
                .containsExactly(TokenType.IDENTIFIER, TokenType.AMPERSAND, TokenType.IDENTIFIER,
                        TokenType.PIPE, TokenType.IDENTIFIER, TokenType.TILDE, TokenType.IDENTIFIER,
                        TokenType.DOUBLE_LESS_THAN, TokenType.IDENTIFIER, TokenType.DOUBLE_GREATER_THAN,
                        TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    @Test
    void scansNumbersOfEveryBase() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<String> numbers = scan("1 0.5 .5 1e10 0xFF 0b1010 1_000 0x1p4", diagnostics).stream()
                .filter(l -> l.type() == TokenType.NUMBER)
                .map(Lexeme::text)
                .toList();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(numbers).containsExactly("1", "0.5", ".5", "1e10", "0xFF", "0b1010", "1_000", "0x1p4");
    }

    @Test
    void scansLongStringsAndComments() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Lexeme> lexemes = scan("--[==[ block\n]==] x = [[a\nb]] -- end", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(lexemes.get(0).type()).isEqualTo(TokenType.MULTI_LINE_COMMENT);
        assertThat(lexemes.get(0).text()).isEqualTo("--[==[ block\n]==]");
        assertThat(lexemes).filteredOn(l -> l.type() == TokenType.STRING)
                .extracting(Lexeme::text).containsExactly("[[a\nb]]");
        assertThat(lexemes.get(lexemes.size() - 2).type()).isEqualTo(TokenType.SINGLE_LINE_COMMENT);
    }

    /**
     * Interpolated strings are split around their expressions; each part keeps its delimiters.
     */
    @Test
    void splitsInterpolatedStrings() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Lexeme> lexemes = scan("`a {b} c {{d}} e`", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(lexemes).extracting(Lexeme::type).containsExactly(
                TokenType.INTERPOLATED_BEGIN, TokenType.IDENTIFIER, TokenType.INTERPOLATED_MIDDLE,
                TokenType.LEFT_BRACE, TokenType.IDENTIFIER, TokenType.RIGHT_BRACE,
                TokenType.INTERPOLATED_END, TokenType.END_OF_FILE);
        assertThat(lexemes.get(0).text()).isEqualTo("`a {");
        assertThat(lexemes.get(2).text()).isEqualTo("} c {");
        assertThat(lexemes.get(6).text()).isEqualTo("} e`");
        assertThat(types("`plain`")).containsExactly(TokenType.INTERPOLATED_SIMPLE, TokenType.END_OF_FILE);
    }

    @Test
    void reportsUnterminatedString() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        scan("local s = \"abc\nreturn s", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.firstError().orElseThrow().message()).isEqualTo("Unterminated string.");
        assertThat(diagnostics.firstError().orElseThrow().line()).isEqualTo(1);
    }

    @Test
    void reportsUnexpectedCharacter() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        scan("a = 1\nb = $", diagnostics);

        // Assert
        assertThat(diagnostics.summary()).contains("Unexpected character: $").contains(":2:");
    }
}
