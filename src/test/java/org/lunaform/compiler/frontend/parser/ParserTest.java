package org.lunaform.compiler.frontend.parser;

import org.lunaform.compiler.diagnostics.DiagnosticsEngine;
import org.lunaform.compiler.frontend.lexer.Lexer;
import org.lunaform.compiler.frontend.lexer.TokenType;
import org.lunaform.compiler.frontend.syntax.Expr;
import org.lunaform.compiler.frontend.syntax.LastStmt;
import org.lunaform.compiler.frontend.syntax.Stmt;
import org.lunaform.compiler.frontend.syntax.SyntaxTree;
import org.lunaform.compiler.frontend.syntax.TokenReference;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ParserTest {

    private static Optional<SyntaxTree> parse(String source, DiagnosticsEngine diagnostics) {
        List<TokenReference> tokens = TriviaAttacher.attach(new Lexer(source, diagnostics).scanTokens());
        return new Parser(source, tokens, diagnostics).parse();
    }

    private static SyntaxTree parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Optional<SyntaxTree> tree = parse(source, diagnostics);
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return tree.orElseThrow();
    }

    @Test
    void parsesStatementsWithTheirSemicolons() {
        // Act
        SyntaxTree tree = parse("local a = 1; a = 2 return a;");

        // Assert
        assertThat(tree.block().statements()).hasSize(2);
        assertThat(tree.block().statements().get(0)).isInstanceOf(Stmt.LocalAssignment.class);
        assertThat(tree.block().statements().get(1)).isInstanceOf(Stmt.Assignment.class);
        assertThat(tree.block().semicolons()).hasSize(2);
        assertThat(tree.block().semicolons().get(0)).isPresent();
        assertThat(tree.block().semicolons().get(1)).isEmpty();
        assertThat(tree.block().lastStatement()).containsInstanceOf(LastStmt.Return.class);
        assertThat(tree.block().lastSemicolon()).isPresent();
    }

    /**
     * Multiplication binds tighter than addition, and {@code ..} groups to the right.
     */
    @Test
    void respectsPrecedenceAndAssociativity() {
        // Act
        Stmt.LocalAssignment sum = (Stmt.LocalAssignment) parse("local x = 1 + 2 * 3").block().statements().get(0);
        Stmt.LocalAssignment concat = (Stmt.LocalAssignment) parse("local y = a .. b .. c").block().statements().get(0);

        // Assert
        Expr.Binary plus = (Expr.Binary) sum.values().values().get(0);
        assertThat(plus.operator().type()).isEqualTo(TokenType.PLUS);
        assertThat(plus.right()).isInstanceOf(Expr.Binary.class);

        Expr.Binary outer = (Expr.Binary) concat.values().values().get(0);
        assertThat(outer.left()).isNotInstanceOf(Expr.Binary.class);
        assertThat(outer.right()).isInstanceOf(Expr.Binary.class);
    }

    @Test
    void treatsContinueAsKeywordOnlyInStatementPosition() {
        // Act
        SyntaxTree loop = parse("while true do continue end");
        SyntaxTree call = parse("continue()");

        // Assert
        Stmt.While whileStatement = (Stmt.While) loop.block().statements().get(0);
        assertThat(whileStatement.block().lastStatement()).containsInstanceOf(LastStmt.Continue.class);
        assertThat(call.block().statements()).hasSize(1);
        assertThat(call.block().lastStatement()).isEmpty();
    }

    @Test
    void parsesGotoAndLabels() {
        // Act
        SyntaxTree tree = parse("goto skip ::skip::");

        // Assert
        assertThat(tree.block().statements())
                .hasExactlyElementsOfTypes(Stmt.Goto.class, Stmt.Label.class);
    }

    @Test
    void parsesLuauTypeSyntax() {
        // Act
        SyntaxTree tree = parse("""
                export type Map<K, V = string> = { [K]: V, size: number }
                local f: (number, ...string) -> (boolean, string?) = nil
                local x = y :: Foo.Bar<T...>
                """);

        // Assert
        assertThat(tree.block().statements())
                .hasExactlyElementsOfTypes(Stmt.TypeDeclaration.class, Stmt.LocalAssignment.class,
                        Stmt.LocalAssignment.class);
        Stmt.TypeDeclaration declaration = (Stmt.TypeDeclaration) tree.block().statements().get(0);
        assertThat(declaration.export()).isPresent();
        assertThat(declaration.generics()).isPresent();
    }

    @Test
    void attachesTriviaToTheEndOfFileToken() {
        // Act
        SyntaxTree tree = parse("a()\n-- trailing comment\n");

        // Assert
        assertThat(tree.endOfFile().type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(tree.endOfFile().leadingTrivia())
                .extracting(l -> l.type())
                .containsExactly(TokenType.SINGLE_LINE_COMMENT, TokenType.WHITESPACE);
    }

    /**
     * Parsing stops at the first syntax error and reports it with its line.
     */
    @Test
    void reportsTheFirstSyntaxError() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("broken.lua");

        // Act
        Optional<SyntaxTree> tree = parse("local a = 1\nif a then\nlocal = 2\nend", diagnostics);

        // Assert
        assertThat(tree).isEmpty();
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        assertThat(diagnostics.firstError().orElseThrow().line()).isEqualTo(3);
        assertThat(diagnostics.firstError().orElseThrow().sourceName()).isEqualTo("broken.lua");
    }

    @Test
    void rejectsTrailingTokens() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        Optional<SyntaxTree> tree = parse("return 1 x = 2", diagnostics);

        // Assert
        assertThat(tree).isEmpty();
        assertThat(diagnostics.hasErrors()).isTrue();
    }
}
