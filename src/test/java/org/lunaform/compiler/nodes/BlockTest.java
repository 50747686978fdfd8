package org.lunaform.compiler.nodes;

import org.lunaform.compiler.LuaParser;
import org.lunaform.compiler.backend.generator.TokenBasedGenerator;
import org.lunaform.compiler.nodes.expressions.FunctionCall;
import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.statements.BreakStatement;
import org.lunaform.compiler.nodes.statements.ReturnStatement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class BlockTest {

    private static final String SOURCE = "a(); b(); c()";

    @Test
    void removesSemicolonWithItsStatement() throws Exception {
        // Arrange
        Block block = LuaParser.preservingTokens().parse(SOURCE);

        // Act
        block.removeStatement(1);

        // Assert
        assertThat(block.getTokens().orElseThrow().semicolons()).hasSize(2);
        assertThat(new TokenBasedGenerator(SOURCE).generate(block)).isEqualTo("a(); c()");
    }

    @Test
    void insertsStatementWithoutSemicolon() throws Exception {
        // Arrange
        Block block = LuaParser.preservingTokens().parse(SOURCE);

        // Act
        block.insertStatement(1, FunctionCall.fromName("z"));
        block.insertStatement(99, FunctionCall.fromName("last"));

        // Assert
        assertThat(block.statementsCount()).isEqualTo(5);
        assertThat(new TokenBasedGenerator(SOURCE).generate(block)).isEqualTo("a(); z()b(); c()last()");
    }

    @Test
    void filtersStatementsTogetherWithSemicolons() throws Exception {
        // Arrange
        Block block = LuaParser.preservingTokens().parse(SOURCE);

        // Act
        block.filterStatements(statement -> !(((FunctionCall) statement).getPrefix() instanceof Identifier identifier
                && identifier.getName().equals("a")));

        // Assert
        assertThat(new TokenBasedGenerator(SOURCE).generate(block)).isEqualTo("b(); c()");
    }

    @Test
    void takesLastStatementWithItsSemicolon() throws Exception {
        // Arrange
        String source = "a() return 1;";
        Block block = LuaParser.preservingTokens().parse(source);

        // Act
        var taken = block.takeLastStatement();

        // Assert
        assertThat(taken).get().isInstanceOf(ReturnStatement.class);
        assertThat(block.getLastStatement()).isEmpty();
        assertThat(new TokenBasedGenerator(source).generate(block)).isEqualTo("a() ");
    }

    @Test
    void countsStatements() {
        // Arrange
        Block block = new Block(List.of(FunctionCall.fromName("a"), FunctionCall.fromName("b")), new BreakStatement());

        // Act & Assert
        assertThat(block.statementsCount()).isEqualTo(2);
        assertThat(block.totalLength()).isEqualTo(3);
        assertThat(block.isEmpty()).isFalse();

        block.clear();
        assertThat(block.totalLength()).isZero();
        assertThat(block.isEmpty()).isTrue();
    }
}
