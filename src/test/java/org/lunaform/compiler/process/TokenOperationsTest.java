package org.lunaform.compiler.process;

import org.lunaform.compiler.LuaParser;
import org.lunaform.compiler.backend.generator.TokenBasedGenerator;
import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.Token;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TokenOperationsTest {

    @Test
    void clearsCommentsIdempotently() throws Exception {
        // Arrange
        String source = "local a = 1 -- c\n--[[ b ]] return a";
        Block block = LuaParser.preservingTokens().parse(source);

        // Act
        TokenOperations.clearComments(block);
        String once = new TokenBasedGenerator(source).generate(block);
        TokenOperations.clearComments(block);
        String twice = new TokenBasedGenerator(source).generate(block);

        // Assert
        assertThat(once).isEqualTo("local a = 1 \n return a");
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void keepsOnlyAcceptedComments() throws Exception {
        // Arrange
        String source = "--!strict\nlocal a = 1 -- drop\nreturn a";
        Block block = LuaParser.preservingTokens().parse(source);

        // Act
        TokenOperations.filterComments(block, trivia -> trivia.read(source).startsWith("--!"));

        // Assert
        assertThat(new TokenBasedGenerator(source).generate(block)).isEqualTo("--!strict\nlocal a = 1 \nreturn a");
    }

    /**
     * Shifting by n then by -n restores every line number.
     */
    @Test
    void shiftsLinesOfEveryToken() throws Exception {
        // Arrange
        Block block = LuaParser.preservingTokens().parse("local a = 1\n\nreturn a -- end");
        List<Integer> before = lines(block);

        // Act
        TokenOperations.shiftTokenLine(block, 3);
        List<Integer> shifted = lines(block);
        TokenOperations.shiftTokenLine(block, -3);

        // Assert
        assertThat(before).containsExactlyInAnyOrder(1, 1, 1, 1, 3, 3, 3);
        assertThat(shifted).containsExactlyInAnyOrder(4, 4, 4, 4, 6, 6, 6);
        assertThat(lines(block)).isEqualTo(before);
    }

    @Test
    void shiftsAreAdditive() throws Exception {
        // Arrange
        String source = "local a = 1\n-- note\nreturn a";
        Block twice = LuaParser.preservingTokens().parse(source);
        Block once = LuaParser.preservingTokens().parse(source);

        // Act
        TokenOperations.shiftTokenLine(twice, 2);
        TokenOperations.shiftTokenLine(twice, 5);
        TokenOperations.shiftTokenLine(once, 7);

        // Assert
        assertThat(lines(twice)).isEqualTo(lines(once));
    }

    @Test
    void detachesTokensFromTheSource() throws Exception {
        // Arrange
        String source = "local t = { 1, 2 } -- values\nreturn t";
        Block block = LuaParser.preservingTokens().parse(source);

        // Act
        TokenOperations.replaceReferencedTokens(block, source);

        // Assert
        List<Token> tokens = new ArrayList<>();
        TokenOperations.forEachToken(block, tokens::add);
        assertThat(tokens).noneMatch(Token::isReferenced);
        assertThat(new TokenBasedGenerator().generate(block)).isEqualTo(source);
    }

    @Test
    void countsTokens() throws Exception {
        assertThat(TokenOperations.countTokens(LuaParser.preservingTokens().parse("local a = 1"))).isEqualTo(5);
        assertThat(TokenOperations.countTokens(LuaParser.discardingTokens().parse("local a = 1"))).isZero();
    }

    private static List<Integer> lines(Block block) {
        List<Integer> lines = new ArrayList<>();
        TokenOperations.forEachToken(block, token -> lines.add(token.getLineNumber().getAsInt()));
        return lines;
    }
}
