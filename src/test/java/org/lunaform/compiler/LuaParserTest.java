package org.lunaform.compiler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.lunaform.compiler.api.ConversionException;
import org.lunaform.compiler.api.ParserException;
import org.lunaform.compiler.frontend.converter.UnsupportedStatementPolicy;
import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.statements.DoStatement;
import org.lunaform.config.LoggingConfigurator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LuaParserTest {

    @Test
    void reportsSyntaxErrorsWithSourceName() {
        assertThatThrownBy(() -> LuaParser.discardingTokens().parse("local a = 1\nlocal = 2", "broken.lua"))
                .isInstanceOf(ParserException.class)
                .hasMessageContaining("broken.lua:2:")
                .hasNoCause();
    }

    @Test
    void reportsLexicalErrors() {
        assertThatThrownBy(() -> LuaParser.discardingTokens().parse("local a = $"))
                .isInstanceOf(ParserException.class)
                .hasMessageContaining("<memory>:1:");
    }

    @Test
    void replacesUnsupportedStatementsByDefault() throws Exception {
        // Act
        Block block = LuaParser.discardingTokens().parse("goto done\n::done::");

        // Assert
        assertThat(block.getStatements()).hasSize(2).allMatch(DoStatement.class::isInstance);
    }

    @Test
    void wrapsConversionErrors() {
        // Arrange
        LuaParser parser = new LuaParser(ParserOptions.defaults().withUnsupportedStatements(UnsupportedStatementPolicy.ERROR));

        // Act & Assert
        assertThatThrownBy(() -> parser.parse("goto done"))
                .isInstanceOf(ParserException.class)
                .hasMessage("unable to convert statement from `goto done`")
                .hasCauseInstanceOf(ConversionException.class);
    }

    @Test
    void readsOptionsFromConfiguration() {
        // Arrange
        LuaParser parser = new LuaParser(ConfigFactory.parseString(
                "lunaform.parser { preserve-tokens = true, unsupported-statements = error }"));

        // Act & Assert
        assertThat(parser.getOptions()).isEqualTo(new ParserOptions(true, UnsupportedStatementPolicy.ERROR));
    }

    @Test
    void configuredParserUsesReferenceDefaults() {
        // Arrange
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();

        // Act
        try {
            LuaParser parser = LuaParser.configured();

            // Assert
            assertThat(parser.getOptions()).isEqualTo(ParserOptions.defaults());
            assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
        } finally {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
            LoggingConfigurator.reset();
        }
    }

    /**
     * Each parse has its own diagnostics, so an error in one call leaves the next one clean.
     */
    @Test
    void canBeSharedBetweenCalls() throws Exception {
        // Arrange
        LuaParser parser = LuaParser.preservingTokens();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<Integer>> results = new ArrayList<>();

        // Act
        try {
            assertThatThrownBy(() -> parser.parse("if then")).isInstanceOf(ParserException.class);
            for (int i = 0; i < 16; i++) {
                int count = i;
                results.add(executor.submit(() -> parser.parse("local x = 1\n".repeat(count + 1)).statementsCount()));
            }

            // Assert
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get()).isEqualTo(i + 1);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
