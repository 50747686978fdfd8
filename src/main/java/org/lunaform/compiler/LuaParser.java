package org.lunaform.compiler;

import com.typesafe.config.Config;
import org.lunaform.compiler.api.ConversionException;
import org.lunaform.config.ConfigLoader;
import org.lunaform.config.LoggingConfigurator;
import org.lunaform.compiler.api.ParserException;
import org.lunaform.compiler.diagnostics.DiagnosticsEngine;
import org.lunaform.compiler.frontend.converter.AstConverter;
import org.lunaform.compiler.frontend.lexer.Lexeme;
import org.lunaform.compiler.frontend.lexer.Lexer;
import org.lunaform.compiler.frontend.parser.Parser;
import org.lunaform.compiler.frontend.parser.TriviaAttacher;
import org.lunaform.compiler.frontend.syntax.SyntaxTree;
import org.lunaform.compiler.frontend.syntax.TokenReference;
import org.lunaform.compiler.nodes.Block;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns Lua source code into a {@link Block}. This class orchestrates the pipeline from source
 * text to the node model: lexing, trivia attachment, parsing and conversion.
 * <p>
 * Each call to {@link #parse(String)} uses its own diagnostics, so one parser can be shared
 * between threads.
 */
public class LuaParser {

    private static final Logger log = LoggerFactory.getLogger(LuaParser.class);

    private final ParserOptions options;

    public LuaParser(ParserOptions options) {
        this.options = options;
    }

    public LuaParser(Config config) {
        this(ParserOptions.fromConfig(config));
    }

    /**
     * Creates a parser from the layered configuration (system properties, {@code lunaform.conf},
     * {@code reference.conf}) and applies its logging section.
     */
    public static LuaParser configured() {
        Config config = ConfigLoader.load();
        LoggingConfigurator.configure(config);
        return new LuaParser(config);
    }

    /**
     * A parser keeping every token and its trivia, for trees that are generated back to text.
     */
    public static LuaParser preservingTokens() {
        return new LuaParser(ParserOptions.defaults().withPreserveTokens(true));
    }

    /**
     * A parser producing a bare tree without any token.
     */
    public static LuaParser discardingTokens() {
        return new LuaParser(ParserOptions.defaults());
    }

    public ParserOptions getOptions() {
        return options;
    }

    /**
     * Parses the given code.
     *
     * @param code The Lua source.
     * @return The root block.
     * @throws ParserException if the code has syntax errors or cannot be converted.
     */
    public Block parse(String code) throws ParserException {
        return parse(code, "<memory>");
    }

    /**
     * Parses the given code.
     *
     * @param code The Lua source.
     * @param sourceName The name used in diagnostics, typically a file name.
     * @return The root block.
     * @throws ParserException if the code has syntax errors or cannot be converted.
     */
    public Block parse(String code, String sourceName) throws ParserException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(sourceName);

        // Phase 1: lexing and trivia attachment
        long start = System.nanoTime();
        List<Lexeme> lexemes = new Lexer(code, diagnostics).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new ParserException(diagnostics.summary());
        }
        List<TokenReference> tokens = TriviaAttacher.attach(lexemes);

        // Phase 2: parsing
        Optional<SyntaxTree> tree = new Parser(code, tokens, diagnostics).parse();
        if (tree.isEmpty() || diagnostics.hasErrors()) {
            throw new ParserException(diagnostics.summary());
        }
        log.debug("parsing done in {} ms", elapsedMillis(start));

        // Phase 3: conversion into the node model
        start = System.nanoTime();
        AstConverter converter = new AstConverter(options.preserveTokens(), options.unsupportedStatements());
        try {
            Block block = converter.convert(tree.get());
            log.debug("conversion done in {} ms", elapsedMillis(start));
            return block;
        } catch (ConversionException e) {
            throw new ParserException(e.getMessage(), e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
