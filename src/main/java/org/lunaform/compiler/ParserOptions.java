package org.lunaform.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.lunaform.compiler.frontend.converter.UnsupportedStatementPolicy;

import java.util.Locale;

/**
 * The options of a {@link LuaParser}, usually read from the {@code lunaform.parser} section of
 * the configuration.
 *
 * @param preserveTokens Whether converted nodes keep their tokens and trivia.
 * @param unsupportedStatements What to do with statements such as {@code goto}.
 */
public record ParserOptions(boolean preserveTokens, UnsupportedStatementPolicy unsupportedStatements) {

    public static final String PATH = "lunaform.parser";

    public ParserOptions {
        if (unsupportedStatements == null) {
            throw new IllegalArgumentException("unsupportedStatements must not be null");
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(false, UnsupportedStatementPolicy.PLACEHOLDER);
    }

    /**
     * Reads the options from the {@code lunaform.parser} section.
     *
     * @param config The root configuration.
     * @return The options.
     * @throws ConfigException.Missing if a key is absent and no reference.conf provides it.
     * @throws ConfigException.BadValue if {@code unsupported-statements} is not a known policy.
     */
    public static ParserOptions fromConfig(Config config) {
        Config parser = config.getConfig(PATH);
        boolean preserveTokens = parser.getBoolean("preserve-tokens");
        String policy = parser.getString("unsupported-statements");
        UnsupportedStatementPolicy unsupported;
        switch (policy.toLowerCase(Locale.ROOT)) {
            case "placeholder" -> unsupported = UnsupportedStatementPolicy.PLACEHOLDER;
            case "error" -> unsupported = UnsupportedStatementPolicy.ERROR;
            default -> throw new ConfigException.BadValue(parser.origin(), "unsupported-statements",
                    "expected `placeholder` or `error` but got `" + policy + "`");
        }
        return new ParserOptions(preserveTokens, unsupported);
    }

    public ParserOptions withPreserveTokens(boolean preserve) {
        return new ParserOptions(preserve, unsupportedStatements);
    }

    public ParserOptions withUnsupportedStatements(UnsupportedStatementPolicy policy) {
        return new ParserOptions(preserveTokens, policy);
    }
}
