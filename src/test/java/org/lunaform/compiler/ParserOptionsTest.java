package org.lunaform.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.lunaform.compiler.frontend.converter.UnsupportedStatementPolicy;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ParserOptionsTest {

    @Test
    void referenceConfigurationMatchesDefaults() {
        // Arrange
        Config reference = ConfigFactory.parseResources("reference.conf");

        // Act
        ParserOptions options = ParserOptions.fromConfig(reference);

        // Assert
        assertThat(options).isEqualTo(ParserOptions.defaults());
        assertThat(options.preserveTokens()).isFalse();
        assertThat(options.unsupportedStatements()).isEqualTo(UnsupportedStatementPolicy.PLACEHOLDER);
    }

    @Test
    void readsPolicyIgnoringCase() {
        // Arrange
        Config config = ConfigFactory.parseString("lunaform.parser { preserve-tokens = yes, unsupported-statements = ERROR }");

        // Act
        ParserOptions options = ParserOptions.fromConfig(config);

        // Assert
        assertThat(options.preserveTokens()).isTrue();
        assertThat(options.unsupportedStatements()).isEqualTo(UnsupportedStatementPolicy.ERROR);
    }

    @Test
    void rejectsUnknownPolicy() {
        // Arrange
        Config config = ConfigFactory.parseString("lunaform.parser { preserve-tokens = false, unsupported-statements = skip }");

        // Act & Assert
        assertThatThrownBy(() -> ParserOptions.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("expected `placeholder` or `error` but got `skip`");
    }

    @Test
    void rejectsMissingSection() {
        assertThatThrownBy(() -> ParserOptions.fromConfig(ConfigFactory.empty()))
                .isInstanceOf(ConfigException.Missing.class);
    }

    @Test
    void copiesWithChangedValues() {
        // Act
        ParserOptions options = ParserOptions.defaults()
                .withPreserveTokens(true)
                .withUnsupportedStatements(UnsupportedStatementPolicy.ERROR);

        // Assert
        assertThat(options).isEqualTo(new ParserOptions(true, UnsupportedStatementPolicy.ERROR));
        assertThatThrownBy(() -> options.withUnsupportedStatements(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
