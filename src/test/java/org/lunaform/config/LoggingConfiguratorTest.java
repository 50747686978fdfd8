package org.lunaform.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private static final String LOGGER = "org.lunaform.config.sample";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndLoggerLevels() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { default-level = ERROR, levels { \"" + LOGGER + "\" = DEBUG } }"));

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(LoggingConfigurator.isConfigured()).isTrue();
    }

    @Test
    void configuresOnlyOnceUntilReset() {
        // Arrange
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER + "\" = DEBUG }"));

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER + "\" = TRACE }"));

        // Assert
        assertThat(context.getLogger(LOGGER).getLevel()).isEqualTo(Level.DEBUG);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER + "\" = TRACE }"));
        assertThat(context.getLogger(LOGGER).getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void skipsUnknownLevels() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + LOGGER + "\" = LOUD }"));

        // Assert
        assertThat(context.getLogger(LOGGER).getLevel()).isNull();
    }

    @Test
    void leavesLevelsAloneWithoutLoggingSection() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
        assertThat(LoggingConfigurator.isConfigured()).isTrue();
    }
}
