package org.lunaform.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.lunaform.compiler.frontend.converter" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean configured = false;

    private LoggingConfigurator() {
        // Static utility
    }

    /**
     * Configures the logger levels. Only the first call has an effect until {@link #reset()}.
     *
     * @param config The root configuration.
     */
    public static synchronized void configure(Config config) {
        if (configured) {
            log.debug("Logging already configured, skipping.");
            return;
        }
        configured = true;
        if (!config.hasPath(LOGGING_PATH)) {
            log.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        Config logging = config.getConfig(LOGGING_PATH);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath(DEFAULT_LEVEL_KEY)) {
            Level level = Level.toLevel(logging.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            log.debug("Configured default log level: {}", level);
        }

        if (logging.hasPath(LEVELS_KEY)) {
            for (Map.Entry<String, ConfigValue> entry : logging.getConfig(LEVELS_KEY).root().entrySet()) {
                String levelName = String.valueOf(entry.getValue().unwrapped());
                Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    log.warn("Ignoring unknown level '{}' for logger '{}'", levelName, entry.getKey());
                    continue;
                }
                context.getLogger(entry.getKey()).setLevel(level);
                log.debug("Configured logger '{}' to level: {}", entry.getKey(), level);
            }
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. Meant for tests.
     */
    public static synchronized void reset() {
        configured = false;
    }

    static synchronized boolean isConfigured() {
        return configured;
    }
}
