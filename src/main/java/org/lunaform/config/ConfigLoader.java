package org.lunaform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the lunaform configuration. Sources, highest precedence first:
 * <ol>
 *     <li>Java system properties ({@code -Dlunaform.parser.preserve-tokens=true})</li>
 *     <li>{@code lunaform.conf} in the working directory, when present</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "lunaform.conf";

    private ConfigLoader() {
        // Static utility
    }

    public static Config load() {
        return load(ConfigFactory.empty());
    }

    /**
     * Loads the configuration with explicit overrides on top of every other source.
     *
     * @param overrides Values that win over system properties, the file and the defaults.
     * @return The resolved configuration.
     */
    public static Config load(Config overrides) {
        return load(overrides, new File(CONFIG_FILE_NAME));
    }

    static Config load(Config overrides, File configFile) {
        Config fileConfig;
        if (configFile.isFile()) {
            log.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            log.debug("No configuration file at '{}', using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        return overrides
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
