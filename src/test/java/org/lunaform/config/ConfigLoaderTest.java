package org.lunaform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ConfigLoaderTest {

    private static final String POLICY_KEY = "lunaform.parser.unsupported-statements";

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(POLICY_KEY);
        ConfigFactory.invalidateCaches();
    }

    @Test
    void fallsBackToReferenceConfiguration() {
        // Act
        Config config = ConfigLoader.load(ConfigFactory.empty(), tempDir.resolve("missing.conf").toFile());

        // Assert
        assertThat(config.getBoolean("lunaform.parser.preserve-tokens")).isFalse();
        assertThat(config.getString(POLICY_KEY)).isEqualTo("placeholder");
        assertThat(config.getString("logging.default-level")).isEqualTo("INFO");
    }

    @Test
    void readsTheConfigurationFile() throws Exception {
        // Arrange
        File file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile();
        Files.writeString(file.toPath(), "lunaform.parser.preserve-tokens = true\n", StandardCharsets.UTF_8);

        // Act
        Config config = ConfigLoader.load(ConfigFactory.empty(), file);

        // Assert
        assertThat(config.getBoolean("lunaform.parser.preserve-tokens")).isTrue();
        assertThat(config.getString(POLICY_KEY)).isEqualTo("placeholder");
    }

    @Test
    void systemPropertiesWinOverTheFile() throws Exception {
        // Arrange
        File file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile();
        Files.writeString(file.toPath(), POLICY_KEY + " = placeholder\n", StandardCharsets.UTF_8);
        System.setProperty(POLICY_KEY, "error");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(ConfigFactory.empty(), file);

        // Assert
        assertThat(config.getString(POLICY_KEY)).isEqualTo("error");
    }

    @Test
    void overridesWinOverEverything() {
        // Arrange
        System.setProperty(POLICY_KEY, "error");
        ConfigFactory.invalidateCaches();
        Config overrides = ConfigFactory.parseString(POLICY_KEY + " = placeholder");

        // Act
        Config config = ConfigLoader.load(overrides, tempDir.resolve("missing.conf").toFile());

        // Assert
        assertThat(config.getString(POLICY_KEY)).isEqualTo("placeholder");
    }

    /**
     * Values may refer to each other; the loader resolves them after merging.
     */
    @Test
    void resolvesSubstitutions() throws Exception {
        // Arrange
        File file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile();
        Files.writeString(file.toPath(), "strict = error\n" + POLICY_KEY + " = ${strict}\n", StandardCharsets.UTF_8);

        // Act
        Config config = ConfigLoader.load(ConfigFactory.empty(), file);

        // Assert
        assertThat(config.getString(POLICY_KEY)).isEqualTo("error");
    }
}
