package org.sassline.compiler.config;

import org.sassline.compiler.api.ParserOptions;
import org.sassline.compiler.api.Style;
import org.sassline.junit.extensions.logging.AllowLog;
import org.sassline.junit.extensions.logging.LogLevel;
import org.sassline.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains integration tests for the layered option loading.
 */
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.INFO, loggerPattern = ".*OptionsLoader")
public class OptionsLoaderTest {

    @TempDir
    Path dir;

    @AfterEach
    void clearProperties() {
        System.clearProperty("sassline.style");
        com.typesafe.config.ConfigFactory.invalidateCaches();
    }

    /**
     * Verifies that the defaults from reference.conf match the built-in defaults.
     */
    @Test
    @Tag("integration")
    void loadsDefaults() {
        // Act
        ParserOptions options = OptionsLoader.load(dir.resolve("absent.conf"));

        // Assert
        assertThat(options).isEqualTo(ParserOptions.DEFAULT);
    }

    /**
     * Verifies that a configuration file overrides the defaults.
     */
    @Test
    @Tag("integration")
    void readsConfigurationFile() throws IOException {
        // Arrange
        Path file = Files.writeString(dir.resolve("sassline.conf"),
                "sassline { style = compact, load-paths = [\"lib\", \"vendor\"], filename = \"main.sass\", line = 5 }");

        // Act
        ParserOptions options = OptionsLoader.load(file);

        // Assert
        assertThat(options.style()).isEqualTo(Style.COMPACT);
        assertThat(options.loadPaths()).containsExactly(Path.of("lib"), Path.of("vendor"));
        assertThat(options.filename()).isEqualTo("main.sass");
        assertThat(options.line()).isEqualTo(5);
        assertThat(options.precompiledLocation()).isEqualTo(Path.of("./.sass-cache"));
    }

    /**
     * Verifies that system properties take precedence over the file.
     */
    @Test
    @Tag("integration")
    void systemPropertiesWin() throws IOException {
        // Arrange
        Path file = Files.writeString(dir.resolve("sassline.conf"), "sassline.style = compact");
        System.setProperty("sassline.style", "compressed");
        com.typesafe.config.ConfigFactory.invalidateCaches();

        // Act
        ParserOptions options = OptionsLoader.load(file);

        // Assert
        assertThat(options.style()).isEqualTo(Style.COMPRESSED);
        assertThat(options.loadPaths()).isEqualTo(List.of(Path.of(".")));
    }
}
