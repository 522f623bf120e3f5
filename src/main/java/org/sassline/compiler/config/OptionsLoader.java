package org.sassline.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.sassline.compiler.api.ParserOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the parser options from the layered configuration.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class OptionsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(OptionsLoader.class);
    private static final String CONFIG_FILE_NAME = "sassline.conf";
    private static final String CONFIG_PATH = "sassline";

    private OptionsLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the options using {@code sassline.conf} in the working directory.
     * @return The resolved options.
     */
    public static ParserOptions load() {
        return load(Path.of(CONFIG_FILE_NAME));
    }

    /**
     * Loads the options, respecting the precedence order:
     * 1. JVM system properties (e.g., -Dsassline.style=compact)
     * 2. The given configuration file, if it exists
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param configFile The configuration file to consult.
     * @return The resolved options.
     * @throws com.typesafe.config.ConfigException if a value is missing or has the wrong type.
     */
    public static ParserOptions load(Path configFile) {
        return ParserOptions.fromConfig(loadConfig(configFile).getConfig(CONFIG_PATH));
    }

    static Config loadConfig(Path configFile) {
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (Files.isRegularFile(configFile)) {
            LOG.info("Loading configuration from file: {}", configFile.toAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile.toFile());
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile);
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return propertiesConfig
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
