package org.agenticscript.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the AgenticScript configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "agenticscript.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dkey=value)
     * 3. Configuration file (explicit file, or agenticscript.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A file given on the command line, or null to look in the working directory.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicit file does not exist.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", cwdConfigFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }
        return layer(fileConfig);
    }

    /**
     * Puts environment and system properties on top of the given file configuration and the
     * classpath defaults below it.
     *
     * @param fileConfig The parsed file configuration.
     * @return The resolved configuration.
     */
    public static Config layer(final Config fileConfig) {
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.defaultReference())
            .resolve();
    }
}
