package org.kaleido.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The file looked up in the working directory when no file is given explicitly. */
    public static final String CONFIG_FILE_NAME = "kaleido.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dkaleido.repl.prompt=...)
     * 3. Configuration File (the given file, else kaleido.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or {@code null} to look for kaleido.conf.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigException if a file cannot be parsed or an explicit file does not exist.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new ConfigException.IO(
                        ConfigOriginFactory.newFile(configFile.getPath()),
                        "Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File defaultFile = new File(CONFIG_FILE_NAME);
            if (defaultFile.isFile()) {
                LOG.info("Loading configuration from file: {}", defaultFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(defaultFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", defaultFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
