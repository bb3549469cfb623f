package org.docsmith.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the docsmith configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "docsmith.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@code docsmith.conf} in the working directory.
     * @return The resolved configuration.
     * @see #load(String)
     */
    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Ddocsmith.handlers.load-order-errors=false)
     * 3. Configuration file, looked up on the file system and then on the classpath
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param fileName The configuration file to layer over the defaults.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String fileName) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysConfig = ConfigFactory.systemProperties();

        final File configFile = new File(fileName);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found on disk, trying the classpath", fileName);
            fileConfig = ConfigFactory.parseResources(fileName);
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(sysConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
