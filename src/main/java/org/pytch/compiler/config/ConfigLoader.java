package org.pytch.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the front-end configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. JVM System Properties (e.g., -Dpytch.frontend.verbosity=4)
     * 3. Configuration File (from the filesystem, otherwise from the classpath)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFileName The configuration file to merge in.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String configFileName) {
        // 1. Environment Variables (highest precedence).
        final Config envConfig = ConfigFactory.systemEnvironment();

        // 2. -Dkey=value system properties.
        final Config systemConfig = ConfigFactory.systemProperties();

        // 3. Configuration file from the filesystem or the classpath.
        final File configFile = new File(configFileName);
        Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.parseResources(configFileName);
        }
        if (fileConfig.isEmpty()) {
            LOG.warn("Configuration file '{}' not found or is empty. Using defaults.", configFileName);
        }

        // 4. Default values from reference.conf in the classpath (lowest precedence).
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(systemConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }
}
