package org.agentworld.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the node configuration. Precedence, highest first:
 * <ol>
 *   <li>environment variables</li>
 *   <li>system properties ({@code -Dkey=value})</li>
 *   <li>the configuration file ({@code agentworld.conf} in the working directory unless given)</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String DEFAULT_CONFIG_FILE = "agentworld.conf";

    private ConfigLoader() {
    }

    public static Config load() {
        return load(new File(DEFAULT_CONFIG_FILE));
    }

    /**
     * @param configFile The configuration file. Skipped if it does not exist.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.info("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
