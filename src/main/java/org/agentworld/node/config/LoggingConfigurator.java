package org.agentworld.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Locale;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "INFO"
 *   levels { "org.agentworld.runtime.engine" = "DEBUG" }
 * }
 * </pre>
 *
 * The format is exported as the {@value #FORMAT_PROPERTY} property, which selects the appender
 * in {@code logback.xml}.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    public static final String FORMAT_PROPERTY = "agentworld.logging.format";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures logging once; later calls have no effect until {@link #reset()}.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            return;
        }
        loggingConfigured = true;
        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        final String format = logging.hasPath("format") ? logging.getString("format") : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? "STDOUT_JSON" : "STDOUT_PLAIN";
        final String active = System.getProperty(FORMAT_PROPERTY, "STDOUT_PLAIN");
        System.setProperty(FORMAT_PROPERTY, appender);
        if (!appender.equals(active)) {
            reloadLogback(context);
        }
        context.putProperty(FORMAT_PROPERTY, appender);

        if (logging.hasPath("default-level")) {
            final Level level = Level.toLevel(logging.getString("default-level"), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (logging.hasPath("levels")) {
            for (final Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                final String levelName = entry.getValue().unwrapped().toString().toUpperCase(Locale.ROOT);
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(levelName, null));
            }
        }
        LOGGER.debug("Logging configured: format={}", format);
    }

    private static void reloadLogback(final LoggerContext context) {
        final URL url = LoggingConfigurator.class.getResource("/logback.xml");
        if (url == null) {
            LOGGER.warn("logback.xml not found on the classpath, keeping the current log format");
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(url);
        } catch (final JoranException e) {
            LOGGER.warn("Failed to reload logging configuration: {}", e.getMessage());
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. For tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
