package org.agentworld.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class LoggingConfiguratorTest {

    private static final String ENGINE_LOGGER = "org.agentworld.runtime.engine";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() throws JoranException {
        LoggingConfigurator.reset();
        context.getLogger(ENGINE_LOGGER).setLevel(null);
        if (System.getProperty(LoggingConfigurator.FORMAT_PROPERTY) != null
                && !"STDOUT_PLAIN".equals(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY))) {
            // back to the test configuration after a reload
            System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(LoggingConfiguratorTest.class.getResource("/logback-test.xml"));
        }
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
    }

    @Test
    void configure_withPlainFormat_keepsPlainAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT_PLAIN", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals("STDOUT_PLAIN", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertTrue(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT_PLAIN") instanceof ConsoleAppender);
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withJsonFormat_switchesAppender() {
        final Config config = ConfigFactory.parseString("logging.format = \"JSON\"");

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT_JSON", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT_JSON"));
        assertNull(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT_PLAIN"));
    }

    @Test
    void configure_appliesLoggerLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "WARN"
              levels { "org.agentworld.runtime.engine" = "debug" }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.WARN, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(ENGINE_LOGGER).getLevel());
    }

    @Test
    void configure_runsOnlyOnceUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.agentworld.runtime.engine\" = \"ERROR\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.agentworld.runtime.engine\" = \"TRACE\" }"));
        assertEquals(Level.ERROR, context.getLogger(ENGINE_LOGGER).getLevel());

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.agentworld.runtime.engine\" = \"TRACE\" }"));
        assertEquals(Level.TRACE, context.getLogger(ENGINE_LOGGER).getLevel());
    }

    @Test
    void configure_withoutLoggingSection_changesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertNull(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals(rootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
