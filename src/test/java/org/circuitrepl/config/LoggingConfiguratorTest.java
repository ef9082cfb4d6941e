package org.circuitrepl.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.circuitrepl.junit.extensions.logging.ExpectLog;
import org.circuitrepl.junit.extensions.logging.LogLevel;
import org.circuitrepl.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.circuitrepl.test.logging";

    private LoggerContext context;
    private Logger root;
    private Level savedRootLevel;
    private List<Appender<ch.qos.logback.classic.spi.ILoggingEvent>> savedAppenders;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        savedRootLevel = root.getLevel();
        savedAppenders = new ArrayList<>();
        final Iterator<Appender<ch.qos.logback.classic.spi.ILoggingEvent>> it = root.iteratorForAppenders();
        while (it.hasNext()) {
            savedAppenders.add(it.next());
        }
    }

    @AfterEach
    void tearDown() {
        final Appender<?> json = root.getAppender(LoggingConfigurator.JSON_APPENDER_NAME);
        if (json != null) {
            root.detachAppender(LoggingConfigurator.JSON_APPENDER_NAME);
            json.stop();
        }
        savedAppenders.forEach(appender -> {
            if (root.getAppender(appender.getName()) == null) {
                appender.start();
                root.addAppender(appender);
            }
        });
        root.setLevel(savedRootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_plainKeepsLogbackXmlAppender() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        final Appender<?> plain = root.getAppender("STDERR_PLAIN");
        assertNotNull(plain, "The STDERR_PLAIN appender from logback.xml should stay attached");
        assertNull(root.getAppender(LoggingConfigurator.JSON_APPENDER_NAME));
        assertEquals(Level.INFO, root.getLevel());
    }

    @Test
    void configure_jsonReplacesRootAppender() {
        // Given
        final Config config = ConfigFactory.parseString("logging.format = \"JSON\"");

        // When
        LoggingConfigurator.configure(config);

        // Then
        final Appender<?> json = root.getAppender(LoggingConfigurator.JSON_APPENDER_NAME);
        assertNotNull(json);
        assertTrue(json instanceof ConsoleAppender);
        assertTrue(json.isStarted());
        assertEquals("System.err", ((ConsoleAppender<?>) json).getTarget());
        assertNull(root.getAppender("STDERR_PLAIN"));
    }

    @Test
    void configure_appliesSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging.levels {
              "org.circuitrepl.test.logging" = "DEBUG"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.DEBUG, context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator", messagePattern = "Ignoring unknown level.*")
    void configure_skipsUnknownLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging.levels {
              "org.circuitrepl.test.logging" = "LOUD"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertNull(context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_isIdempotent() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"DEBUG\""));

        // Then
        assertEquals(Level.ERROR, root.getLevel());
        assertFalse(root.isDebugEnabled());
    }
}
