package org.minilisp.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String EVALUATOR_LOGGER = "org.minilisp.runtime.Evaluator";

    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context().getLogger(EVALUATOR_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @Test
    void configure_appliesDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.minilisp.runtime.Evaluator" = "TRACE"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.TRACE, context().getLogger(EVALUATOR_LOGGER).getLevel());
    }

    @Test
    void configure_isIdempotentUntilReset() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"DEBUG\""));

        // Then
        assertEquals(Level.ERROR, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_keepsCurrentLevels() {
        final Level before = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        LoggingConfigurator.configure(ConfigFactory.parseString("minilisp.repl.prompt = \"> \""));

        assertEquals(before, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
