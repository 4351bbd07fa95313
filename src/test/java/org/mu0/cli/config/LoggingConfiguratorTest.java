package org.mu0.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@link LoggingConfigurator}.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = \"PLAIN\", default-level = \"WARN\" }"));
        context.getLogger("org.mu0.runtime.Machine").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void plainFormatSelectsPlainAppender() {
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
        final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        final Appender<?> appender = root.getAppender(LoggingConfigurator.PLAIN_APPENDER);
        assertThat(appender).isInstanceOf(ConsoleAppender.class);
        assertThat(root.getAppender(LoggingConfigurator.DETAILED_APPENDER)).isNull();
        assertThat(root.getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void detailedFormatSelectsDetailedAppender() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = \"DETAILED\""));

        final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertThat(root.getAppender(LoggingConfigurator.DETAILED_APPENDER)).isInstanceOf(ConsoleAppender.class);
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo(LoggingConfigurator.DETAILED_APPENDER);
    }

    @Test
    void specificLevelsAreApplied() {
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "org.mu0.runtime.Machine" = "DEBUG"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertThat(context.getLogger("org.mu0.runtime.Machine").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void secondConfigurationIsIgnoredUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"TRACE\""));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }
}
