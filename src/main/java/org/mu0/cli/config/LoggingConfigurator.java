package org.mu0.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or DETAILED
 *   default-level = "WARN"    # root logger level
 *   levels {
 *     "org.mu0.runtime.Machine" = "DEBUG"
 *   }
 * }
 * </pre>
 * The format selects one of the appenders defined in {@code logback.xml} through the
 * {@value #FORMAT_PROPERTY} property; selecting it reloads the Logback configuration.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    /** Property read by {@code logback.xml} to pick the root appender. */
    public static final String FORMAT_PROPERTY = "mu0.logging.format";

    static final String PLAIN_APPENDER = "STDOUT_PLAIN";
    static final String DETAILED_APPENDER = "STDOUT";

    private static boolean configured = false;

    private LoggingConfigurator() {}

    /**
     * Applies the logging configuration once; later calls are ignored until {@link #reset()}.
     *
     * @param config The application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (configured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        configured = true;

        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath("format")) {
            applyFormat(logging.getString("format"), context);
        }
        if (logging.hasPath("default-level")) {
            final Level level = Level.toLevel(logging.getString("default-level"), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (logging.hasPath("levels")) {
            for (final Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                final String levelName = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(levelName, null));
                LOGGER.debug("Logger '{}' set to {}", entry.getKey(), levelName);
            }
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. Intended for tests.
     */
    public static synchronized void reset() {
        configured = false;
    }

    private static void applyFormat(final String format, final LoggerContext context) {
        final String appender = "DETAILED".equalsIgnoreCase(format) ? DETAILED_APPENDER : PLAIN_APPENDER;
        System.setProperty(FORMAT_PROPERTY, appender);

        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            LOGGER.warn("logback.xml not found on classpath, keeping current appenders.");
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            context.putProperty(FORMAT_PROPERTY, appender);
            configurator.doConfigure(configUrl);
        } catch (final JoranException e) {
            LOGGER.error("Failed to reload Logback configuration for format {}", format, e);
        }
    }
}
