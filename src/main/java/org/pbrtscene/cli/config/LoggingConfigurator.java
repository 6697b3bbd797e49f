package org.pbrtscene.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"   # level of the root logger
 *   levels {
 *     "org.pbrtscene.loader.SceneLoader" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private LoggingConfigurator() {}

    /**
     * Applies the {@code logging} block of {@code config}, if present.
     * Does nothing when SLF4J is not bound to Logback.
     *
     * @param config The application configuration.
     */
    public static void configure(final Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOG.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOG.debug("SLF4J is not bound to Logback, ignoring logging configuration.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOG.debug("Configured default log level: {}", level);
        }

        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOG.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, entry.getKey());
                continue;
            }
            context.getLogger(entry.getKey()).setLevel(level);
            LOG.debug("Configured logger '{}' to level: {}", entry.getKey(), level);
        }
    }
}
