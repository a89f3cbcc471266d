package org.cuepoint.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the {@code logging} section of the compiler configuration to Logback.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.cuepoint.compiler.Compiler" = "INFO"
 *     "org.cuepoint.compiler.registry" = "DEBUG"
 *   }
 * }
 * </pre>
 *
 * {@code default-level} sets the root logger; entries under {@code levels} set single loggers
 * or whole packages. The first call wins until {@link #reset()}.
 */
public final class LoggingConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String LOGGING_PATH = "logging";
    static final String DEFAULT_LEVEL_KEY = "default-level";
    static final String LEVELS_KEY = "levels";

    private static boolean applied = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies the logger levels of the given configuration once.
     *
     * @param config The resolved configuration.
     */
    public static synchronized void configure(final Config config) {
        if (applied) {
            LOG.debug("Logger levels already applied");
            return;
        }
        applied = true;

        if (!config.hasPath(LOGGING_PATH)) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOG.warn("SLF4J is not bound to Logback; '{}' settings are ignored", LOGGING_PATH);
            return;
        }

        final Map<String, Level> levels = requestedLevels(config.getConfig(LOGGING_PATH));
        levels.forEach((name, level) -> context.getLogger(name).setLevel(level));
        LOG.debug("Applied {} logger level(s)", levels.size());
    }

    /**
     * Collects the levels to apply, root logger first. Unknown level names are skipped.
     */
    private static Map<String, Level> requestedLevels(final Config logging) {
        final Map<String, Level> levels = new LinkedHashMap<>();
        if (logging.hasPath(DEFAULT_LEVEL_KEY)) {
            putLevel(levels, Logger.ROOT_LOGGER_NAME, logging.getString(DEFAULT_LEVEL_KEY));
        }
        if (logging.hasPath(LEVELS_KEY)) {
            for (final Map.Entry<String, ConfigValue> entry : logging.getConfig(LEVELS_KEY).root().entrySet()) {
                putLevel(levels, entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
            }
        }
        return levels;
    }

    private static void putLevel(final Map<String, Level> levels, final String loggerName, final String levelName) {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            LOG.warn("Unknown log level '{}' for logger '{}', keeping its current level", levelName, loggerName);
            return;
        }
        levels.put(loggerName, level);
    }

    /**
     * Allows the next {@link #configure(Config)} call to apply its levels again. Used by tests.
     */
    public static synchronized void reset() {
        applied = false;
    }
}
