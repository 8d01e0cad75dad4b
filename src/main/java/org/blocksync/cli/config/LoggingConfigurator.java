package org.blocksync.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the log levels from the {@code logging.levels} block of the configuration.
 * <p>
 * Keys are logger names, values are Logback level names; the key {@code root} addresses the
 * root logger. Keys containing dots must be quoted in HOCON:
 * <pre>
 * logging.levels {
 *   root = WARN
 *   "org.blocksync.compiler" = DEBUG
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.warn("Logback is not the active SLF4J binding; ignoring logging.levels");
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
            String loggerName = "root".equalsIgnoreCase(entry.getKey())
                    ? Logger.ROOT_LOGGER_NAME
                    : entry.getKey();
            String levelName = String.valueOf(entry.getValue().unwrapped());
            Level level = Level.toLevel(levelName, null);
            if (level == null) {
                log.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
        }
    }
}
