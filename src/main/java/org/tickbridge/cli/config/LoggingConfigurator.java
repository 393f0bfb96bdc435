package org.tickbridge.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

/**
 * Applies logger levels from the {@code logging} config section to Logback.
 * <pre>
 * logging {
 *   default-level = INFO
 *   levels { "org.tickbridge.runtime" = DEBUG }
 * }
 * </pre>
 * Unknown level names fall back to DEBUG, as Logback does.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @return the number of logger levels applied, including the root level
     */
    public static int configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return 0;
        }
        int applied = 0;
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(config.getString("logging.default-level")));
            applied++;
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped())));
                applied++;
            }
        }
        return applied;
    }
}
