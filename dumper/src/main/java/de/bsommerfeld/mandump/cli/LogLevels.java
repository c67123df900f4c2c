package de.bsommerfeld.mandump.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Applies the {@code --log-level} option to the Logback root logger.
 */
final class LogLevels {

    private LogLevels() {}

    /**
     * Parses a level name, case-insensitively: {@code off}, {@code error}, {@code warn},
     * {@code info}, {@code debug} or {@code trace}.
     *
     * @throws IllegalArgumentException for any other name
     */
    static Level parse(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "off":
                return Level.OFF;
            case "error":
                return Level.ERROR;
            case "warn":
            case "warning":
                return Level.WARN;
            case "info":
                return Level.INFO;
            case "debug":
                return Level.DEBUG;
            case "trace":
                return Level.TRACE;
            default:
                throw new IllegalArgumentException("unknown log level: " + name);
        }
    }

    static void apply(Level level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
    }
}
