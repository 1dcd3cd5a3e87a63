package fr.lapetina.cluster.client.infrastructure.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Locale;
import java.util.Objects;

/**
 * {@link RequestLogger} writing to an SLF4J logger at a fixed level.
 */
public final class Slf4jRequestLogger implements RequestLogger {

    private final Logger logger;
    private final Level level;

    public Slf4jRequestLogger(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "Logger is required");
        this.level = Objects.requireNonNull(level, "Level is required");
    }

    /**
     * Logs to the named SLF4J logger, e.g. {@code "cluster.client.requests"}.
     */
    public static Slf4jRequestLogger named(String loggerName, Level level) {
        return new Slf4jRequestLogger(LoggerFactory.getLogger(loggerName), level);
    }

    public static Slf4jRequestLogger info(Class<?> owner) {
        return new Slf4jRequestLogger(LoggerFactory.getLogger(owner), Level.INFO);
    }

    public static Slf4jRequestLogger trace(Class<?> owner) {
        return new Slf4jRequestLogger(LoggerFactory.getLogger(owner), Level.TRACE);
    }

    public static Slf4jRequestLogger error(Class<?> owner) {
        return new Slf4jRequestLogger(LoggerFactory.getLogger(owner), Level.ERROR);
    }

    @Override
    public void printf(String format, Object... args) {
        if (!logger.isEnabledForLevel(level)) {
            return;
        }
        logger.atLevel(level).log(String.format(Locale.ROOT, format, args));
    }

    public Level getLevel() {
        return level;
    }
}
