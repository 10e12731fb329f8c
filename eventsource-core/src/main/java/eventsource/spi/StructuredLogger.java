package eventsource.spi;

import java.util.Map;
import java.util.logging.Level;

/**
 * Structured-log sink used by the bus, middleware and publisher for events that carry
 * machine-readable fields (event type, attempt, duration, breaker state).
 *
 * <p>The default {@link JulStructuredLogger} renders fields as {@code key=value} pairs on
 * a {@code java.util.logging} logger. Applications using another logging backend can
 * supply their own implementation through the component builders.
 */
@FunctionalInterface
public interface StructuredLogger {

    /**
     * Emits a log record.
     *
     * @param level   severity
     * @param message human-readable message
     * @param name    logger name, usually the emitting component's class name
     * @param fields  structured fields; never {@code null}, may be empty
     */
    void log(Level level, String message, String name, Map<String, ?> fields);

    /**
     * Returns whether a record at {@code level} for {@code name} would be emitted.
     * Callers use this to skip building expensive field maps.
     */
    default boolean isLoggable(Level level, String name) {
        return true;
    }

    /**
     * Returns the default JUL-backed logger.
     */
    static StructuredLogger jul() {
        return JulStructuredLogger.INSTANCE;
    }
}
