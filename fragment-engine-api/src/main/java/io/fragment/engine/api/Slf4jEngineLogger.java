package io.fragment.engine.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Production implementation of EngineLogger that emits logs via SLF4J.
 *
 * Every warning, error and exception carries a marker named after its
 * {@link LogSeverity}, so backends can filter or route by severity.
 * TRIVIAL warnings are demoted to DEBUG.
 */
public final class Slf4jEngineLogger implements EngineLogger {

    private static final Map<LogSeverity, Marker> MARKERS = new EnumMap<>(LogSeverity.class);

    static {
        for (LogSeverity severity : LogSeverity.values()) {
            MARKERS.put(severity, MarkerFactory.getMarker(severity.name()));
        }
    }

    private final Logger log;

    /** Logs under the engine's default logger name. */
    public Slf4jEngineLogger() {
        this(LoggerFactory.getLogger("io.fragment.engine"));
    }

    public Slf4jEngineLogger(Logger log) {
        if (log == null) throw new NullPointerException("log");
        this.log = log;
    }

    @Override
    public void logMessage(String message) {
        log.info(message);
    }

    @Override
    public void logStatus(String message) {
        log.info("[status] {}", message);
    }

    @Override
    public void logWarning(String message, LogSeverity severity) {
        Marker marker = MARKERS.get(severity);
        if (severity == LogSeverity.TRIVIAL) {
            log.debug(marker, message);
        } else {
            log.warn(marker, message);
        }
    }

    @Override
    public void logError(String message, LogSeverity severity) {
        log.error(MARKERS.get(severity), "[{}] {}", severity, message);
    }

    @Override
    public void logException(String message, Throwable cause, LogSeverity severity) {
        log.error(MARKERS.get(severity), "[" + severity + "] " + message, cause);
    }
}
