package io.fragment.engine.api;

/**
 * Logging contract used by all engine components.
 *
 * Components never talk to a logging backend directly. The production binding
 * is {@link Slf4jEngineLogger}; tests install a recording implementation.
 *
 * THREAD SAFETY:
 *   Implementations must accept calls from any thread. The resource scan
 *   thread and the main-loop thread log concurrently.
 */
public interface EngineLogger {

    /** Plain informational message. */
    void logMessage(String message);

    /** Status update of a subsystem, e.g. a phase change. */
    void logStatus(String message);

    void logWarning(String message, LogSeverity severity);

    void logError(String message, LogSeverity severity);

    /**
     * Logs an exception with its stack trace.
     *
     * @param message  context of the failure
     * @param cause    the exception; must not be null
     * @param severity how severe the failure is
     */
    void logException(String message, Throwable cause, LogSeverity severity);

    default void logWarning(String message) {
        logWarning(message, LogSeverity.NORMAL);
    }

    default void logError(String message) {
        logError(message, LogSeverity.NORMAL);
    }
}
