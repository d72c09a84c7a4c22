package io.fragment.engine.api;

/**
 * Severity attached to every warning, error and exception logged by the engine.
 * Ordered from least to most severe.
 */
public enum LogSeverity {
    /** Noise. Safe to ignore. */
    TRIVIAL,
    NORMAL,
    /** Likely to degrade behaviour. */
    HIGH,
    /** A subsystem can no longer continue. */
    CRITICAL,
    /** The process cannot continue. */
    FATAL;

    /** True if this severity is at least as severe as {@code other}. */
    public boolean isAtLeast(LogSeverity other) {
        return compareTo(other) >= 0;
    }
}
