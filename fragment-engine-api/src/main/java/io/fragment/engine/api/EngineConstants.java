package io.fragment.engine.api;

/**
 * Global constants for the Fragment engine core.
 *
 * Timing constants bound every internal wait. No engine thread ever blocks
 * on a lock or a background task for longer than these values.
 */
public final class EngineConstants {

    private EngineConstants() {}

    // -- Identity -------------------------------------------------------------

    public static final String ENGINE_NAME = "Fragment Engine";

    public static final String ENGINE_VERSION = "0.1.0";

    // -- Timing ---------------------------------------------------------------

    /** Default target frame rate of every main loop. */
    public static final int DEFAULT_TARGET_FRAME_RATE = 60;

    /** Upper bound for the target frame rate accepted by the configuration. */
    public static final int MAX_TARGET_FRAME_RATE = 1_000;

    /** Number of frames averaged for the smoothed frame rate. */
    public static final int FRAME_RATE_SAMPLE_COUNT = 10;

    /** Default bounded wait for every reader-writer lock, in milliseconds. */
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 100L;

    /**
     * Polls made by a main-loop state's shutdown while waiting for its loop to
     * leave. Total wait = SHUTDOWN_POLL_ATTEMPTS * SHUTDOWN_POLL_INTERVAL_MS.
     */
    public static final int SHUTDOWN_POLL_ATTEMPTS = 50;

    public static final long SHUTDOWN_POLL_INTERVAL_MS = 10L;

    /** Bounded join on the resource scan thread before it is detached. */
    public static final long SCAN_THREAD_JOIN_TIMEOUT_MS = 500L;

    /** Default per-frame time budget for draining the load queue, in milliseconds. */
    public static final double DEFAULT_LOAD_BUDGET_MS = 2.0;

    static {
        validate();
    }

    /**
     * Validates constant relationships. Called once from the static initializer.
     * Throws IllegalStateException if any invariant is violated.
     */
    static void validate() {
        if (DEFAULT_TARGET_FRAME_RATE <= 0 || DEFAULT_TARGET_FRAME_RATE > MAX_TARGET_FRAME_RATE) {
            throw new IllegalStateException(
                "DEFAULT_TARGET_FRAME_RATE must be in (0, MAX_TARGET_FRAME_RATE]");
        }
        if (FRAME_RATE_SAMPLE_COUNT < 1) {
            throw new IllegalStateException("FRAME_RATE_SAMPLE_COUNT must be >= 1");
        }
        if (SHUTDOWN_POLL_ATTEMPTS < 1 || SHUTDOWN_POLL_INTERVAL_MS < 1) {
            throw new IllegalStateException("Shutdown polling must make at least one 1 ms poll");
        }
        if (DEFAULT_LOCK_TIMEOUT_MS <= 0) {
            throw new IllegalStateException("DEFAULT_LOCK_TIMEOUT_MS must be > 0");
        }
    }
}
