package io.fragment.engine.api;

/**
 * Lifecycle phases of the engine. Exactly one phase is active at any instant.
 *
 * TRANSITIONS:
 *   NONE -> STARTING -> LOADING -> RUNNING -> UNLOADING -> EXITING -> NONE
 *   Every other direct transition is illegal. A transition to the current
 *   phase is a legal no-op and is accepted by {@link #canTransitionTo}.
 *
 * MAIN LOOP:
 *   LOADING, RUNNING and UNLOADING each run a per-frame main loop on the
 *   thread that called the engine's run() method.
 */
public enum LifecyclePhase {

    /** Engine constructed but never started, or reset after exiting. */
    NONE,
    /** Platform and services are being brought up. No main loop. */
    STARTING,
    /** Resource discovery and application loading. Main loop. */
    LOADING,
    /** Normal gameplay frames. Main loop. */
    RUNNING,
    /** Application unloading. Main loop. */
    UNLOADING,
    /** Final teardown. No main loop. */
    EXITING;

    /**
     * Returns the one phase this phase may advance to.
     */
    public LifecyclePhase next() {
        return switch (this) {
            case NONE      -> STARTING;
            case STARTING  -> LOADING;
            case LOADING   -> RUNNING;
            case RUNNING   -> UNLOADING;
            case UNLOADING -> EXITING;
            case EXITING   -> NONE;
        };
    }

    /**
     * Returns true if the engine may move directly from this phase to {@code target}.
     *
     * @param target destination phase; must not be null
     */
    public boolean canTransitionTo(LifecyclePhase target) {
        if (target == null) throw new NullPointerException("target");
        return target == this || target == next();
    }

    /** True for the phases that run a per-frame main loop. */
    public boolean isMainLoopPhase() {
        return this == LOADING || this == RUNNING || this == UNLOADING;
    }
}
