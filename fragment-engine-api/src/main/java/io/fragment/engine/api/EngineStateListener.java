package io.fragment.engine.api;

/**
 * Observer of engine phase changes and exit requests.
 *
 * Listeners are invoked synchronously on the thread that performs the change,
 * in registration order. A listener that throws is logged and skipped.
 */
public interface EngineStateListener {

    /** Called before the current phase is shut down. */
    default void onStateChanging(LifecyclePhase current, LifecyclePhase target) {}

    /** Called after the new phase has been initialized. */
    default void onStateChanged(LifecyclePhase previous, LifecyclePhase current) {}

    /** Called once per run, after the exit signal has been raised. */
    default void onExitRequested() {}
}
