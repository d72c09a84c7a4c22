package io.fragment.engine.api;

/**
 * The engine as seen by the host application.
 *
 * THREAD SAFETY:
 *   requestExit() and all property getters may be called from any thread.
 *   run() blocks its caller for the whole lifetime of the engine's main loops.
 */
public interface EngineHost {

    /**
     * Drives the engine through STARTING, LOADING, RUNNING, UNLOADING and EXITING.
     *
     * @return true if every stage succeeded
     */
    boolean run();

    /**
     * Asks the running engine to leave its main loops and exit. Idempotent.
     * Ignored if the engine is not running, already exiting, or disposed.
     */
    void requestExit();

    /** True while a run() call is in progress. */
    boolean isRunning();

    /** True once an exit has been requested during the current run. */
    boolean isExiting();

    /** True if the current phase runs a main loop. */
    boolean isInMainLoop();

    LifecyclePhase currentPhase();

    /** True once the loading phase's background resource scan has resolved. */
    boolean hasDataScanCompleted();

    /** Registers a listener; listeners are notified in registration order. */
    void addStateListener(EngineStateListener listener);

    void removeStateListener(EngineStateListener listener);
}
