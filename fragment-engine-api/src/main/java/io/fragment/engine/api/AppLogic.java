package io.fragment.engine.api;

/**
 * Application-specific logic driven by the engine.
 *
 * The engine calls initialize() once on construction and shutdown() once on
 * close. All other callbacks arrive on the main-loop thread, one phase at a time.
 *
 * CALLBACK ORDER PER RUNNING FRAME:
 *   updateRunningInput() -> updateRunningUpdate() -> updateRunningDraw()
 */
public interface AppLogic {

    /**
     * Binds the application to its engine.
     *
     * @return false to abort engine construction
     */
    boolean initialize(EngineHost engine);

    /** Releases application resources. Called after all engine systems have stopped. */
    void shutdown();

    /**
     * Called before the engine leaves {@code current}.
     *
     * @return false to report that the application failed to prepare for the change
     */
    boolean onEngineStateChanging(LifecyclePhase current, LifecyclePhase target);

    /**
     * Called after the engine has entered {@code current}.
     *
     * @return false to fail the transition
     */
    boolean onEngineStateChanged(LifecyclePhase previous, LifecyclePhase current);

    /**
     * One frame of application loading. Only called once the resource scan has
     * resolved.
     *
     * @param hasDataScanCompleted true if the scan succeeded and the resource
     *                             index can be queried; false if it failed
     */
    UpdateResult updateLoadingState(boolean hasDataScanCompleted);

    /** One frame of application unloading. */
    UpdateResult updateUnloadingState();

    boolean updateRunningInput();

    boolean updateRunningUpdate();

    boolean updateRunningDraw();
}
