package io.fragment.engine.core;

import io.fragment.engine.api.LifecyclePhase;

/**
 * Behaviour of the engine while it is in one lifecycle phase.
 *
 * LIFECYCLE (driven by EngineStateMachine, under its state lock):
 *   initialize() when the phase is entered
 *   run(externalCancel) from EngineStateMachine.run(), blocking for main-loop phases
 *   shutdown() when the phase is left
 *   close() once, when the engine is disposed
 *
 * One instance per phase lives for the lifetime of the engine; initialize()
 * must therefore reset all per-visit state.
 */
abstract sealed class EngineState permits StartingState, MainLoopEngineState, ExitingState {

    protected final EngineStateMachine engine;
    private volatile boolean disposed = false;

    protected EngineState(EngineStateMachine engine) {
        if (engine == null) throw new NullPointerException("engine");
        this.engine = engine;
    }

    /** Phase this state implements. */
    abstract LifecyclePhase phase();

    /** @return false if the phase cannot be entered */
    abstract boolean initialize();

    /** Stops the phase. Best effort; never fails. */
    abstract void shutdown();

    /**
     * Executes the phase.
     *
     * @param externalCancel engine-wide exit signal
     * @return false if the phase failed
     */
    abstract boolean run(CancellationSignal externalCancel);

    /** Shuts the state down for good. Idempotent. */
    final void close() {
        if (disposed) return;
        disposed = true;
        shutdown();
    }

    final boolean isDisposed() { return disposed; }
}
