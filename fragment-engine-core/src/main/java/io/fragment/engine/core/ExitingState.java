package io.fragment.engine.core;

import io.fragment.engine.api.LifecyclePhase;
import io.fragment.engine.api.LogSeverity;

/**
 * Final phase of a run. Drops all pending load requests; no main loop.
 */
final class ExitingState extends EngineState {

    ExitingState(EngineStateMachine engine) {
        super(engine);
    }

    @Override
    LifecyclePhase phase() { return LifecyclePhase.EXITING; }

    @Override
    boolean initialize() {
        if (isDisposed()) {
            engine.logger().logError("Cannot initialize disposed EXITING state", LogSeverity.HIGH);
            return false;
        }
        return true;
    }

    @Override
    void shutdown() {}

    @Override
    boolean run(CancellationSignal externalCancel) {
        int dropped = engine.loadService().queue().clear();
        boolean cleared = dropped >= 0;
        if (!cleared) {
            engine.logger().logError("Could not drop pending resource loads; load queue is locked",
                LogSeverity.HIGH);
        } else if (dropped > 0) {
            engine.logger().logMessage("Dropped " + dropped + " pending resource loads");
        }
        engine.logger().logStatus("# Exiting");
        return cleared;
    }
}
