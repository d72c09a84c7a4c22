package io.fragment.engine.core;

import io.fragment.engine.api.LifecyclePhase;
import io.fragment.engine.api.LogSeverity;
import io.fragment.engine.api.UpdateResult;

/**
 * Unloading phase. Calls the application's unloading logic every frame until
 * it reports completion.
 */
final class UnloadingState extends MainLoopEngineState {

    UnloadingState(EngineStateMachine engine) {
        super(engine);
    }

    @Override
    LifecyclePhase phase() { return LifecyclePhase.UNLOADING; }

    @Override
    protected boolean executeUpdateCycle(CancellationSignal internal) {
        UpdateResult result = engine.appLogic().updateUnloadingState();
        if (result == null) {
            engine.logger().logError("Application unloading returned no result", LogSeverity.HIGH);
            result = UpdateResult.failed();
        }
        if (result.done()) {
            internal.cancel();
        }
        return result.success();
    }
}
