package io.fragment.engine.core;

import io.fragment.engine.api.AppLogic;
import io.fragment.engine.api.LifecyclePhase;

/**
 * Gameplay phase. Every frame runs the application's input, update and draw
 * callbacks in that order, then drains the load queue within the frame budget.
 * Ends only on an exit request, an error, or engine disposal.
 */
final class RunningState extends MainLoopEngineState {

    RunningState(EngineStateMachine engine) {
        super(engine);
    }

    @Override
    LifecyclePhase phase() { return LifecyclePhase.RUNNING; }

    @Override
    protected boolean executeUpdateCycle(CancellationSignal internal) {
        AppLogic app = engine.appLogic();
        boolean ok = app.updateRunningInput();
        ok &= app.updateRunningUpdate();
        ok &= app.updateRunningDraw();
        engine.loadService().processPending(engine.config().loadBudgetMs());
        return ok;
    }
}
