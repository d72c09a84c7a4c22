package io.fragment.engine.core;

import io.fragment.engine.api.EngineConstants;
import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.LogSeverity;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Base implementation of the loop-bearing phases (LOADING, RUNNING, UNLOADING).
 *
 * FRAME SEQUENCE:
 *   window pump -> TimeService.beginFrame() -> input update
 *   -> executeUpdateCycle() -> TimeService.endFrame() -> sleep
 *
 * The loop ends as soon as the external signal, the internal signal, engine
 * disposal or a stopped engine is observed at the top of a frame. Subclasses
 * finish their phase by cancelling the internal signal passed to
 * executeUpdateCycle().
 *
 * An exception escaping a frame is logged at CRITICAL, cancels the internal
 * signal and makes run() return false. It is never rethrown.
 *
 * THREAD SAFETY:
 *   run() executes on the engine's main thread. shutdown() may be called from
 *   another thread; it cancels the internal signal and polls for the loop to
 *   leave for at most SHUTDOWN_POLL_ATTEMPTS * SHUTDOWN_POLL_INTERVAL_MS, then
 *   proceeds regardless.
 */
abstract sealed class MainLoopEngineState extends EngineState
        permits LoadingState, RunningState, UnloadingState {

    private volatile CancellationSignal internalCancel = null;
    private volatile boolean loopRunning = false;
    private volatile Thread loopThread = null;

    protected MainLoopEngineState(EngineStateMachine engine) {
        super(engine);
    }

    @Override
    final boolean initialize() {
        EngineLogger logger = engine.logger();
        if (isDisposed()) {
            logger.logError("Cannot initialize disposed " + phase() + " state", LogSeverity.HIGH);
            return false;
        }
        if (engine.isDisposed()) {
            logger.logError("Cannot initialize " + phase() + " state of a disposed engine", LogSeverity.HIGH);
            return false;
        }
        if (!engine.currentPhase().isMainLoopPhase()) {
            logger.logError("Cannot initialize " + phase() + " state while engine is in phase "
                + engine.currentPhase(), LogSeverity.HIGH);
            return false;
        }
        if (loopRunning) {
            logger.logError(phase() + " main loop is already running", LogSeverity.HIGH);
            return false;
        }
        internalCancel = new CancellationSignal();
        return onInitialize();
    }

    @Override
    final void shutdown() {
        CancellationSignal signal = internalCancel;
        if (signal != null) signal.cancel();
        awaitLoopExit();
        onShutdown();
    }

    @Override
    final boolean run(CancellationSignal externalCancel) {
        if (externalCancel == null) throw new NullPointerException("externalCancel");
        EngineLogger logger = engine.logger();
        CancellationSignal internal = internalCancel;
        if (internal == null || isDisposed()) {
            logger.logError("Cannot run " + phase() + " main loop; state is not initialized", LogSeverity.HIGH);
            return false;
        }
        if (loopRunning) {
            logger.logError(phase() + " main loop is already running", LogSeverity.HIGH);
            return false;
        }

        loopThread = Thread.currentThread();
        loopRunning = true;
        boolean success = true;
        try {
            while (!externalCancel.isCancelled()
                    && !internal.isCancelled()
                    && !engine.isDisposed()
                    && engine.isRunning()) {
                success &= runFrame(internal);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.logException(phase() + " main loop interrupted", e, LogSeverity.CRITICAL);
            internal.cancel();
            success = false;
        } catch (Exception e) {
            logger.logException("Unhandled exception in " + phase() + " main loop", e, LogSeverity.CRITICAL);
            internal.cancel();
            success = false;
        } finally {
            loopRunning = false;
            loopThread = null;
        }
        return success;
    }

    /** True while run() is inside its loop. */
    final boolean isLoopRunning() { return loopRunning; }

    private boolean runFrame(CancellationSignal internal) throws InterruptedException {
        TimeService time = engine.timeService();

        boolean frameOk = engine.windowService().update();
        time.beginFrame();
        frameOk &= engine.inputService().update();
        frameOk &= executeUpdateCycle(internal);
        Duration sleep = time.endFrame();

        if (!sleep.isZero()) {
            TimeUnit.NANOSECONDS.sleep(sleep.toNanos());
        }
        return frameOk;
    }

    private void awaitLoopExit() {
        if (!loopRunning || Thread.currentThread() == loopThread) return;
        for (int i = 0; i < EngineConstants.SHUTDOWN_POLL_ATTEMPTS && loopRunning; i++) {
            try {
                Thread.sleep(EngineConstants.SHUTDOWN_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (loopRunning) {
            engine.logger().logWarning(phase() + " main loop did not exit within "
                + EngineConstants.SHUTDOWN_POLL_ATTEMPTS * EngineConstants.SHUTDOWN_POLL_INTERVAL_MS
                + " ms; continuing shutdown", LogSeverity.HIGH);
        }
    }

    /**
     * Phase-specific work of one frame.
     *
     * @param internal cancel this to end the loop after the current frame
     * @return false if the frame failed
     */
    protected abstract boolean executeUpdateCycle(CancellationSignal internal);

    /** Called at the end of a successful initialize(). Default: succeeds. */
    protected boolean onInitialize() { return true; }

    /** Called at the end of shutdown(). Default: no-op. */
    protected void onShutdown() {}
}
