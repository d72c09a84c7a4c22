package io.fragment.engine.core;

import io.fragment.engine.api.EngineConstants;
import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.LifecyclePhase;
import io.fragment.engine.api.LogSeverity;
import io.fragment.engine.api.UpdateResult;
import io.fragment.engine.resources.ResourceScanner;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Loading phase.
 *
 * STAGE 1 - DISCOVERY:
 *   initialize() starts ResourceScanner.scanAll() on a dedicated thread from
 *   the engine's scan thread factory. Its result lands in a single-assignment
 *   future, which is always resolved when the scan ends, including by an
 *   Error (resolved as false). While the future is unresolved, frames do nothing but report
 *   hasDataScanCompleted() == false.
 *
 * STAGE 2 - APPLICATION LOADING:
 *   On the first frame that sees the future resolved, the result is captured
 *   (cancelled or failed counts as false) and hasDataScanCompleted() turns
 *   true. From that frame on, AppLogic.updateLoadingState(scanSucceeded) is
 *   called every frame until it reports done, and the load queue is drained
 *   within the frame budget. A failed scan still proceeds into application
 *   loading; the application decides what to do without an index.
 *
 * SHUTDOWN:
 *   Cancels an unresolved future, then joins the scan thread for at most
 *   SCAN_THREAD_JOIN_TIMEOUT_MS. A thread still alive after that is detached;
 *   its late result is ignored.
 */
final class LoadingState extends MainLoopEngineState {

    private volatile CompletableFuture<Boolean> scanFuture = null;
    private volatile Thread scanThread = null;
    private volatile boolean scanning = false;
    private volatile boolean scanCompleted = false;
    private volatile boolean scanSucceeded = false;

    LoadingState(EngineStateMachine engine) {
        super(engine);
    }

    @Override
    LifecyclePhase phase() { return LifecyclePhase.LOADING; }

    /** True once a frame has observed the scan's result. */
    boolean hasDataScanCompleted() { return scanCompleted; }

    /** Result of the last resolved scan. Only meaningful once hasDataScanCompleted(). */
    boolean scanSucceeded() { return scanSucceeded; }

    @Override
    protected boolean onInitialize() {
        EngineLogger logger = engine.logger();
        ResourceScanner scanner = engine.resourceScanner();
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        scanFuture = future;
        scanCompleted = false;
        scanSucceeded = false;
        scanning = true;

        // The future resolves on every exit path, errors included.
        Runnable scan = () -> {
            boolean succeeded = false;
            try {
                succeeded = scanner.scanAll();
            } catch (RuntimeException e) {
                logger.logException("Resource scan failed", e, LogSeverity.HIGH);
            } catch (Error e) {
                logger.logException("Resource scan failed", e, LogSeverity.CRITICAL);
                throw e;
            } finally {
                future.complete(succeeded);
            }
        };

        try {
            Thread thread = engine.scanThreadFactory().newThread(scan);
            if (thread == null) {
                throw new IllegalStateException("Scan thread factory returned no thread");
            }
            thread.start();
            scanThread = thread;
        } catch (RuntimeException | OutOfMemoryError e) {
            // OutOfMemoryError here means the OS refused a native thread.
            future.cancel(false);
            scanning = false;
            logger.logException("Failed to start resource scan thread", e, LogSeverity.CRITICAL);
            return false;
        }
        logger.logStatus("Resource scan started");
        return true;
    }

    @Override
    protected boolean executeUpdateCycle(CancellationSignal internal) {
        if (scanning) {
            CompletableFuture<Boolean> future = scanFuture;
            if (!future.isDone()) {
                return true;
            }
            scanSucceeded = resultOf(future);
            scanning = false;
            scanCompleted = true;
            if (scanSucceeded) {
                engine.logger().logStatus("Resource scan completed: "
                    + engine.resourceIndex().size() + " resources");
            } else {
                engine.logger().logError("Resource scan failed; continuing with application loading",
                    LogSeverity.HIGH);
            }
        }

        UpdateResult result = engine.appLogic().updateLoadingState(scanSucceeded);
        if (result == null) {
            engine.logger().logError("Application loading returned no result", LogSeverity.HIGH);
            result = UpdateResult.failed();
        }
        engine.loadService().processPending(engine.config().loadBudgetMs());
        if (result.done()) {
            internal.cancel();
        }
        return result.success();
    }

    @Override
    protected void onShutdown() {
        CompletableFuture<Boolean> future = scanFuture;
        if (future != null && !future.isDone()) {
            future.cancel(false);
        }
        scanning = false;

        Thread thread = scanThread;
        scanThread = null;
        if (thread == null || !thread.isAlive()) return;
        try {
            thread.join(EngineConstants.SCAN_THREAD_JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            engine.logger().logWarning("Resource scan thread still running after "
                + EngineConstants.SCAN_THREAD_JOIN_TIMEOUT_MS + " ms; detaching it", LogSeverity.HIGH);
        }
    }

    private boolean resultOf(CompletableFuture<Boolean> future) {
        try {
            return Boolean.TRUE.equals(future.getNow(Boolean.FALSE));
        } catch (CancellationException | CompletionException e) {
            engine.logger().logWarning("Resource scan did not produce a result: " + e, LogSeverity.NORMAL);
            return false;
        }
    }
}
