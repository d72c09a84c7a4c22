package io.fragment.engine.core;

import io.fragment.engine.api.AppLogic;
import io.fragment.engine.api.EngineConstants;
import io.fragment.engine.api.EngineHost;
import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.EngineStateListener;
import io.fragment.engine.api.LifecyclePhase;
import io.fragment.engine.api.LogSeverity;
import io.fragment.engine.api.PlatformInfo;
import io.fragment.engine.api.Slf4jEngineLogger;
import io.fragment.engine.resources.AssetDirectoryManifestSource;
import io.fragment.engine.resources.EmbeddedManifestSource;
import io.fragment.engine.resources.LoadPriorityQueue;
import io.fragment.engine.resources.ManifestSource;
import io.fragment.engine.resources.ResourceImporter;
import io.fragment.engine.resources.ResourceIndex;
import io.fragment.engine.resources.ResourceLoadService;
import io.fragment.engine.resources.ResourceScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * The engine: owns the lifecycle phase, validates transitions and drives the
 * phases of a run.
 *
 * RUN SEQUENCE:
 *   STARTING -> LOADING -> RUNNING -> UNLOADING -> EXITING
 *   Each stage enters its phase with setState() and then runs the phase's
 *   state. Results are ANDed; later stages are attempted after earlier
 *   failures. LOADING requires a successful STARTING, RUNNING and UNLOADING
 *   require a successful LOADING, EXITING is always attempted. A stage that an
 *   exit redirect has already moved past is skipped.
 *
 * EXIT REQUESTS:
 *   requestExit() raises the run's exit signal. Main loops observe it once per
 *   frame. While it is raised, setState() redirects targets: from LOADING or
 *   RUNNING to UNLOADING, from STARTING to EXITING. The redirected edges
 *   LOADING -> UNLOADING and STARTING -> EXITING are accepted only in that case.
 *   UNLOADING runs with a signal that is never raised, so the application's
 *   unloading logic always gets to finish.
 *
 * TRANSITIONS:
 *   setState() holds the state lock for its whole duration, so transitions are
 *   serialized and a phase is never observed half-applied. Sequence:
 *     pre-change notification (AppLogic, then listeners in registration order)
 *     -> shut down the current state -> mutate the phase
 *     -> initialize the new state -> post-change notification.
 *   Shutting down a state never fails. A state that fails to initialize, or an
 *   AppLogic that rejects the new phase, fails the call at CRITICAL severity.
 *
 * THREAD SAFETY:
 *   run() blocks its calling thread, which becomes the main-loop thread.
 *   requestExit(), close() and all getters are safe from any thread.
 */
public final class EngineStateMachine implements EngineHost, AutoCloseable {

    // ── Collaborators ─────────────────────────────────────────────────────

    private final AppLogic appLogic;
    private final EngineConfig config;
    private final EngineLogger logger;
    private final PlatformInfo platform;
    private final WindowService windowService;
    private final InputService inputService;
    private final TimeService timeService;
    private final ThreadFactory scanThreadFactory;

    // ── Resources ─────────────────────────────────────────────────────────

    private final ResourceIndex resourceIndex;
    private final ResourceScanner resourceScanner;
    private final ResourceLoadService loadService;

    // ── States ────────────────────────────────────────────────────────────

    private final StartingState startingState;
    private final LoadingState loadingState;
    private final RunningState runningState;
    private final UnloadingState unloadingState;
    private final ExitingState exitingState;

    // ── Lifecycle ─────────────────────────────────────────────────────────

    private final ReentrantLock stateLock = new ReentrantLock();
    private final CopyOnWriteArrayList<EngineStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile LifecyclePhase phase = LifecyclePhase.NONE;
    private volatile EngineState currentState = null;
    private volatile CancellationSignal exitSignal = new CancellationSignal();
    private volatile boolean running = false;
    private volatile boolean disposed = false;

    // ── Construction ──────────────────────────────────────────────────────

    private EngineStateMachine(Builder builder) {
        this.appLogic = builder.appLogic;
        this.logger = builder.logger != null ? builder.logger : new Slf4jEngineLogger();
        this.config = builder.config != null ? builder.config : new EngineConfigReader(logger).load();
        this.platform = builder.platform != null
            ? builder.platform
            : PlatformInfo.detect(config.preferNativeGraphicsApi());
        this.windowService = builder.windowService != null ? builder.windowService : WindowService.headless();
        this.inputService = builder.inputService != null ? builder.inputService : InputService.none();
        this.scanThreadFactory = builder.scanThreadFactory != null
            ? builder.scanThreadFactory
            : EngineStateMachine::newScanThread;
        this.timeService = new TimeService(logger, config.targetFrameRate());

        List<ManifestSource> sources = builder.manifestSources != null
            ? builder.manifestSources
            : defaultManifestSources(config, appLogic);
        this.resourceIndex = new ResourceIndex(logger, config.lockTimeoutMs());
        this.resourceScanner = new ResourceScanner(resourceIndex, sources, platform, logger);
        this.loadService = new ResourceLoadService(
            resourceIndex,
            new LoadPriorityQueue(logger, config.lockTimeoutMs()),
            builder.importer != null ? builder.importer : ResourceImporter.discarding(),
            logger);

        this.startingState = new StartingState(this);
        this.loadingState = new LoadingState(this);
        this.runningState = new RunningState(this);
        this.unloadingState = new UnloadingState(this);
        this.exitingState = new ExitingState(this);

        boolean initialized;
        try {
            initialized = appLogic.initialize(this);
        } catch (RuntimeException e) {
            disposed = true;
            throw new EngineException("Application logic failed to initialize", e);
        }
        if (!initialized) {
            disposed = true;
            throw new EngineException("Application logic failed to initialize");
        }
        logger.logStatus(EngineConstants.ENGINE_NAME + " created");
    }

    private static List<ManifestSource> defaultManifestSources(EngineConfig config, AppLogic appLogic) {
        List<ManifestSource> sources = new ArrayList<>(3);
        if (config.scanEmbeddedResources()) {
            sources.add(EmbeddedManifestSource.forClass(EngineStateMachine.class));
            sources.add(EmbeddedManifestSource.forClass(appLogic.getClass()));
        }
        sources.add(new AssetDirectoryManifestSource(config.assetsRoot()));
        return sources;
    }

    private static Thread newScanThread(Runnable task) {
        Thread thread = new Thread(task, "fragment-resource-scan");
        thread.setDaemon(true);
        return thread;
    }

    // ── Run ───────────────────────────────────────────────────────────────

    @Override
    public boolean run() {
        stateLock.lock();
        try {
            if (disposed) {
                logger.logError("Cannot run a disposed engine", LogSeverity.HIGH);
                return false;
            }
            if (running) {
                logger.logError("Engine is already running", LogSeverity.NORMAL);
                return false;
            }
            if (isExiting() && phase != LifecyclePhase.EXITING) {
                logger.logError("Engine is still exiting from phase " + phase, LogSeverity.HIGH);
                return false;
            }
            exitSignal = new CancellationSignal();
            if (phase == LifecyclePhase.EXITING && !setState(LifecyclePhase.NONE)) {
                return false;
            }
            running = true;
        } finally {
            stateLock.unlock();
        }

        boolean success = true;
        try {
            boolean started = enterAndRun(LifecyclePhase.STARTING);
            success &= started;

            boolean loaded = false;
            if (started) {
                loaded = enterAndRun(LifecyclePhase.LOADING);
                success &= loaded;
            }
            if (loaded) {
                success &= enterAndRun(LifecyclePhase.RUNNING);
                success &= enterAndRun(LifecyclePhase.UNLOADING);
            }
        } finally {
            running = false;
        }
        success &= enterExiting();

        if (!success) {
            logger.logError("Engine run finished with errors", LogSeverity.HIGH);
        }
        return success;
    }

    private boolean enterAndRun(LifecyclePhase target) {
        if (phase.ordinal() > target.ordinal()) {
            // an exit redirect already moved past this stage
            return true;
        }
        if (!setState(target)) {
            logger.logError("Failed to enter " + target + " phase", LogSeverity.HIGH);
            return false;
        }
        if (phase != target) {
            // redirected by an exit request; the phase was skipped
            return true;
        }
        CancellationSignal signal = target == LifecyclePhase.UNLOADING
            ? CancellationSignal.never()
            : exitSignal;
        boolean ok = currentState.run(signal);
        if (!ok) {
            logger.logError(target + " phase failed", LogSeverity.HIGH);
        }
        return ok;
    }

    private boolean enterExiting() {
        exitSignal.cancel();
        if (phase != LifecyclePhase.EXITING && !setState(LifecyclePhase.EXITING)) {
            logger.logError("Failed to enter EXITING phase", LogSeverity.HIGH);
            return false;
        }
        // A redirect out of LOADING stops in UNLOADING first.
        if (phase == LifecyclePhase.UNLOADING && !setState(LifecyclePhase.EXITING)) {
            logger.logError("Failed to enter EXITING phase", LogSeverity.HIGH);
            return false;
        }
        if (phase != LifecyclePhase.EXITING) {
            logger.logError("Engine could not reach EXITING from " + phase, LogSeverity.HIGH);
            return false;
        }
        return exitingState.run(exitSignal);
    }

    // ── Exit ──────────────────────────────────────────────────────────────

    @Override
    public void requestExit() {
        if (disposed || !running || isExiting()) return;
        stateLock.lock();
        try {
            if (isExiting()) return;
            exitSignal.cancel();
        } finally {
            stateLock.unlock();
        }
        logger.logStatus("Exit requested in phase " + phase);
        notifyListeners(EngineStateListener::onExitRequested);
    }

    // ── Transitions ───────────────────────────────────────────────────────

    /**
     * Moves the engine to {@code target}, subject to exit redirection and the
     * transition table.
     *
     * @return true if the engine is in the (possibly redirected) target phase
     *         and its state initialized
     */
    public boolean setState(LifecyclePhase target) {
        if (target == null) throw new NullPointerException("target");
        stateLock.lock();
        try {
            if (disposed) {
                logger.logError("Cannot change phase of a disposed engine", LogSeverity.HIGH);
                return false;
            }
            LifecyclePhase current = phase;
            boolean exiting = isExiting();

            if (exiting) {
                LifecyclePhase redirected = exitRedirect(current, target);
                if (redirected != target) {
                    logger.logWarning("Exit requested; redirecting " + current + " -> " + target
                        + " to " + redirected, LogSeverity.NORMAL);
                    target = redirected;
                }
            }
            if (target == current) {
                logger.logWarning("Engine is already in phase " + current, LogSeverity.TRIVIAL);
                return true;
            }
            boolean exitAbort = exiting && isExitAbortEdge(current, target);
            if (!current.canTransitionTo(target) && !exitAbort) {
                logger.logError("Illegal engine phase transition " + current + " -> " + target,
                    LogSeverity.NORMAL);
                return false;
            }

            endCurrentState(current, target);
            phase = target;
            currentState = stateFor(target);
            if (config.collectGarbageOnStateChange()) {
                System.gc();
            }
            return startNewState(current, target);
        } finally {
            stateLock.unlock();
        }
    }

    private static LifecyclePhase exitRedirect(LifecyclePhase current, LifecyclePhase target) {
        return switch (current) {
            case LOADING, RUNNING -> LifecyclePhase.UNLOADING;
            case STARTING -> LifecyclePhase.EXITING;
            default -> target;
        };
    }

    private static boolean isExitAbortEdge(LifecyclePhase current, LifecyclePhase target) {
        return (current == LifecyclePhase.LOADING && target == LifecyclePhase.UNLOADING)
            || (current == LifecyclePhase.STARTING && target == LifecyclePhase.EXITING);
    }

    private EngineState stateFor(LifecyclePhase target) {
        return switch (target) {
            case NONE -> null;
            case STARTING -> startingState;
            case LOADING -> loadingState;
            case RUNNING -> runningState;
            case UNLOADING -> unloadingState;
            case EXITING -> exitingState;
        };
    }

    private void endCurrentState(LifecyclePhase current, LifecyclePhase target) {
        boolean appReady;
        try {
            appReady = appLogic.onEngineStateChanging(current, target);
        } catch (RuntimeException e) {
            logger.logException("Application logic failed before " + current + " -> " + target,
                e, LogSeverity.HIGH);
            appReady = false;
        }
        if (!appReady) {
            logger.logWarning("Application logic was not ready to leave " + current, LogSeverity.HIGH);
        }
        notifyListeners(l -> l.onStateChanging(current, target));

        if (target == LifecyclePhase.EXITING && !isExiting()) {
            exitSignal.cancel();
        }
        EngineState state = currentState;
        if (state != null) {
            state.shutdown();
        }
    }

    private boolean startNewState(LifecyclePhase previous, LifecyclePhase target) {
        EngineState state = currentState;
        if (state != null && !state.initialize()) {
            logger.logError("Failed to initialize " + target + " state", LogSeverity.CRITICAL);
            return false;
        }
        logger.logStatus("Engine phase changed: " + previous + " -> " + target);

        boolean appAccepted;
        try {
            appAccepted = appLogic.onEngineStateChanged(previous, target);
        } catch (RuntimeException e) {
            logger.logException("Application logic failed after " + previous + " -> " + target,
                e, LogSeverity.CRITICAL);
            appAccepted = false;
        }
        notifyListeners(l -> l.onStateChanged(previous, target));

        if (!appAccepted) {
            logger.logError("Application logic rejected phase " + target, LogSeverity.CRITICAL);
            return false;
        }
        return true;
    }

    private void notifyListeners(Consumer<EngineStateListener> call) {
        for (EngineStateListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                logger.logException("Engine state listener failed", e, LogSeverity.NORMAL);
            }
        }
    }

    // ── Listener management ───────────────────────────────────────────────

    @Override
    public void addStateListener(EngineStateListener listener) {
        if (listener != null) listeners.add(listener);
    }

    @Override
    public void removeStateListener(EngineStateListener listener) {
        listeners.remove(listener);
    }

    // ── Disposal ──────────────────────────────────────────────────────────

    /**
     * Stops the engine for good: requests an exit, shuts down every state,
     * cancels pending loads and shuts down the application logic. Idempotent.
     */
    @Override
    public void close() {
        if (disposed) return;
        requestExit();
        stateLock.lock();
        try {
            if (disposed) return;
            disposed = true;
            startingState.close();
            loadingState.close();
            runningState.close();
            unloadingState.close();
            exitingState.close();
        } finally {
            stateLock.unlock();
        }
        loadService.queue().clear();
        try {
            appLogic.shutdown();
        } catch (RuntimeException e) {
            logger.logException("Application logic failed to shut down", e, LogSeverity.HIGH);
        }
        logger.logStatus("Engine disposed");
    }

    // ── Properties ────────────────────────────────────────────────────────

    @Override public boolean isRunning() { return running; }
    @Override public boolean isExiting() { return exitSignal.isCancelled(); }
    @Override public boolean isInMainLoop() { return phase.isMainLoopPhase(); }
    @Override public LifecyclePhase currentPhase() { return phase; }
    @Override public boolean hasDataScanCompleted() { return loadingState.hasDataScanCompleted(); }

    public boolean isDisposed() { return disposed; }

    public EngineConfig config() { return config; }
    public EngineLogger logger() { return logger; }
    public PlatformInfo platform() { return platform; }
    public TimeService timeService() { return timeService; }
    public ResourceIndex resourceIndex() { return resourceIndex; }

    /** Entry point for the application to request resource loads. */
    public ResourceLoadService loadService() { return loadService; }

    AppLogic appLogic() { return appLogic; }
    WindowService windowService() { return windowService; }
    InputService inputService() { return inputService; }
    ResourceScanner resourceScanner() { return resourceScanner; }
    ThreadFactory scanThreadFactory() { return scanThreadFactory; }

    // ── Builder ───────────────────────────────────────────────────────────

    /**
     * @param appLogic application driven by the engine; must not be null
     */
    public static Builder builder(AppLogic appLogic) {
        return new Builder(appLogic);
    }

    public static final class Builder {
        private final AppLogic appLogic;
        private EngineConfig config;
        private EngineLogger logger;
        private PlatformInfo platform;
        private WindowService windowService;
        private InputService inputService;
        private ResourceImporter importer;
        private ThreadFactory scanThreadFactory;
        private List<ManifestSource> manifestSources;

        private Builder(AppLogic appLogic) {
            if (appLogic == null) throw new NullPointerException("appLogic");
            this.appLogic = appLogic;
        }

        /**
         * Overrides the configuration. Without it the engine loads the file
         * named by {@link EngineConfigReader#configuredPath()}, falling back
         * to defaults when there is none.
         */
        public Builder config(EngineConfig config) { this.config = config; return this; }
        public Builder logger(EngineLogger logger) { this.logger = logger; return this; }

        /** Overrides platform detection. */
        public Builder platform(PlatformInfo platform) { this.platform = platform; return this; }
        public Builder windowService(WindowService service) { this.windowService = service; return this; }
        public Builder inputService(InputService service) { this.inputService = service; return this; }
        public Builder importer(ResourceImporter importer) { this.importer = importer; return this; }
        public Builder scanThreadFactory(ThreadFactory factory) { this.scanThreadFactory = factory; return this; }

        /**
         * Replaces the default discovery sources (engine bundle, application
         * bundle, assets root) with {@code sources}, scanned in list order.
         */
        public Builder manifestSources(List<ManifestSource> sources) {
            this.manifestSources = sources != null ? List.copyOf(sources) : null;
            return this;
        }

        /**
         * @throws EngineException if the application logic fails to initialize,
         *                         or the configuration file exists but is unusable
         */
        public EngineStateMachine build() {
            return new EngineStateMachine(this);
        }
    }
}
