package io.fragment.engine.test;

import io.fragment.engine.api.EngineStateListener;
import io.fragment.engine.api.GraphicsBackend;
import io.fragment.engine.api.LifecyclePhase;
import io.fragment.engine.api.LogSeverity;
import io.fragment.engine.api.OperatingSystemType;
import io.fragment.engine.api.PlatformInfo;
import io.fragment.engine.api.UpdateResult;
import io.fragment.engine.core.EngineConfig;
import io.fragment.engine.core.EngineConfigReader;
import io.fragment.engine.core.EngineException;
import io.fragment.engine.core.EngineStateMachine;
import io.fragment.engine.core.HeadlessWindowService;
import io.fragment.engine.resources.ManifestSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static io.fragment.engine.api.LifecyclePhase.*;
import static org.assertj.core.api.Assertions.*;

@Timeout(value = 20, unit = TimeUnit.SECONDS)
class EngineStateMachineTest {

    static final PlatformInfo LINUX_VULKAN =
        new PlatformInfo(OperatingSystemType.LINUX, GraphicsBackend.VULKAN);

    private RecordingEngineLogger logger;
    private ScriptedAppLogic app;
    private List<String> listenerEvents;
    private EngineStateMachine engine;

    @BeforeEach
    void setUp() {
        logger = new RecordingEngineLogger();
        app = new ScriptedAppLogic();
        listenerEvents = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) engine.close();
    }

    // ── Construction ──────────────────────────────────────────────────────

    @Test
    void constructionInitializesTheApplication() {
        engine = newEngine();
        assertThat(app.engine).isSameAs(engine);
        assertThat(engine.currentPhase()).isEqualTo(NONE);
        assertThat(engine.isRunning()).isFalse();
        assertThat(engine.isExiting()).isFalse();
        assertThat(engine.isInMainLoop()).isFalse();
    }

    @Test
    void applicationInitializeFailureAbortsConstruction() {
        app.initializeResult = false;
        assertThatThrownBy(this::newEngine).isInstanceOf(EngineException.class);
    }

    @Test
    void nullAppLogicThrows() {
        assertThatThrownBy(() -> EngineStateMachine.builder(null))
            .isInstanceOf(NullPointerException.class);
    }

    // ── setState ──────────────────────────────────────────────────────────

    @Test
    void settingTheCurrentPhaseIsANoOpWithoutNotifications() {
        engine = newEngine();
        app.events.clear();

        assertThat(engine.setState(NONE)).isTrue();

        assertThat(app.events).isEmpty();
        assertThat(listenerEvents).isEmpty();
        assertThat(logger.warnings()).anySatisfy(w -> assertThat(w.message()).contains("already in phase"));
    }

    @Test
    void illegalTransitionIsRejectedWithoutMutation() {
        engine = newEngine();
        app.events.clear();

        assertThat(engine.setState(RUNNING)).isFalse();

        assertThat(engine.currentPhase()).isEqualTo(NONE);
        assertThat(app.events).isEmpty();
        assertThat(listenerEvents).isEmpty();
        assertThat(logger.failures()).anySatisfy(e -> assertThat(e.message()).contains("NONE -> RUNNING"));
    }

    @Test
    void legalTransitionNotifiesApplicationThenListenersBeforeAndAfter() {
        engine = newEngine();
        app.events.clear();
        engine.addStateListener(new EngineStateListener() {
            @Override
            public void onStateChanging(LifecyclePhase current, LifecyclePhase target) {
                app.events.add("listener changing " + current + "->" + target);
            }

            @Override
            public void onStateChanged(LifecyclePhase previous, LifecyclePhase current) {
                app.events.add("listener changed " + previous + "->" + current);
            }
        });

        assertThat(engine.setState(STARTING)).isTrue();

        assertThat(app.events).containsExactly(
            "changing NONE->STARTING",
            "listener changing NONE->STARTING",
            "changed NONE->STARTING",
            "listener changed NONE->STARTING");
        assertThat(engine.currentPhase()).isEqualTo(STARTING);
    }

    @Test
    void failingListenerDoesNotBreakTheTransition() {
        engine = newEngine();
        engine.addStateListener(new EngineStateListener() {
            @Override
            public void onStateChanged(LifecyclePhase previous, LifecyclePhase current) {
                throw new IllegalStateException("listener bug");
            }
        });
        engine.addStateListener(recordingListener());

        assertThat(engine.setState(STARTING)).isTrue();
        assertThat(listenerEvents).contains("changed NONE->STARTING");
        assertThat(logger.ofKind(RecordingEngineLogger.Kind.EXCEPTION)).isNotEmpty();
    }

    @Test
    void applicationRejectingAPhaseFailsTheTransition() {
        engine = newEngine();
        app.acceptStateChanges = false;

        assertThat(engine.setState(STARTING)).isFalse();
        assertThat(logger.failures()).anySatisfy(e -> assertThat(e.severity()).isEqualTo(LogSeverity.CRITICAL));
    }

    // ── run ───────────────────────────────────────────────────────────────

    @Test
    void runWalksEveryPhaseInOrder() {
        engine = newEngine();

        assertThat(engine.run()).isTrue();

        assertThat(listenerEvents).containsExactly(
            "changing NONE->STARTING", "changed NONE->STARTING",
            "changing STARTING->LOADING", "changed STARTING->LOADING",
            "changing LOADING->RUNNING", "changed LOADING->RUNNING",
            "exit requested",
            "changing RUNNING->UNLOADING", "changed RUNNING->UNLOADING",
            "changing UNLOADING->EXITING", "changed UNLOADING->EXITING");
        assertThat(engine.currentPhase()).isEqualTo(EXITING);
        assertThat(engine.isRunning()).isFalse();
        assertThat(app.loadingFrames.get()).isEqualTo(1);
        assertThat(app.runningFrames.get()).isEqualTo(1);
        assertThat(app.unloadingFrames.get()).isEqualTo(1);
    }

    @Test
    void mainLoopsPumpTheWindowEveryFrame() {
        HeadlessWindowService window = new HeadlessWindowService();
        app.runningScript = frame -> {
            if (frame == 4) app.engine.requestExit();
            return true;
        };
        engine = install(builder().windowService(window));

        assertThat(engine.run()).isTrue();

        assertThat(app.runningFrames.get()).isEqualTo(5);
        assertThat(window.updateCount()).isGreaterThanOrEqualTo(7);
    }

    @Test
    void isRunningAndInMainLoopDuringRunningPhase() {
        AtomicBoolean observedRunning = new AtomicBoolean();
        AtomicBoolean observedMainLoop = new AtomicBoolean();
        app.runningScript = frame -> {
            observedRunning.set(app.engine.isRunning());
            observedMainLoop.set(app.engine.isInMainLoop());
            app.engine.requestExit();
            return true;
        };
        engine = newEngine();

        engine.run();

        assertThat(observedRunning).isTrue();
        assertThat(observedMainLoop).isTrue();
    }

    @Test
    void engineCanRunAgainAfterExiting() {
        engine = newEngine();
        assertThat(engine.run()).isTrue();
        listenerEvents.clear();

        assertThat(engine.run()).isTrue();

        assertThat(listenerEvents).startsWith("changing EXITING->NONE", "changed EXITING->NONE");
        assertThat(engine.currentPhase()).isEqualTo(EXITING);
        assertThat(app.runningFrames.get()).isEqualTo(2);
    }

    @Test
    void runningFrameFailureIsReportedButRunCompletes() {
        app.runningInput = () -> false;
        engine = newEngine();

        assertThat(engine.run()).isFalse();
        assertThat(engine.currentPhase()).isEqualTo(EXITING);
    }

    @Test
    void exceptionInMainLoopIsContainedAndExitStillRuns() {
        app.runningScript = frame -> {
            throw new IllegalStateException("boom");
        };
        engine = newEngine();

        assertThat(engine.run()).isFalse();

        assertThat(engine.currentPhase()).isEqualTo(EXITING);
        assertThat(app.unloadingFrames.get()).isEqualTo(1);
        assertThat(logger.ofKind(RecordingEngineLogger.Kind.EXCEPTION))
            .anySatisfy(e -> {
                assertThat(e.severity()).isEqualTo(LogSeverity.CRITICAL);
                assertThat(e.cause()).hasMessage("boom");
            });
    }

    @Test
    void unloadingRunsUntilTheApplicationIsDone() {
        app.unloadingScript = frame -> frame < 3 ? UpdateResult.inProgress() : UpdateResult.completed();
        engine = newEngine();

        assertThat(engine.run()).isTrue();
        assertThat(app.unloadingFrames.get()).isEqualTo(4);
    }

    // ── Exit requests ─────────────────────────────────────────────────────

    @Test
    void requestExitIsIgnoredWhenNotRunning() {
        engine = newEngine();
        engine.requestExit();

        assertThat(engine.isExiting()).isFalse();
        assertThat(listenerEvents).doesNotContain("exit requested");
    }

    @Test
    void requestExitIsIdempotent() {
        app.runningScript = frame -> {
            app.engine.requestExit();
            app.engine.requestExit();
            return true;
        };
        engine = newEngine();

        engine.run();

        assertThat(listenerEvents).containsOnlyOnce("exit requested");
    }

    @Test
    void exitRequestedInRunningRedirectsStartingToUnloading() {
        AtomicBoolean redirectResult = new AtomicBoolean();
        AtomicReference<LifecyclePhase> phaseAfterRedirect = new AtomicReference<>();
        app.runningScript = frame -> {
            app.engine.requestExit();
            redirectResult.set(engine.setState(STARTING));
            phaseAfterRedirect.set(engine.currentPhase());
            return true;
        };
        engine = newEngine();

        assertThat(engine.run()).isTrue();

        assertThat(redirectResult).isTrue();
        assertThat(phaseAfterRedirect.get()).isEqualTo(UNLOADING);
        assertThat(listenerEvents).contains("changed RUNNING->UNLOADING")
            .doesNotContain("changed RUNNING->STARTING");
        assertThat(app.unloadingFrames.get()).isEqualTo(1);
        assertThat(engine.currentPhase()).isEqualTo(EXITING);
    }

    @Test
    void exitRequestedInStartingRedirectsToExiting() {
        app.onChanged = (previous, current) -> {
            if (current == STARTING) app.engine.requestExit();
        };
        engine = newEngine();

        assertThat(engine.run()).isTrue();

        assertThat(listenerEvents).contains("changed STARTING->EXITING");
        assertThat(listenerEvents).noneMatch(e -> e.contains("LOADING") || e.contains("RUNNING"));
        assertThat(app.loadingFrames.get()).isZero();
        assertThat(engine.currentPhase()).isEqualTo(EXITING);
    }

    @Test
    void exitRequestedDuringLoadingSkipsRunning() {
        app.loadingScript = frame -> {
            app.engine.requestExit();
            return UpdateResult.inProgress();
        };
        engine = newEngine();

        assertThat(engine.run()).isTrue();

        assertThat(listenerEvents).contains("changed LOADING->UNLOADING");
        assertThat(app.runningFrames.get()).isZero();
        assertThat(app.unloadingFrames.get()).isEqualTo(1);
        assertThat(engine.currentPhase()).isEqualTo(EXITING);
    }

    // ── Disposal ──────────────────────────────────────────────────────────

    @Test
    void closeShutsDownTheApplicationAndBlocksFurtherUse() {
        engine = newEngine();
        engine.close();
        engine.close();

        assertThat(engine.isDisposed()).isTrue();
        assertThat(app.shutdownCalled).isTrue();
        assertThat(app.events).containsOnlyOnce("shutdown");
        assertThat(engine.run()).isFalse();
        assertThat(engine.setState(STARTING)).isFalse();
    }

    @Test
    void closeFromAnotherThreadStopsARunningEngine() throws Exception {
        AtomicInteger frames = new AtomicInteger();
        app.runningScript = frame -> {
            frames.incrementAndGet();
            return true;
        };
        engine = newEngine();
        Thread mainLoop = new Thread(engine::run, "test-main-loop");
        mainLoop.start();

        awaitCondition(() -> frames.get() > 2);
        engine.close();
        mainLoop.join(5_000);

        assertThat(mainLoop.isAlive()).isFalse();
        assertThat(engine.isRunning()).isFalse();
        assertThat(app.shutdownCalled).isTrue();
    }

    @Test
    void configIsReadFromTheConfiguredFileWhenNotGiven(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("engine_config.json");
        Files.writeString(file, "{ \"targetFrameRate\": 30, \"scanEmbeddedResources\": false }");
        String previous = System.getProperty(EngineConfigReader.CONFIG_PATH_PROPERTY);
        System.setProperty(EngineConfigReader.CONFIG_PATH_PROPERTY, file.toString());
        try {
            engine = EngineStateMachine.builder(app)
                .logger(logger)
                .platform(LINUX_VULKAN)
                .manifestSources(List.of())
                .build();
        } finally {
            if (previous == null) {
                System.clearProperty(EngineConfigReader.CONFIG_PATH_PROPERTY);
            } else {
                System.setProperty(EngineConfigReader.CONFIG_PATH_PROPERTY, previous);
            }
        }

        assertThat(engine.config().targetFrameRate()).isEqualTo(30);
        assertThat(engine.config().scanEmbeddedResources()).isFalse();
        assertThat(engine.timeService().targetFrameRate()).isEqualTo(30);
    }

    @Test
    void unusableConfigFileFailsConstruction(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("engine_config.json");
        Files.writeString(file, "{ \"targetFrameRate\": ");
        String previous = System.getProperty(EngineConfigReader.CONFIG_PATH_PROPERTY);
        System.setProperty(EngineConfigReader.CONFIG_PATH_PROPERTY, file.toString());
        try {
            assertThatThrownBy(() -> EngineStateMachine.builder(app).logger(logger).build())
                .isInstanceOf(EngineException.class);
            assertThat(app.events).doesNotContain("initialize");
        } finally {
            if (previous == null) {
                System.clearProperty(EngineConfigReader.CONFIG_PATH_PROPERTY);
            } else {
                System.setProperty(EngineConfigReader.CONFIG_PATH_PROPERTY, previous);
            }
        }
    }

    @Test
    void defaultCollaboratorsRunHeadless() {
        engine = EngineStateMachine.builder(app)
            .config(EngineConfig.builder().targetFrameRate(200).collectGarbageOnStateChange(true).build())
            .build();

        assertThat(engine.run()).isTrue();
        assertThat(engine.resourceIndex().lookup("tex_grass")).isPresent();
        assertThat(engine.platform()).isNotNull();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private EngineStateMachine newEngine(ManifestSource... sources) {
        return install(builder(sources));
    }

    private EngineStateMachine install(EngineStateMachine.Builder builder) {
        EngineStateMachine built = builder.build();
        built.addStateListener(recordingListener());
        return built;
    }

    private EngineStateMachine.Builder builder(ManifestSource... sources) {
        return EngineStateMachine.builder(app)
            .config(EngineConfig.builder().targetFrameRate(1_000).build())
            .logger(logger)
            .platform(LINUX_VULKAN)
            .manifestSources(List.of(sources));
    }

    private EngineStateListener recordingListener() {
        return new EngineStateListener() {
            @Override
            public void onStateChanging(LifecyclePhase current, LifecyclePhase target) {
                listenerEvents.add("changing " + current + "->" + target);
            }

            @Override
            public void onStateChanged(LifecyclePhase previous, LifecyclePhase current) {
                listenerEvents.add("changed " + previous + "->" + current);
            }

            @Override
            public void onExitRequested() {
                listenerEvents.add("exit requested");
            }
        };
    }

    static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("condition not reached within 5 s");
            Thread.sleep(5);
        }
    }
}
