package io.fragment.engine.core;

import io.fragment.engine.api.EngineConstants;
import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.LifecyclePhase;
import io.fragment.engine.api.LogSeverity;
import io.fragment.engine.api.PlatformInfo;

/**
 * Startup phase. Reports the platform and configuration; no main loop.
 */
final class StartingState extends EngineState {

    StartingState(EngineStateMachine engine) {
        super(engine);
    }

    @Override
    LifecyclePhase phase() { return LifecyclePhase.STARTING; }

    @Override
    boolean initialize() {
        if (isDisposed()) {
            engine.logger().logError("Cannot initialize disposed STARTING state", LogSeverity.HIGH);
            return false;
        }
        return true;
    }

    @Override
    void shutdown() {}

    @Override
    boolean run(CancellationSignal externalCancel) {
        EngineLogger logger = engine.logger();
        PlatformInfo platform = engine.platform();
        logger.logStatus("# Starting " + EngineConstants.ENGINE_NAME + " " + EngineConstants.ENGINE_VERSION);
        logger.logMessage("- Operating system: " + platform.operatingSystem().manifestName());
        logger.logMessage("- Graphics API: " + platform.graphicsBackend().manifestName());
        logger.logMessage("- Target frame rate: " + engine.timeService().targetFrameRate());
        return true;
    }
}
