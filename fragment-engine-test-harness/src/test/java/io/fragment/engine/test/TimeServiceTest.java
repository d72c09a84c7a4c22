package io.fragment.engine.test;

import io.fragment.engine.api.EngineConstants;
import io.fragment.engine.core.TimeService;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class TimeServiceTest {

    private RecordingEngineLogger logger;
    private TimeService time;

    @BeforeEach
    void setUp() {
        logger = new RecordingEngineLogger();
        time = new TimeService(logger, 60);
    }

    @Test
    void fastFrameIsPaddedToTheTargetDuration() {
        time.beginFrame();
        Duration sleep = time.endFrame();

        assertThat(sleep).isPositive().isLessThanOrEqualTo(time.targetDeltaTime());
        assertThat(time.frameIndex()).isEqualTo(1);
        assertThat(time.appDeltaTime()).isLessThan(time.targetDeltaTime());
    }

    @Test
    void slowFrameGetsNoSleep() throws InterruptedException {
        time.setTargetFrameRate(EngineConstants.MAX_TARGET_FRAME_RATE);
        time.beginFrame();
        Thread.sleep(5);
        assertThat(time.endFrame()).isZero();
    }

    @Test
    void endWithoutBeginIsReportedAndIgnored() {
        assertThat(time.endFrame()).isZero();
        assertThat(time.frameIndex()).isZero();
        assertThat(logger.failures()).hasSize(1);
    }

    @Test
    void targetFrameRateIsClamped() {
        assertThat(time.targetFrameRate()).isEqualTo(60);

        time.setTargetFrameRate(0);
        assertThat(time.targetFrameRate()).isEqualTo(1);

        time.setTargetFrameRate(50_000);
        assertThat(time.targetFrameRate()).isEqualTo(EngineConstants.MAX_TARGET_FRAME_RATE);
    }

    @Test
    void pausedFramesHaveNoIngameDelta() throws InterruptedException {
        assertThat(time.pause()).isTrue();
        assertThat(time.pause()).isFalse();

        time.beginFrame();
        Thread.sleep(2);
        time.endFrame();

        assertThat(time.isPaused()).isTrue();
        assertThat(time.appDeltaTime()).isPositive();
        assertThat(time.ingameDeltaTime()).isZero();

        assertThat(time.unpause()).isTrue();
        assertThat(time.unpause()).isFalse();
        assertThat(time.ingameTime()).isLessThanOrEqualTo(time.appTime());
    }

    @Test
    void frameRateStartsAtTheTarget() {
        assertThat(time.currentFrameRate()).isEqualTo(60.0);
    }
}
