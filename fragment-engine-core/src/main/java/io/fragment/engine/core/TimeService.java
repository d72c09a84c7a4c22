package io.fragment.engine.core;

import io.fragment.engine.api.EngineConstants;
import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.LogSeverity;

import java.time.Duration;
import java.util.Arrays;

/**
 * Frame timing for the main loops.
 *
 * PROTOCOL (main-loop thread):
 *   beginFrame() ... frame work ... endFrame() -> sleep duration
 *   The returned sleep fills the remainder of the target frame duration.
 *
 * Application time always advances. In-game time stops while paused; the
 * in-game delta of a paused frame is zero.
 *
 * THREAD SAFETY: all methods are synchronized; getters may be read from any thread.
 */
public final class TimeService {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final long MIN_TARGET_DELTA_NANOS = 1_000_000L;

    private final EngineLogger logger;
    private final long appStartNanos = System.nanoTime();
    private final long[] frameTimeBuffer = new long[EngineConstants.FRAME_RATE_SAMPLE_COUNT];
    private int frameTimeBufferIdx = 0;

    private long targetDeltaNanos;
    private long frameStartNanos = 0L;
    private long frameIndex = 0L;
    private long appDeltaNanos = 0L;
    private long ingameDeltaNanos = 0L;
    private double currentFrameRate;

    private boolean paused = false;
    private long pausedNanos = 0L;
    private long pauseStartNanos = 0L;
    private boolean frameOpen = false;

    /**
     * @param targetFrameRate frames per second the loops aim for; clamped to [1, MAX_TARGET_FRAME_RATE]
     */
    public TimeService(EngineLogger logger, int targetFrameRate) {
        if (logger == null) throw new NullPointerException("logger");
        this.logger = logger;
        setTargetFrameRate(targetFrameRate);
        Arrays.fill(frameTimeBuffer, targetDeltaNanos);
        this.currentFrameRate = targetFrameRate();
    }

    // -- Frame protocol -------------------------------------------------------

    /** Marks the start of a frame. */
    public synchronized void beginFrame() {
        if (frameOpen) {
            logger.logWarning("Time service frame started twice without ending", LogSeverity.TRIVIAL);
        }
        frameStartNanos = System.nanoTime();
        frameOpen = true;
    }

    /**
     * Marks the end of the frame started by {@link #beginFrame()}.
     *
     * @return how long the caller should sleep to hold the target frame rate; never negative
     */
    public synchronized Duration endFrame() {
        if (!frameOpen) {
            logger.logError("Time service frame ended without being started", LogSeverity.NORMAL);
            return Duration.ZERO;
        }
        frameOpen = false;
        frameIndex++;

        appDeltaNanos = Math.max(0L, System.nanoTime() - frameStartNanos);
        ingameDeltaNanos = paused ? 0L : appDeltaNanos;

        frameTimeBuffer[frameTimeBufferIdx++] = appDeltaNanos;
        if (frameTimeBufferIdx >= frameTimeBuffer.length) {
            frameTimeBufferIdx = 0;
        }
        long total = 0L;
        for (long frameTime : frameTimeBuffer) total += frameTime;
        long average = Math.max(1L, total / frameTimeBuffer.length);
        currentFrameRate = (double) NANOS_PER_SECOND / average;

        return appDeltaNanos < targetDeltaNanos
            ? Duration.ofNanos(targetDeltaNanos - appDeltaNanos)
            : Duration.ZERO;
    }

    // -- Pause ----------------------------------------------------------------

    /** Stops in-game time. @return false if already paused */
    public synchronized boolean pause() {
        if (paused) {
            logger.logWarning("In-game time is already paused");
            return false;
        }
        paused = true;
        pauseStartNanos = System.nanoTime();
        return true;
    }

    /** Resumes in-game time. @return false if not paused */
    public synchronized boolean unpause() {
        if (!paused) {
            logger.logWarning("In-game time is not paused");
            return false;
        }
        paused = false;
        pausedNanos += System.nanoTime() - pauseStartNanos;
        return true;
    }

    public synchronized boolean isPaused() { return paused; }

    // -- Target rate ----------------------------------------------------------

    public synchronized void setTargetFrameRate(int framesPerSecond) {
        int clamped = Math.max(1, Math.min(framesPerSecond, EngineConstants.MAX_TARGET_FRAME_RATE));
        targetDeltaNanos = Math.max(MIN_TARGET_DELTA_NANOS, NANOS_PER_SECOND / clamped);
    }

    public synchronized int targetFrameRate() {
        return (int) Math.round((double) NANOS_PER_SECOND / targetDeltaNanos);
    }

    public synchronized Duration targetDeltaTime() { return Duration.ofNanos(targetDeltaNanos); }

    // -- Readouts -------------------------------------------------------------

    /** Time since this service was created. */
    public Duration appTime() { return Duration.ofNanos(System.nanoTime() - appStartNanos); }

    /** Application time minus all paused intervals. */
    public synchronized Duration ingameTime() {
        long pausedTotal = pausedNanos + (paused ? System.nanoTime() - pauseStartNanos : 0L);
        return Duration.ofNanos(System.nanoTime() - appStartNanos - pausedTotal);
    }

    public synchronized Duration appDeltaTime() { return Duration.ofNanos(appDeltaNanos); }

    public synchronized Duration ingameDeltaTime() { return Duration.ofNanos(ingameDeltaNanos); }

    /** Number of completed frames. */
    public synchronized long frameIndex() { return frameIndex; }

    /** Frame rate averaged over the last FRAME_RATE_SAMPLE_COUNT frames. */
    public synchronized double currentFrameRate() { return currentFrameRate; }
}
