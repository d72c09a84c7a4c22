package io.fragment.engine.core;

import io.fragment.engine.api.EngineConstants;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Immutable engine configuration.
 *
 * Built in code with {@link #builder()}, or read from a JSON file by
 * {@link EngineConfigReader}. Every field has a default, so an empty builder
 * yields a working headless configuration.
 */
public final class EngineConfig {

    private final int targetFrameRate;
    private final Path assetsRoot;
    private final boolean scanEmbeddedResources;
    private final long lockTimeoutMs;
    private final double loadBudgetMs;
    private final boolean preferNativeGraphicsApi;
    private final boolean collectGarbageOnStateChange;

    private EngineConfig(Builder builder) {
        this.targetFrameRate = builder.targetFrameRate;
        this.assetsRoot = builder.assetsRoot;
        this.scanEmbeddedResources = builder.scanEmbeddedResources;
        this.lockTimeoutMs = builder.lockTimeoutMs;
        this.loadBudgetMs = builder.loadBudgetMs;
        this.preferNativeGraphicsApi = builder.preferNativeGraphicsApi;
        this.collectGarbageOnStateChange = builder.collectGarbageOnStateChange;
    }

    /** Configuration with every field at its default. */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /** Frames per second every main loop aims for. */
    public int targetFrameRate() { return targetFrameRate; }

    /** Directory searched recursively for resource manifests. */
    public Path assetsRoot() { return assetsRoot; }

    /** Whether the engine and application bundles are scanned for embedded manifests. */
    public boolean scanEmbeddedResources() { return scanEmbeddedResources; }

    /** Bounded wait for the resource index and load queue locks. */
    public long lockTimeoutMs() { return lockTimeoutMs; }

    /** Time per frame spent draining the load queue on the main-loop thread. */
    public double loadBudgetMs() { return loadBudgetMs; }

    /** On Windows, prefer Direct3D11 over Vulkan. */
    public boolean preferNativeGraphicsApi() { return preferNativeGraphicsApi; }

    /** Request a garbage collection after every phase change. */
    public boolean collectGarbageOnStateChange() { return collectGarbageOnStateChange; }

    /** Builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        return builder()
            .targetFrameRate(targetFrameRate)
            .assetsRoot(assetsRoot)
            .scanEmbeddedResources(scanEmbeddedResources)
            .lockTimeoutMs(lockTimeoutMs)
            .loadBudgetMs(loadBudgetMs)
            .preferNativeGraphicsApi(preferNativeGraphicsApi)
            .collectGarbageOnStateChange(collectGarbageOnStateChange);
    }

    @Override
    public String toString() {
        return "EngineConfig{targetFrameRate=" + targetFrameRate + ", assetsRoot=" + assetsRoot
            + ", scanEmbeddedResources=" + scanEmbeddedResources + ", lockTimeoutMs=" + lockTimeoutMs
            + ", loadBudgetMs=" + loadBudgetMs + "}";
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int targetFrameRate = EngineConstants.DEFAULT_TARGET_FRAME_RATE;
        private Path assetsRoot = Paths.get("assets");
        private boolean scanEmbeddedResources = true;
        private long lockTimeoutMs = EngineConstants.DEFAULT_LOCK_TIMEOUT_MS;
        private double loadBudgetMs = EngineConstants.DEFAULT_LOAD_BUDGET_MS;
        private boolean preferNativeGraphicsApi = true;
        private boolean collectGarbageOnStateChange = false;

        private Builder() {}

        public Builder targetFrameRate(int fps) { this.targetFrameRate = fps; return this; }
        public Builder assetsRoot(Path root) { this.assetsRoot = root; return this; }
        public Builder scanEmbeddedResources(boolean scan) { this.scanEmbeddedResources = scan; return this; }
        public Builder lockTimeoutMs(long ms) { this.lockTimeoutMs = ms; return this; }
        public Builder loadBudgetMs(double ms) { this.loadBudgetMs = ms; return this; }
        public Builder preferNativeGraphicsApi(boolean prefer) { this.preferNativeGraphicsApi = prefer; return this; }
        public Builder collectGarbageOnStateChange(boolean gc) { this.collectGarbageOnStateChange = gc; return this; }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public EngineConfig build() {
            if (targetFrameRate < 1 || targetFrameRate > EngineConstants.MAX_TARGET_FRAME_RATE) {
                throw new IllegalArgumentException("targetFrameRate must be in [1, "
                    + EngineConstants.MAX_TARGET_FRAME_RATE + "], got " + targetFrameRate);
            }
            if (assetsRoot == null) throw new NullPointerException("assetsRoot");
            if (lockTimeoutMs <= 0) {
                throw new IllegalArgumentException("lockTimeoutMs must be > 0, got " + lockTimeoutMs);
            }
            if (loadBudgetMs < 0 || Double.isNaN(loadBudgetMs)) {
                throw new IllegalArgumentException("loadBudgetMs must be >= 0, got " + loadBudgetMs);
            }
            return new EngineConfig(this);
        }
    }
}
