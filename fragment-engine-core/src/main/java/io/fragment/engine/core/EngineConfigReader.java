package io.fragment.engine.core;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.LogSeverity;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads {@link EngineConfig} from a JSON settings file.
 *
 * FILE FORMAT (every field optional):
 *   { "targetFrameRate": 60, "assetsRoot": "assets", "scanEmbeddedResources": true,
 *     "lockTimeoutMs": 100, "loadBudgetMs": 2.0, "preferNativeGraphicsApi": true,
 *     "collectGarbageOnStateChange": false }
 *
 * A missing file yields the defaults. An unreadable or malformed file, or one
 * with out-of-range values, is an {@link EngineException}.
 *
 * The file location defaults to {@link #DEFAULT_CONFIG_PATH} and can be
 * overridden with the system property {@value #CONFIG_PATH_PROPERTY}.
 */
public final class EngineConfigReader {

    public static final String CONFIG_PATH_PROPERTY = "fragment.engine.config";

    public static final String DEFAULT_CONFIG_PATH = "settings/engine_config.json";

    private final Gson gson = new Gson();
    private final EngineLogger logger;

    public EngineConfigReader(EngineLogger logger) {
        if (logger == null) throw new NullPointerException("logger");
        this.logger = logger;
    }

    /** Path given by the system property, or the default path. */
    public static Path configuredPath() {
        String override = System.getProperty(CONFIG_PATH_PROPERTY, "");
        return Paths.get(override.isBlank() ? DEFAULT_CONFIG_PATH : override);
    }

    /** Loads from {@link #configuredPath()}. */
    public EngineConfig load() {
        return load(configuredPath());
    }

    /**
     * Loads the configuration at {@code path}, or the defaults if there is no file.
     *
     * @throws EngineException if the file exists but cannot be used
     */
    public EngineConfig load(Path path) {
        if (path == null) throw new NullPointerException("path");
        if (!Files.exists(path)) {
            logger.logWarning("Engine config '" + path + "' not found; using defaults", LogSeverity.TRIVIAL);
            return EngineConfig.defaults();
        }
        ConfigJson json;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            json = gson.fromJson(reader, ConfigJson.class);
        } catch (IOException | JsonParseException e) {
            throw new EngineException("Failed to read engine config '" + path + "'", e);
        }
        if (json == null) {
            logger.logWarning("Engine config '" + path + "' is empty; using defaults", LogSeverity.NORMAL);
            return EngineConfig.defaults();
        }
        try {
            EngineConfig config = apply(json, EngineConfig.builder()).build();
            logger.logMessage("Loaded engine config from '" + path + "': " + config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new EngineException("Invalid engine config '" + path + "': " + e.getMessage(), e);
        }
    }

    private static EngineConfig.Builder apply(ConfigJson json, EngineConfig.Builder b) {
        if (json.targetFrameRate != null) b.targetFrameRate(json.targetFrameRate);
        if (json.assetsRoot != null) b.assetsRoot(Paths.get(json.assetsRoot));
        if (json.scanEmbeddedResources != null) b.scanEmbeddedResources(json.scanEmbeddedResources);
        if (json.lockTimeoutMs != null) b.lockTimeoutMs(json.lockTimeoutMs);
        if (json.loadBudgetMs != null) b.loadBudgetMs(json.loadBudgetMs);
        if (json.preferNativeGraphicsApi != null) b.preferNativeGraphicsApi(json.preferNativeGraphicsApi);
        if (json.collectGarbageOnStateChange != null) b.collectGarbageOnStateChange(json.collectGarbageOnStateChange);
        return b;
    }

    private static final class ConfigJson {
        @SerializedName("targetFrameRate")             Integer targetFrameRate;
        @SerializedName("assetsRoot")                  String  assetsRoot;
        @SerializedName("scanEmbeddedResources")       Boolean scanEmbeddedResources;
        @SerializedName("lockTimeoutMs")               Long    lockTimeoutMs;
        @SerializedName("loadBudgetMs")                Double  loadBudgetMs;
        @SerializedName("preferNativeGraphicsApi")     Boolean preferNativeGraphicsApi;
        @SerializedName("collectGarbageOnStateChange") Boolean collectGarbageOnStateChange;
    }
}
