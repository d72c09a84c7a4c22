package io.fragment.engine.api;

/**
 * Where a resource's data lives.
 */
public enum ResourceLocationType {
    /** File below the assets root, relative to its manifest. */
    ASSET_FILE,
    /** Resource embedded in the engine or application bundle. */
    EMBEDDED_FILE,
    NETWORK,
    /** Generated at runtime; no backing file. */
    PROCEDURAL,
    /** Invalid marker. */
    UNKNOWN
}
