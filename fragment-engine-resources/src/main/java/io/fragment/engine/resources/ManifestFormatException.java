package io.fragment.engine.resources;

/**
 * Thrown when a resource manifest cannot be parsed or fails validation.
 *
 * Carries the name of the offending manifest for diagnostics.
 */
public final class ManifestFormatException extends Exception {

    private final String manifestName;

    public ManifestFormatException(String manifestName, String message) {
        super(manifestName + ": " + message);
        this.manifestName = manifestName;
    }

    public ManifestFormatException(String manifestName, String message, Throwable cause) {
        super(manifestName + ": " + message, cause);
        this.manifestName = manifestName;
    }

    /** Name of the manifest that failed. */
    public String manifestName() { return manifestName; }
}
