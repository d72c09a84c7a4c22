package io.fragment.engine.resources;

import java.util.Locale;

/**
 * Constants of the resource discovery and load scheduling subsystem.
 */
public final class ResourceConstants {

    private ResourceConstants() {}

    /** File extension of resource manifests, lowercase with leading period. */
    public static final String MANIFEST_EXTENSION = ".fres";

    /** Priority given to load requests that do not specify one. Lower = more urgent. */
    public static final int DEFAULT_LOAD_PRIORITY = 100;

    /** Initial capacity of the load queue's backing list. */
    public static final int DEFAULT_QUEUE_CAPACITY = 50;

    /** Minimum initial capacity of a scan's descriptor map. */
    public static final int MIN_INDEX_CAPACITY = 16;

    static {
        validate();
    }

    static void validate() {
        if (!MANIFEST_EXTENSION.startsWith(".")
                || !MANIFEST_EXTENSION.equals(MANIFEST_EXTENSION.toLowerCase(Locale.ROOT))) {
            throw new IllegalStateException("MANIFEST_EXTENSION must be lowercase with a leading period");
        }
        if (DEFAULT_QUEUE_CAPACITY < 1 || MIN_INDEX_CAPACITY < 1) {
            throw new IllegalStateException("Capacities must be >= 1");
        }
    }

    /** True if {@code name} ends with the manifest extension, ignoring case. */
    public static boolean isManifestName(String name) {
        return name != null
            && name.regionMatches(true, name.length() - MANIFEST_EXTENSION.length(),
                                  MANIFEST_EXTENSION, 0, MANIFEST_EXTENSION.length());
    }
}
