package io.fragment.engine.resources;

import io.fragment.engine.api.ResourceLocationType;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * A place resource manifests are discovered in.
 *
 * Implementations: {@link EmbeddedManifestSource} (classpath bundle of a class),
 * {@link AssetDirectoryManifestSource} (assets folder on disk).
 */
public interface ManifestSource {

    /** Location type assigned to every descriptor read from this source. */
    ResourceLocationType locationType();

    /**
     * Identity of the underlying bundle or directory. Two sources with the same
     * origin list the same manifests and are scanned only once.
     */
    String origin();

    /**
     * Lists the names of all manifests in this source, in a stable order.
     *
     * @throws IOException if the source exists but cannot be listed
     */
    List<String> findManifests() throws IOException;

    /**
     * Opens a manifest listed by {@link #findManifests()}. The caller closes the stream.
     */
    InputStream open(String manifestName) throws IOException;
}
