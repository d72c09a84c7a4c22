package io.fragment.engine.resources;

import io.fragment.engine.api.EngineLogger;
import io.fragment.engine.api.LogSeverity;
import io.fragment.engine.api.PlatformInfo;
import io.fragment.engine.api.ResourceDescriptor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Discovers resource manifests and publishes their descriptors to a
 * {@link ResourceIndex}.
 *
 * SCAN ORDER:
 *   Sources are scanned in construction order (engine bundle, application
 *   bundle, assets directory). Within a source, manifests are read in the
 *   source's listing order. The first descriptor seen for a key wins; later
 *   duplicates are reported as TRIVIAL warnings and dropped.
 *
 * FAILURE MODEL:
 *   Any listing, open, parse or manifest validation failure aborts the scan
 *   and leaves the index untouched. A manifest whose own OS or graphics
 *   restriction does not match the platform is skipped. A single invalid
 *   descriptor is skipped with a warning.
 *
 * THREAD SAFETY:
 *   scanAll() is intended for one background thread at a time; an
 *   overlapping call is rejected and returns false.
 */
public final class ResourceScanner {

    private final ResourceIndex index;
    private final List<ManifestSource> sources;
    private final PlatformInfo platform;
    private final EngineLogger logger;
    private final ManifestReader reader = new ManifestReader();
    private final AtomicBoolean scanning = new AtomicBoolean(false);

    /**
     * @param index    index to publish into
     * @param sources  manifest sources in scan order
     * @param platform platform used to evaluate manifest restrictions
     * @param logger   engine logger
     */
    public ResourceScanner(ResourceIndex index, List<ManifestSource> sources,
                           PlatformInfo platform, EngineLogger logger) {
        if (index    == null) throw new NullPointerException("index");
        if (sources  == null) throw new NullPointerException("sources");
        if (platform == null) throw new NullPointerException("platform");
        if (logger   == null) throw new NullPointerException("logger");
        this.index    = index;
        this.sources  = List.copyOf(sources);
        this.platform = platform;
        this.logger   = logger;
    }

    public ResourceIndex index() { return index; }

    public List<ManifestSource> sources() { return sources; }

    /**
     * Scans every source and replaces the index contents on success.
     *
     * @return true if all manifests were read and the index was replaced
     */
    public boolean scanAll() {
        if (!scanning.compareAndSet(false, true)) {
            logger.logWarning("Resource scan already in progress; request ignored", LogSeverity.NORMAL);
            return false;
        }
        try {
            Map<String, ResourceDescriptor> found =
                new LinkedHashMap<>(Math.max(index.size(), ResourceConstants.MIN_INDEX_CAPACITY));
            Set<String> scannedOrigins = new HashSet<>();

            for (ManifestSource source : sources) {
                if (!scannedOrigins.add(source.origin())) {
                    logger.logMessage("Skipping already scanned resource source " + source.origin());
                    continue;
                }
                if (!scanSource(source, found)) {
                    logger.logError("Resource scan aborted in source " + source, LogSeverity.HIGH);
                    return false;
                }
            }

            if (!index.replaceAll(found)) {
                logger.logError("Failed to publish " + found.size()
                    + " scanned resources; previous index kept", LogSeverity.HIGH);
                return false;
            }
            logger.logMessage("Resource scan complete: " + found.size() + " resources indexed");
            return true;
        } finally {
            scanning.set(false);
        }
    }

    private boolean scanSource(ManifestSource source, Map<String, ResourceDescriptor> found) {
        List<String> manifestNames;
        try {
            manifestNames = source.findManifests();
        } catch (IOException | UncheckedIOException e) {
            logger.logException("Failed to list manifests of " + source, e, LogSeverity.HIGH);
            return false;
        }

        for (String manifestName : manifestNames) {
            ResourceManifest manifest;
            try (InputStream in = source.open(manifestName)) {
                manifest = reader.read(in, manifestName, source.locationType());
            } catch (IOException | UncheckedIOException e) {
                logger.logException("Failed to open resource manifest '" + manifestName + "'",
                    e, LogSeverity.HIGH);
                return false;
            } catch (ManifestFormatException e) {
                logger.logException("Invalid resource manifest '" + manifestName + "'",
                    e, LogSeverity.HIGH);
                return false;
            }

            if (!platform.satisfies(manifest.osRestriction(), manifest.graphicsRestriction())) {
                logger.logMessage("Skipping resource manifest '" + manifestName
                    + "' restricted to " + manifest.osRestriction() + "/" + manifest.graphicsRestriction());
                continue;
            }
            merge(manifest, found);
        }
        return true;
    }

    private void merge(ResourceManifest manifest, Map<String, ResourceDescriptor> found) {
        for (ResourceDescriptor descriptor : manifest.resources()) {
            if (!descriptor.isValid()) {
                logger.logWarning("Skipping invalid resource '" + descriptor.key()
                    + "' in manifest '" + manifest.name() + "'", LogSeverity.NORMAL);
                continue;
            }
            ResourceDescriptor existing = found.putIfAbsent(descriptor.key(), descriptor);
            if (existing != null) {
                logger.logWarning("Duplicate resource key '" + descriptor.key() + "' in manifest '"
                    + manifest.name() + "'; keeping the one from '" + existing.manifestName() + "'",
                    LogSeverity.TRIVIAL);
            }
        }
    }
}
