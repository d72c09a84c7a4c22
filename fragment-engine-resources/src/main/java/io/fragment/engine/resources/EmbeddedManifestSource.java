package io.fragment.engine.resources;

import io.fragment.engine.api.ResourceLocationType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Manifests embedded in the bundle (jar or class directory) that contains an
 * anchor class.
 *
 * Only the anchor's own code source is listed, never the whole classpath, so
 * the engine bundle and the application bundle stay distinguishable.
 * Manifest names are bundle-relative paths with '/' separators.
 * Classes without a file-based code source (e.g. JDK classes) list nothing.
 */
public final class EmbeddedManifestSource implements ManifestSource {

    private final Class<?> anchor;
    private final Path bundle;

    private EmbeddedManifestSource(Class<?> anchor, Path bundle) {
        this.anchor = anchor;
        this.bundle = bundle;
    }

    /**
     * Creates a source for the bundle containing {@code anchor}.
     *
     * @param anchor any class of the bundle; must not be null
     */
    public static EmbeddedManifestSource forClass(Class<?> anchor) {
        if (anchor == null) throw new NullPointerException("anchor");
        return new EmbeddedManifestSource(anchor, locateBundle(anchor));
    }

    private static Path locateBundle(Class<?> anchor) {
        CodeSource codeSource = anchor.getProtectionDomain().getCodeSource();
        if (codeSource == null) return null;
        URL location = codeSource.getLocation();
        if (location == null || !"file".equals(location.getProtocol())) return null;
        try {
            return Paths.get(location.toURI()).toAbsolutePath().normalize();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    /** Bundle path, or null if the anchor has no file-based code source. */
    public Path bundle() { return bundle; }

    @Override
    public ResourceLocationType locationType() { return ResourceLocationType.EMBEDDED_FILE; }

    @Override
    public String origin() {
        return bundle != null ? bundle.toUri().toString() : "embedded:" + anchor.getName();
    }

    @Override
    public List<String> findManifests() throws IOException {
        if (bundle == null) return List.of();
        if (Files.isDirectory(bundle)) {
            try (Stream<Path> files = Files.walk(bundle)) {
                return files
                    .filter(Files::isRegularFile)
                    .filter(p -> ResourceConstants.isManifestName(p.getFileName().toString()))
                    .map(p -> bundle.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .collect(Collectors.toList());
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
        }
        if (Files.isRegularFile(bundle)) {
            List<String> names = new ArrayList<>();
            try (JarFile jar = new JarFile(bundle.toFile())) {
                Enumeration<JarEntry> entries = jar.entries();
                while (entries.hasMoreElements()) {
                    JarEntry entry = entries.nextElement();
                    if (!entry.isDirectory() && ResourceConstants.isManifestName(entry.getName())) {
                        names.add(entry.getName());
                    }
                }
            }
            Collections.sort(names);
            return names;
        }
        return List.of();
    }

    @Override
    public InputStream open(String manifestName) throws IOException {
        if (manifestName == null) throw new NullPointerException("manifestName");
        if (bundle == null) throw new IOException("No bundle for " + anchor.getName());
        if (Files.isDirectory(bundle)) {
            Path file = bundle.resolve(manifestName).normalize();
            if (!file.startsWith(bundle)) {
                throw new IOException("Manifest path escapes the bundle: " + manifestName);
            }
            return Files.newInputStream(file);
        }
        // Read jar entries fully so the jar can be closed before returning.
        try (JarFile jar = new JarFile(bundle.toFile())) {
            JarEntry entry = jar.getJarEntry(manifestName);
            if (entry == null) throw new IOException("No embedded manifest '" + manifestName + "'");
            try (InputStream in = jar.getInputStream(entry)) {
                return new ByteArrayInputStream(in.readAllBytes());
            }
        }
    }

    @Override
    public String toString() {
        return "EmbeddedManifestSource[" + anchor.getName() + " @ " + bundle + "]";
    }
}
