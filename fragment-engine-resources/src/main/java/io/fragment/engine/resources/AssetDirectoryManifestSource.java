package io.fragment.engine.resources;

import io.fragment.engine.api.ResourceLocationType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Manifests stored as files anywhere below an assets root directory.
 *
 * A missing root directory lists no manifests; it is not an error, since an
 * application may ship all of its resources embedded.
 */
public final class AssetDirectoryManifestSource implements ManifestSource {

    private final Path root;

    public AssetDirectoryManifestSource(Path root) {
        if (root == null) throw new NullPointerException("root");
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() { return root; }

    @Override
    public ResourceLocationType locationType() { return ResourceLocationType.ASSET_FILE; }

    @Override
    public String origin() { return root.toUri().toString(); }

    @Override
    public List<String> findManifests() throws IOException {
        if (!Files.isDirectory(root)) return List.of();
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> ResourceConstants.isManifestName(p.getFileName().toString()))
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .sorted()
                .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    @Override
    public InputStream open(String manifestName) throws IOException {
        if (manifestName == null) throw new NullPointerException("manifestName");
        Path file = root.resolve(manifestName).normalize();
        if (!file.startsWith(root)) {
            throw new IOException("Manifest path escapes the assets root: " + manifestName);
        }
        return Files.newInputStream(file);
    }

    @Override
    public String toString() {
        return "AssetDirectoryManifestSource[" + root + "]";
    }
}
