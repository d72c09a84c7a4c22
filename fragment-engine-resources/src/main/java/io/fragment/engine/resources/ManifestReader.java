package io.fragment.engine.resources;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.fragment.engine.api.GraphicsBackend;
import io.fragment.engine.api.OperatingSystemType;
import io.fragment.engine.api.ResourceDescriptor;
import io.fragment.engine.api.ResourceLocationType;
import io.fragment.engine.api.ResourceType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Deserializes resource manifests (JSON) with Gson.
 *
 * FORMAT:
 *   {
 *     "OSRestriction": "Windows",            optional, gates the whole manifest
 *     "GraphicsRestriction": "Vulkan",       optional, gates the whole manifest
 *     "Resources": [
 *       { "ResourceKey": "tex_grass", "RelativePath": "grass.png", "DataSize": 4096,
 *         "FormatKey": ".png", "Type": "Texture", "SubType": 1 }
 *     ]
 *   }
 *
 * A missing "Resources" array, malformed JSON or an unknown restriction name
 * fails the whole manifest. Missing descriptor fields are carried through as
 * invalid descriptors ({@link ResourceDescriptor#isValid()} is false) so that
 * the scanner can skip them individually. An unknown "Type" maps to
 * {@link ResourceType#UNKNOWN}.
 *
 * THREAD SAFETY: stateless apart from the Gson instance, which is thread-safe.
 */
public final class ManifestReader {

    private final Gson gson = new Gson();

    /**
     * Reads one manifest. The stream is not closed.
     *
     * @param in       manifest content, UTF-8
     * @param name     manifest name used for diagnostics and stored on each descriptor
     * @param location location type assigned to every descriptor
     */
    public ResourceManifest read(InputStream in, String name, ResourceLocationType location)
            throws ManifestFormatException {
        if (in == null) throw new NullPointerException("in");
        if (name == null) throw new NullPointerException("name");
        if (location == null) throw new NullPointerException("location");

        ManifestJson json;
        try {
            Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
            json = gson.fromJson(reader, ManifestJson.class);
        } catch (JsonParseException e) {
            throw new ManifestFormatException(name, "malformed manifest JSON", e);
        }
        if (json == null) {
            throw new ManifestFormatException(name, "manifest is empty");
        }
        if (json.resources == null) {
            throw new ManifestFormatException(name, "manifest has no 'Resources' array");
        }

        List<ResourceDescriptor> descriptors = new ArrayList<>(json.resources.size());
        for (DescriptorJson d : json.resources) {
            if (d == null) {
                throw new ManifestFormatException(name, "null entry in 'Resources'");
            }
            descriptors.add(toDescriptor(d, name, location));
        }
        return new ResourceManifest(name,
            parseOs(json.osRestriction, name),
            parseGraphics(json.graphicsRestriction, name),
            descriptors);
    }

    /** Reads a manifest from a string. Convenience for tools and tests. */
    public ResourceManifest read(String content, String name, ResourceLocationType location)
            throws ManifestFormatException {
        if (content == null) throw new NullPointerException("content");
        try (InputStream in = new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8))) {
            return read(in, name, location);
        } catch (IOException e) {
            throw new ManifestFormatException(name, "unreadable manifest", e);
        }
    }

    private static ResourceDescriptor toDescriptor(DescriptorJson d, String manifestName,
                                                   ResourceLocationType location)
            throws ManifestFormatException {
        ResourceType type = ResourceType.UNKNOWN;
        if (d.type != null) {
            try {
                type = ResourceType.fromManifestName(d.type);
            } catch (IllegalArgumentException e) {
                // invalid descriptor; the scanner reports and skips it
                type = ResourceType.UNKNOWN;
            }
        }
        return new ResourceDescriptor(
            d.resourceKey,
            d.fallbackResourceKey,
            location,
            d.relativePath,
            d.dataOffset != null ? d.dataOffset : 0L,
            d.dataSize != null ? d.dataSize : -1L,
            d.formatKey,
            type,
            d.subType != null ? d.subType : 0,
            parseOs(d.osRestriction, manifestName),
            parseGraphics(d.graphicsRestriction, manifestName),
            manifestName);
    }

    private static OperatingSystemType parseOs(String value, String manifestName)
            throws ManifestFormatException {
        if (value == null || value.isBlank()) return null;
        try {
            return OperatingSystemType.fromManifestName(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ManifestFormatException(manifestName, e.getMessage(), e);
        }
    }

    private static GraphicsBackend parseGraphics(String value, String manifestName)
            throws ManifestFormatException {
        if (value == null || value.isBlank()) return null;
        try {
            return GraphicsBackend.fromManifestName(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ManifestFormatException(manifestName, e.getMessage(), e);
        }
    }

    // -- JSON shape -----------------------------------------------------------

    private static final class ManifestJson {
        @SerializedName("OSRestriction")       String osRestriction;
        @SerializedName("GraphicsRestriction") String graphicsRestriction;
        @SerializedName("Resources")           List<DescriptorJson> resources;
    }

    private static final class DescriptorJson {
        @SerializedName("ResourceKey")         String  resourceKey;
        @SerializedName("FallbackResourceKey") String  fallbackResourceKey;
        @SerializedName("RelativePath")        String  relativePath;
        @SerializedName("DataOffset")          Long    dataOffset;
        @SerializedName("DataSize")            Long    dataSize;
        @SerializedName("FormatKey")           String  formatKey;
        @SerializedName("Type")                String  type;
        @SerializedName("SubType")             Integer subType;
        @SerializedName("OSRestriction")       String  osRestriction;
        @SerializedName("GraphicsRestriction") String  graphicsRestriction;
    }
}
