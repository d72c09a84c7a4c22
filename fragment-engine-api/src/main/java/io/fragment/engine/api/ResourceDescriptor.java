package io.fragment.engine.api;

/**
 * Immutable description of one resource, as declared by a resource manifest.
 *
 * Descriptors are created by the resource scanner and replaced wholesale on
 * the next scan. {@code relativePath} is relative to {@code manifestName}'s
 * location for asset files, and to the bundle root for embedded files.
 *
 * @param key                 unique resource key; never blank
 * @param fallbackKey         resource to use if this one fails to load; may be null
 * @param location            where the data lives
 * @param relativePath        path of the data file
 * @param dataOffset          byte offset of the data within the file (u32)
 * @param dataSize            byte size of the data (u32)
 * @param formatKey           data format, e.g. ".png"; lowercase with a leading
 *                            period when it is a file extension
 * @param type                resource category
 * @param subType             category-specific sub type
 * @param osRestriction       only usable on this OS; may be null
 * @param graphicsRestriction only usable on this graphics API; may be null
 * @param manifestName        manifest that declared this descriptor
 */
public record ResourceDescriptor(
        String key,
        String fallbackKey,
        ResourceLocationType location,
        String relativePath,
        long dataOffset,
        long dataSize,
        String formatKey,
        ResourceType type,
        int subType,
        OperatingSystemType osRestriction,
        GraphicsBackend graphicsRestriction,
        String manifestName) {

    /** Largest value of the unsigned 32-bit offset and size fields. */
    public static final long MAX_U32 = 0xFFFF_FFFFL;

    /**
     * True if the descriptor can be used to look up and load a resource:
     * non-blank key and relative path, non-empty format key, known type and
     * location, offset and size within the u32 range.
     */
    public boolean isValid() {
        return key != null && !key.isBlank()
            && relativePath != null && !relativePath.isBlank()
            && formatKey != null && !formatKey.isEmpty()
            && type != null && type != ResourceType.UNKNOWN
            && location != null && location != ResourceLocationType.UNKNOWN
            && dataOffset >= 0 && dataOffset <= MAX_U32
            && dataSize >= 0 && dataSize <= MAX_U32;
    }

    /** Handle identifying this resource in load requests. */
    public ResourceHandle handle() {
        return new ResourceHandle(key, type);
    }
}
