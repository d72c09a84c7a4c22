package io.fragment.engine.api;

/**
 * Broad category of a resource. Numeric codes are grouped by family and
 * match the codes written by the asset tooling.
 */
public enum ResourceType {

    // -- Misc -----------------------------------------------------------------
    /** Invalid marker. A descriptor with this type is rejected. */
    UNKNOWN(0, "Unknown"),
    CUSTOM(1, "Custom"),

    // -- Game assets ----------------------------------------------------------
    TEXTURE(10, "Texture"),
    VIDEO(11, "Video"),
    AUDIO(12, "Audio"),
    MODEL(13, "Model"),
    SHADER(14, "Shader"),

    // -- Pure data ------------------------------------------------------------
    BUFFER(30, "Buffer"),
    SERIALIZED_DATA(31, "SerializedData"),
    MARKUP(32, "Markup"),
    TEXT(33, "Text"),
    DATABASE(34, "Database"),

    // -- Code and logic -------------------------------------------------------
    ASSEMBLY(60, "Assembly"),
    SCRIPT(61, "Script"),
    PROGRAM(62, "Program");

    private final int code;
    private final String manifestName;

    ResourceType(int code, String manifestName) {
        this.code = code;
        this.manifestName = manifestName;
    }

    public int code() { return code; }

    /** Name used for this type in resource manifests. */
    public String manifestName() { return manifestName; }

    /**
     * Resolves a manifest type name, ignoring case.
     *
     * @throws IllegalArgumentException if the name matches no type
     */
    public static ResourceType fromManifestName(String name) {
        if (name == null) throw new NullPointerException("name");
        for (ResourceType type : values()) {
            if (type.manifestName.equalsIgnoreCase(name)) return type;
        }
        throw new IllegalArgumentException("Unknown resource type: '" + name + "'");
    }
}
