package io.fragment.engine.api;

/**
 * Graphics APIs a platform may run on. The engine core only uses this value
 * to evaluate manifest restrictions.
 */
public enum GraphicsBackend {

    DIRECT3D11("Direct3D11"),
    VULKAN("Vulkan"),
    OPENGL("OpenGL"),
    METAL("Metal"),
    OPENGLES("OpenGLES");

    private final String manifestName;

    GraphicsBackend(String manifestName) {
        this.manifestName = manifestName;
    }

    public String manifestName() { return manifestName; }

    /**
     * Resolves a manifest graphics API name, ignoring case.
     *
     * @throws IllegalArgumentException if the name matches no backend
     */
    public static GraphicsBackend fromManifestName(String name) {
        if (name == null) throw new NullPointerException("name");
        for (GraphicsBackend backend : values()) {
            if (backend.manifestName.equalsIgnoreCase(name)) return backend;
        }
        throw new IllegalArgumentException("Unknown graphics backend: '" + name + "'");
    }
}
