package io.fragment.engine.api;

import java.util.Locale;

/**
 * Operating system and graphics API the engine is running on.
 *
 * @param operatingSystem detected or configured OS; never null
 * @param graphicsBackend graphics API chosen for that OS; never null
 */
public record PlatformInfo(OperatingSystemType operatingSystem, GraphicsBackend graphicsBackend) {

    public PlatformInfo {
        if (operatingSystem == null) throw new NullPointerException("operatingSystem");
        if (graphicsBackend == null) throw new NullPointerException("graphicsBackend");
    }

    /**
     * Detects the current platform from the {@code os.name} system property.
     *
     * @param preferNativeGraphicsApi on Windows, pick Direct3D11 instead of Vulkan
     */
    public static PlatformInfo detect(boolean preferNativeGraphicsApi) {
        return fromOsName(System.getProperty("os.name", ""), preferNativeGraphicsApi);
    }

    /**
     * Maps an {@code os.name} value to a platform.
     * Unrecognised names yield {@link OperatingSystemType#UNKNOWN} on OpenGL.
     */
    public static PlatformInfo fromOsName(String osName, boolean preferNativeGraphicsApi) {
        String name = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (name.startsWith("windows")) {
            return new PlatformInfo(OperatingSystemType.WINDOWS,
                preferNativeGraphicsApi ? GraphicsBackend.DIRECT3D11 : GraphicsBackend.VULKAN);
        }
        if (name.contains("android")) {
            return new PlatformInfo(OperatingSystemType.ANDROID, GraphicsBackend.VULKAN);
        }
        if (name.startsWith("linux")) {
            return new PlatformInfo(OperatingSystemType.LINUX, GraphicsBackend.VULKAN);
        }
        if (name.startsWith("mac") || name.startsWith("darwin")) {
            return new PlatformInfo(OperatingSystemType.MACOS, GraphicsBackend.METAL);
        }
        if (name.startsWith("ios")) {
            return new PlatformInfo(OperatingSystemType.IOS, GraphicsBackend.METAL);
        }
        if (name.contains("bsd")) {
            return new PlatformInfo(OperatingSystemType.BSD, GraphicsBackend.VULKAN);
        }
        return new PlatformInfo(OperatingSystemType.UNKNOWN, GraphicsBackend.OPENGL);
    }

    /**
     * True if a resource or manifest carrying these restrictions may be used here.
     * A null restriction does not restrict.
     */
    public boolean satisfies(OperatingSystemType osRestriction, GraphicsBackend graphicsRestriction) {
        if (osRestriction != null && osRestriction != operatingSystem) return false;
        return graphicsRestriction == null || graphicsRestriction == graphicsBackend;
    }
}
