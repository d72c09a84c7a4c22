package io.fragment.engine.api;

/**
 * Operating systems the engine distinguishes, e.g. for manifest restrictions.
 */
public enum OperatingSystemType {

    WINDOWS("Windows"),
    MACOS("MacOS"),
    LINUX("Linux"),
    BSD("BSD"),
    IOS("iOS"),
    ANDROID("Android"),
    /** Detection failed. Never matches a restriction. */
    UNKNOWN("Unknown");

    private final String manifestName;

    OperatingSystemType(String manifestName) {
        this.manifestName = manifestName;
    }

    public String manifestName() { return manifestName; }

    public boolean isDesktop() {
        return this == WINDOWS || this == MACOS || this == LINUX || this == BSD;
    }

    public boolean isMobile() {
        return this == IOS || this == ANDROID;
    }

    /**
     * Resolves a manifest OS name, ignoring case.
     *
     * @throws IllegalArgumentException if the name matches no OS
     */
    public static OperatingSystemType fromManifestName(String name) {
        if (name == null) throw new NullPointerException("name");
        for (OperatingSystemType os : values()) {
            if (os.manifestName.equalsIgnoreCase(name)) return os;
        }
        throw new IllegalArgumentException("Unknown operating system: '" + name + "'");
    }
}
