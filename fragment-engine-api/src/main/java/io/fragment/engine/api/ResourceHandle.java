package io.fragment.engine.api;

/**
 * Opaque identity of a resource, used to request and track loads.
 *
 * Two handles are equal when their key and type are equal.
 */
public record ResourceHandle(String resourceKey, ResourceType resourceType) {

    public ResourceHandle {
        if (resourceKey == null || resourceKey.isBlank()) {
            throw new IllegalArgumentException("resourceKey must not be null or blank");
        }
        if (resourceType == null) throw new NullPointerException("resourceType");
    }

    /** Stable numeric id derived from the key. Not guaranteed unique. */
    public int resourceId() {
        return resourceKey.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceHandle[" + resourceType.manifestName() + ":" + resourceKey + "]";
    }
}
