package io.fragment.engine.resources;

import io.fragment.engine.api.ResourceDescriptor;

import java.io.IOException;

/**
 * Turns a resource descriptor into a loaded resource.
 *
 * Implemented by the application or by format-specific loaders. Called on the
 * main-loop thread by {@link ResourceLoadService}, within its frame budget.
 */
@FunctionalInterface
public interface ResourceImporter {

    /**
     * Loads the resource described by {@code descriptor}.
     *
     * @return true if the resource is now available
     * @throws IOException if the resource data could not be read
     */
    boolean importResource(ResourceDescriptor descriptor) throws IOException;

    /**
     * Importer that accepts every resource without reading any data.
     * Used in headless and test environments.
     */
    static ResourceImporter discarding() {
        return descriptor -> true;
    }
}
