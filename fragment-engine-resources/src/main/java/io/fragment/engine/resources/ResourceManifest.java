package io.fragment.engine.resources;

import io.fragment.engine.api.GraphicsBackend;
import io.fragment.engine.api.OperatingSystemType;
import io.fragment.engine.api.ResourceDescriptor;

import java.util.List;

/**
 * Parsed content of one resource manifest.
 *
 * @param name                manifest name, as listed by its source
 * @param osRestriction       whole manifest only applies to this OS; may be null
 * @param graphicsRestriction whole manifest only applies to this graphics API; may be null
 * @param resources           declared descriptors in file order; may contain invalid entries
 */
public record ResourceManifest(
        String name,
        OperatingSystemType osRestriction,
        GraphicsBackend graphicsRestriction,
        List<ResourceDescriptor> resources) {

    public ResourceManifest {
        if (name == null) throw new NullPointerException("name");
        if (resources == null) throw new NullPointerException("resources");
        resources = List.copyOf(resources);
    }
}
