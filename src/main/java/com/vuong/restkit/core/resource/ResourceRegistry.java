package com.vuong.restkit.core.resource;

import com.vuong.restkit.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Index of the application's {@link Resource} beans by kind and name.
 */
@Component
public class ResourceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ResourceRegistry.class);

    private final Map<ResourceKind, Map<String, Resource<?>>> resources = new EnumMap<>(ResourceKind.class);

    @Autowired
    public ResourceRegistry(ObjectProvider<Resource<?>> resources) {
        this(resources.orderedStream().toList());
    }

    public ResourceRegistry(List<Resource<?>> resources) {
        for (ResourceKind kind : ResourceKind.values()) {
            this.resources.put(kind, new ConcurrentHashMap<>());
        }
        resources.forEach(this::register);
    }

    private void register(Resource<?> resource) {
        Resource<?> previous = resources.get(resource.getKind()).putIfAbsent(resource.getName(), resource);
        if (previous != null) {
            throw new IllegalStateException("Duplicate " + resource.getKind() + " resource '" + resource.getName()
                    + "': " + previous + " and " + resource);
        }
        logger.info("Registered {} resource: {} -> {}. Methods: {}", resource.getKind(), resource.getName(),
                resource.getClass().getSimpleName(), resource.getAllowedMethods());
    }

    public Optional<Resource<?>> find(ResourceKind kind, String name) {
        return Optional.ofNullable(resources.get(kind).get(name));
    }

    /**
     * @throws NotFoundException if no resource of that kind has that name
     */
    public Resource<?> get(ResourceKind kind, String name) {
        return find(kind, name).orElseThrow(() -> new NotFoundException("No " + kind + " resource named " + name));
    }
}
