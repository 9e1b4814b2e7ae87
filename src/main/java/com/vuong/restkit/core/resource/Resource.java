package com.vuong.restkit.core.resource;

import com.vuong.restkit.core.domain.DomainModel;
import com.vuong.restkit.core.pipeline.ResourceContext;
import com.vuong.restkit.core.pipeline.ResourceHandler;
import com.vuong.restkit.core.schema.Schema;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An HTTP-addressable resource backed by a domain model.
 * <p>
 * Subclasses bind a handler per supported method in their constructor; the set of bound
 * methods is what the resource allows. Register resources as Spring beans to have
 * {@link ResourceRegistry} serve them.
 * @param <T> the entity type
 */
public abstract class Resource<T> {

    private final String name;
    private final ResourceKind kind;
    private final ResourceSchemas<T> schemas;
    private final Map<RequestMethod, ResourceHandler> handlers = new EnumMap<>(RequestMethod.class);

    protected final DomainModel<T> model;

    protected Resource(String name, ResourceKind kind, DomainModel<T> model, ResourceSchemas<T> schemas) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.model = Objects.requireNonNull(model, "model");
        this.schemas = Objects.requireNonNull(schemas, "schemas");
    }

    /**
     * Binds the handler for a method, replacing any earlier binding.
     */
    protected final void bind(RequestMethod method, ResourceHandler handler) {
        handlers.put(Objects.requireNonNull(method), Objects.requireNonNull(handler));
    }

    public String getName() {
        return name;
    }

    public ResourceKind getKind() {
        return kind;
    }

    public Optional<ResourceHandler> handlerFor(RequestMethod method) {
        return Optional.ofNullable(handlers.get(method));
    }

    public Set<RequestMethod> getAllowedMethods() {
        return handlers.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(handlers.keySet()));
    }

    public Schema<? super T> requestSchema(RequestMethod method) {
        return schemas.requestSchema(method);
    }

    /**
     * Serializes an instance with the response schema of the current request's method.
     */
    protected Map<String, Object> serialize(ResourceContext context, T instance) {
        return schemas.responseSchema(context.getMethod()).dump(instance);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", kind=" + kind + ", methods=" + getAllowedMethods() + "}";
    }
}
