package com.vuong.restkit.core.resource;

import com.vuong.restkit.core.domain.DomainModel;
import com.vuong.restkit.core.pipeline.ResourceContext;
import com.vuong.restkit.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.Map;

/**
 * Single-item resource addressed by the {@code id} path variable:
 * {@code GET} retrieves the item, {@code PATCH} updates the fields sent.
 * @param <T> the entity type
 */
public class RetrieveUpdateResource<T> extends Resource<T> {

    public static final String ID_VARIABLE = "id";

    private static final Logger logger = LoggerFactory.getLogger(RetrieveUpdateResource.class);

    public RetrieveUpdateResource(String name, DomainModel<T> model, ResourceSchemas<T> schemas) {
        super(name, ResourceKind.ITEM, model, schemas);
        bind(RequestMethod.GET, this::retrieve);
        bind(RequestMethod.PATCH, this::update);
    }

    protected ResponseEntity<Object> retrieve(ResourceContext context) {
        T instance = fetch(context);
        return ResponseEntity.ok(serialize(context, instance));
    }

    /**
     * Applies every validated field to the stored item and saves it.
     */
    protected ResponseEntity<Object> update(ResourceContext context) {
        T instance = fetch(context);
        Map<String, Object> data = context.getValidatedData();
        data.forEach((field, value) -> model.setField(instance, field, value));
        T saved = model.persist(instance);
        logger.debug("Updated {} {} fields {}", getName(), context.getRequest().getPathVariable(ID_VARIABLE),
                data.keySet());
        return ResponseEntity.ok(serialize(context, saved));
    }

    protected T fetch(ResourceContext context) {
        String id = context.getRequest().getPathVariable(ID_VARIABLE);
        if (id == null) {
            throw new NotFoundException();
        }
        return model.getById(id).orElseThrow(NotFoundException::new);
    }
}
