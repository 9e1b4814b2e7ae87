package com.vuong.restkit.core.resource;

import com.vuong.restkit.core.domain.DomainModel;
import com.vuong.restkit.core.pagination.PageQuery;
import com.vuong.restkit.core.pagination.Paginator;
import com.vuong.restkit.core.pipeline.ResourceContext;
import com.vuong.restkit.core.pipeline.ResourceRequest;
import com.vuong.restkit.dto.PageResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collection resource: {@code GET} lists a page of items, {@code POST} creates one.
 * @param <T> the entity type
 */
public class ListCreateResource<T> extends Resource<T> {

    private static final Logger logger = LoggerFactory.getLogger(ListCreateResource.class);

    private final Paginator paginator;

    public ListCreateResource(String name, DomainModel<T> model, ResourceSchemas<T> schemas, Paginator paginator) {
        super(name, ResourceKind.COLLECTION, model, schemas);
        this.paginator = paginator;
        bind(RequestMethod.GET, this::list);
        bind(RequestMethod.POST, this::create);
    }

    /**
     * Builds, links and saves a new instance from the validated body.
     */
    protected ResponseEntity<Object> create(ResourceContext context) {
        Map<String, Object> data = context.getValidatedData();
        T instance = model.create(data);
        model.fetchRelated(instance, data);
        T saved = model.persist(instance);
        logger.debug("Created {} from fields {}", getName(), data.keySet());
        return ResponseEntity.ok(serialize(context, saved));
    }

    /**
     * Returns the requested page of items matching the validated query filters.
     */
    protected ResponseEntity<Object> list(ResourceContext context) {
        ResourceRequest request = context.getRequest();
        PageQuery page = paginator.resolvePage(request.getQueryParams());
        Map<String, Object> filters = filters(context.getValidatedData());

        List<T> items = model.getList(filters, page);
        long count = model.getCount(filters);

        List<Map<String, Object>> serialized = items.stream()
                .map(item -> serialize(context, item))
                .toList();
        PageResponse body = paginator.paginate(serialized, count, page, request.getResourceUri(),
                request.getQueryParams());
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> filters(Map<String, Object> validatedData) {
        Map<String, Object> filters = new LinkedHashMap<>(validatedData);
        paginator.getPageParameters().forEach(filters::remove);
        return filters;
    }
}
