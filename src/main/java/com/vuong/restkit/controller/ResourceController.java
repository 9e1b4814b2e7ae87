package com.vuong.restkit.controller;

import com.vuong.restkit.core.pipeline.RequestPipeline;
import com.vuong.restkit.core.pipeline.ResourceRequest;
import com.vuong.restkit.core.resource.Resource;
import com.vuong.restkit.core.resource.ResourceKind;
import com.vuong.restkit.core.resource.ResourceRegistry;
import com.vuong.restkit.core.resource.RetrieveUpdateResource;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * REST controller serving every registered resource.
 * Collection resources answer on {@code {prefix}/{resource}}, item resources on
 * {@code {prefix}/{resource}/{id}}, for any HTTP method; the resource decides which
 * methods it supports.
 */
@RestController
@RequestMapping("${restkit.api-prefix:/api}/{resource}")
public class ResourceController {

    private final ResourceRegistry resourceRegistry;
    private final RequestPipeline requestPipeline;

    /**
     * Constructs a ResourceController with the required dependencies.
     * @param resourceRegistry the registered resources
     * @param requestPipeline the pipeline requests run through
     */
    public ResourceController(ResourceRegistry resourceRegistry, RequestPipeline requestPipeline) {
        this.resourceRegistry = resourceRegistry;
        this.requestPipeline = requestPipeline;
    }

    /**
     * Handles a request on a collection resource.
     * @param resource the resource name (path variable)
     * @param queryParams all query parameters
     * @param body the raw body, if any
     * @param request the servlet request
     * @return the pipeline's response
     */
    @RequestMapping
    public ResponseEntity<Object> collection(
            @PathVariable("resource") String resource,
            @RequestParam MultiValueMap<String, String> queryParams,
            @RequestBody(required = false) String body,
            HttpServletRequest request) {
        Resource<?> target = resourceRegistry.get(ResourceKind.COLLECTION, resource);
        return requestPipeline.process(target, toResourceRequest(request, queryParams, body, Map.of()));
    }

    /**
     * Handles a request on an item resource.
     * @param resource the resource name (path variable)
     * @param id the item id (path variable)
     * @param queryParams all query parameters
     * @param body the raw body, if any
     * @param request the servlet request
     * @return the pipeline's response
     */
    @RequestMapping("/{id}")
    public ResponseEntity<Object> item(
            @PathVariable("resource") String resource,
            @PathVariable("id") String id,
            @RequestParam MultiValueMap<String, String> queryParams,
            @RequestBody(required = false) String body,
            HttpServletRequest request) {
        Resource<?> target = resourceRegistry.get(ResourceKind.ITEM, resource);
        return requestPipeline.process(target,
                toResourceRequest(request, queryParams, body, Map.of(RetrieveUpdateResource.ID_VARIABLE, id)));
    }

    private ResourceRequest toResourceRequest(HttpServletRequest request, MultiValueMap<String, String> queryParams,
                                              String body, Map<String, String> pathVariables) {
        URI resourceUri = ServletUriComponentsBuilder.fromRequestUri(request).build(true).toUri();
        return ResourceRequest.builder()
                .method(request.getMethod())
                .body(body)
                .queryParams(new LinkedMultiValueMap<>(queryParams))
                .pathVariables(pathVariables)
                .resourceUri(resourceUri)
                .build();
    }
}
