package com.vuong.restkit.core.pipeline;

import org.springframework.http.ResponseEntity;

/**
 * Handles one HTTP method on a resource, once the request data is validated.
 */
@FunctionalInterface
public interface ResourceHandler {

    ResponseEntity<Object> handle(ResourceContext context);
}
