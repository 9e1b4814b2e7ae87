package com.vuong.restkit.exception;

import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Raised when a resource has no handler for the requested method.
 * The response has no body and advertises the supported methods in the Allow header.
 */
public class MethodNotAllowedException extends ApiException {

    private final String method;
    private final Set<RequestMethod> allowedMethods;

    public MethodNotAllowedException(String method, Set<RequestMethod> allowedMethods) {
        super("Method " + method + " not allowed");
        this.method = method;
        this.allowedMethods = Collections.unmodifiableSet(new LinkedHashSet<>(allowedMethods));
    }

    public String getMethod() {
        return method;
    }

    public Set<RequestMethod> getAllowedMethods() {
        return allowedMethods;
    }

    @Override
    public ResponseEntity<Object> getResponse() {
        HttpMethod[] allow = allowedMethods.stream()
                .map(m -> HttpMethod.valueOf(m.name()))
                .toArray(HttpMethod[]::new);
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).allow(allow).build();
    }
}
