package com.vuong.restkit.core.pipeline;

import org.springframework.web.bind.annotation.RequestMethod;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The HTTP methods the pipeline recognizes, and which of them carry a body.
 */
public final class RequestMethods {

    private static final Set<RequestMethod> BODY_METHODS =
            EnumSet.of(RequestMethod.POST, RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE);

    private RequestMethods() {
    }

    /**
     * @param name the method name as received; matched case-sensitively
     * @return the recognized method, or empty for anything else
     */
    public static Optional<RequestMethod> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (RequestMethod method : RequestMethod.values()) {
            if (method.name().equals(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    public static boolean hasBody(RequestMethod method) {
        return BODY_METHODS.contains(method);
    }
}
