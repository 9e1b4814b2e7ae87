package com.vuong.restkit.core.pipeline;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.util.CollectionUtils;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.net.URI;
import java.util.Map;

/**
 * Transport-neutral view of an inbound request, as the pipeline sees it.
 */
@Getter
@Builder
@ToString(exclude = "body")
public class ResourceRequest {

    /** Method name exactly as received, e.g. {@code "PATCH"}. */
    private final String method;

    /** Raw body text; null when the request has none. */
    private final String body;

    @Builder.Default
    private final MultiValueMap<String, String> queryParams = new LinkedMultiValueMap<>();

    @Builder.Default
    private final Map<String, String> pathVariables = Map.of();

    /** Absolute URI of the addressed resource (scheme, host and path, no query). */
    private final URI resourceUri;

    public MultiValueMap<String, String> getQueryParams() {
        return CollectionUtils.unmodifiableMultiValueMap(queryParams);
    }

    public String getPathVariable(String name) {
        return pathVariables.get(name);
    }
}
