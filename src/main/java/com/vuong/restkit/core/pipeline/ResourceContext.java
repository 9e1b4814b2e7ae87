package com.vuong.restkit.core.pipeline;

import org.springframework.web.bind.annotation.RequestMethod;

import java.util.Map;

/**
 * State of a single request while it moves through the pipeline.
 * One instance per request; never shared between requests.
 */
public class ResourceContext {

    private final ResourceRequest request;
    private PipelineStage stage = PipelineStage.RECEIVED;
    private RequestMethod method;
    private Map<String, Object> validatedData;

    public ResourceContext(ResourceRequest request) {
        this.request = request;
    }

    public ResourceRequest getRequest() {
        return request;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public RequestMethod getMethod() {
        return method;
    }

    /**
     * @return the request data accepted by the method's schema
     * @throws IllegalStateException if validation has not run yet
     */
    public Map<String, Object> getValidatedData() {
        if (validatedData == null) {
            throw new IllegalStateException("Request data has not been validated");
        }
        return validatedData;
    }

    void methodResolved(RequestMethod method) {
        this.method = method;
        moveTo(PipelineStage.METHOD_RESOLVED);
    }

    void validated(Map<String, Object> validatedData) {
        this.validatedData = validatedData;
        moveTo(PipelineStage.VALIDATED);
    }

    void moveTo(PipelineStage next) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Request already answered at stage " + stage);
        }
        this.stage = next;
    }
}
