package com.vuong.restkit.core.pipeline;

import com.vuong.restkit.core.resource.Resource;
import com.vuong.restkit.core.validation.RequestDataValidator;
import com.vuong.restkit.exception.ApiException;
import com.vuong.restkit.exception.MethodNotAllowedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.Map;

/**
 * Runs a request against a resource: resolves the method's handler, validates the input,
 * invokes the handler and answers recognized errors with their pre-built responses.
 * <p>
 * Exceptions outside the {@link ApiException} hierarchy are not caught.
 */
@Component
public class RequestPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RequestPipeline.class);

    private final RequestDataValidator validator;

    public RequestPipeline(RequestDataValidator validator) {
        this.validator = validator;
    }

    /**
     * Handles one request.
     * @param resource the addressed resource
     * @param request the request
     * @return the single response for the request
     */
    public ResponseEntity<Object> process(Resource<?> resource, ResourceRequest request) {
        return process(resource, new ResourceContext(request));
    }

    ResponseEntity<Object> process(Resource<?> resource, ResourceContext context) {
        ResourceRequest request = context.getRequest();
        try {
            RequestMethod method = RequestMethods.resolve(request.getMethod())
                    .orElseThrow(() -> methodNotAllowed(resource, request.getMethod()));
            ResourceHandler handler = resource.handlerFor(method)
                    .orElseThrow(() -> methodNotAllowed(resource, request.getMethod()));
            context.methodResolved(method);

            Map<String, Object> data = validator.validate(resource.requestSchema(method), method, request);
            context.validated(data);

            ResponseEntity<Object> response = handler.handle(context);
            context.moveTo(PipelineStage.HANDLED);

            context.moveTo(PipelineStage.RESPONDED);
            logger.debug("{} {} answered with {}", method, resource.getName(), response.getStatusCode().value());
            return response;
        } catch (ApiException e) {
            context.moveTo(PipelineStage.ERROR_RESPONDED);
            ResponseEntity<Object> response = e.getResponse();
            logger.debug("{} {} short-circuited at {}: {} ({})", request.getMethod(), resource.getName(),
                    e.getClass().getSimpleName(), e.getMessage(), response.getStatusCode().value());
            return response;
        }
    }

    private static MethodNotAllowedException methodNotAllowed(Resource<?> resource, String method) {
        return new MethodNotAllowedException(method, resource.getAllowedMethods());
    }
}
