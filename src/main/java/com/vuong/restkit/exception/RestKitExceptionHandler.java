package com.vuong.restkit.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the REST kit.
 * Renders any {@link ApiException} that escapes a controller as its pre-built response.
 * Other exceptions are left to Spring's default error handling.
 */
@RestControllerAdvice
@Component
@ConditionalOnMissingBean(RestKitExceptionHandler.class)
public class RestKitExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(RestKitExceptionHandler.class);

    /**
     * Handles ApiException and returns the response the exception carries.
     * @param ex the ApiException that was thrown
     * @return the pre-built ResponseEntity
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Object> handleApiException(ApiException ex) {
        ResponseEntity<Object> response = ex.getResponse();
        logger.debug("Answering {} with status {}", ex.getClass().getSimpleName(), response.getStatusCode().value());
        return response;
    }
}
