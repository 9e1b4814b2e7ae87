package com.vuong.restkit.exception;

import com.vuong.restkit.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raised when request data is rejected by a schema.
 * The response body lists the messages for every rejected field.
 */
public class ValidationException extends ApiException {

    public static final String DETAILS = "Validation failed";

    private final Map<String, List<String>> fieldErrors;

    public ValidationException(Map<String, List<String>> fieldErrors) {
        super(DETAILS);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    /**
     * Shorthand for a failure on a single field.
     * @param field the rejected field
     * @param message why it was rejected
     * @return the exception
     */
    public static ValidationException forField(String field, String message) {
        return new ValidationException(Map.of(field, List.of(message)));
    }

    public Map<String, List<String>> getFieldErrors() {
        return fieldErrors;
    }

    @Override
    public ResponseEntity<Object> getResponse() {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(fieldErrors, DETAILS));
    }
}
