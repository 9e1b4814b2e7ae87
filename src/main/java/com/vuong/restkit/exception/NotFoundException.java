package com.vuong.restkit.exception;

import com.vuong.restkit.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Raised when a referenced resource or object does not exist.
 */
public class NotFoundException extends ApiException {

    public static final String DETAILS = "Not found.";

    public NotFoundException() {
        super(DETAILS);
    }

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public ResponseEntity<Object> getResponse() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(DETAILS));
    }
}
