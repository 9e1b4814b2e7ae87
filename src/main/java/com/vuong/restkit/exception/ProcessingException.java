package com.vuong.restkit.exception;

import com.vuong.restkit.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Raised when the request body cannot be read as the expected format.
 */
public class ProcessingException extends ApiException {

    public ProcessingException(String message) {
        super(message);
    }

    @Override
    public ResponseEntity<Object> getResponse() {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(getMessage()));
    }
}
