package com.vuong.restkit.exception;

import org.springframework.http.ResponseEntity;

/**
 * Root of the errors the request pipeline knows how to answer.
 * Each subclass builds its HTTP response up front, so catching an ApiException
 * anywhere is enough to reply to the client.
 */
public abstract class ApiException extends RuntimeException {

    protected ApiException(String message) {
        super(message);
    }

    /**
     * Returns the response to send for this error.
     * @return status, headers and body describing the error
     */
    public abstract ResponseEntity<Object> getResponse();
}
