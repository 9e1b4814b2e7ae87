package com.vuong.restkit.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO representing an error response for API calls.
 * Carries the per-field validation messages (when the error is a validation failure)
 * and a human-readable summary.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    /** Validation messages keyed by field name. */
    private Map<String, List<String>> fieldErrors;
    /** Summary of what went wrong. */
    private String details;

    /**
     * Constructs an ErrorResponse without field errors.
     * @param details human-readable error summary
     */
    public ErrorResponse(String details) {
        this.details = details;
    }
}
