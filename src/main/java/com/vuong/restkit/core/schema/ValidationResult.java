package com.vuong.restkit.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of loading raw input through a {@link Schema}: either the validated data
 * or the messages for every rejected field, never both.
 */
public final class ValidationResult {

    private final Map<String, Object> data;
    private final Map<String, List<String>> errors;

    private ValidationResult(Map<String, Object> data, Map<String, List<String>> errors) {
        this.data = data;
        this.errors = errors;
    }

    public static ValidationResult valid(Map<String, Object> data) {
        return new ValidationResult(Collections.unmodifiableMap(new LinkedHashMap<>(data)), null);
    }

    public static ValidationResult invalid(Map<String, List<String>> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one field error");
        }
        return new ValidationResult(null, Collections.unmodifiableMap(new LinkedHashMap<>(errors)));
    }

    public boolean isValid() {
        return errors == null;
    }

    /**
     * @return the validated data
     * @throws IllegalStateException if the input was rejected
     */
    public Map<String, Object> getData() {
        if (data == null) {
            throw new IllegalStateException("Input was rejected: " + errors);
        }
        return data;
    }

    /**
     * @return the field errors
     * @throws IllegalStateException if the input was accepted
     */
    public Map<String, List<String>> getErrors() {
        if (errors == null) {
            throw new IllegalStateException("Input was accepted");
        }
        return errors;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{data=" + data + "}" : "ValidationResult{errors=" + errors + "}";
    }
}
