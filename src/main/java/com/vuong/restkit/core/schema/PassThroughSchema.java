package com.vuong.restkit.core.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Schema that accepts any input unchanged and serializes objects with Jackson.
 * Used when a resource declares no schema for a method.
 */
public class PassThroughSchema implements Schema<Object> {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public PassThroughSchema(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ValidationResult load(Map<String, Object> raw) {
        return ValidationResult.valid(raw);
    }

    @Override
    public Map<String, Object> dump(Object instance) {
        return objectMapper.convertValue(instance, MAP_TYPE);
    }
}
