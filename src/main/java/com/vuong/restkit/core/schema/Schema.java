package com.vuong.restkit.core.schema;

import java.util.Map;

/**
 * Describes the shape of a resource's data in both directions.
 * @param <T> the domain type this schema can serialize
 */
public interface Schema<T> {

    /**
     * Validates raw request input (a JSON object or flattened query parameters).
     * @param raw the input keyed by field name
     * @return the validated data, or the field errors
     */
    ValidationResult load(Map<String, Object> raw);

    /**
     * Serializes a domain object into a response-ready mapping.
     * @param instance the object to serialize
     * @return the serialized fields
     */
    Map<String, Object> dump(T instance);
}
