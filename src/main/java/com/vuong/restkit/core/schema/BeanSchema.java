package com.vuong.restkit.core.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.modelmapper.ModelMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Schema backed by a DTO class annotated with Jakarta Bean Validation constraints.
 * <p>
 * Loading binds the raw input onto the DTO with Jackson (so query strings such as {@code "5"}
 * are coerced to the declared type), then runs the validator. Type mismatches are reported for
 * every mistyped field; constraint violations only once all fields convert. On success only the
 * fields present in the input are returned, carrying their converted values, so a partial update
 * touches nothing else.
 * <p>
 * Dumping maps the domain object onto the DTO with ModelMapper and writes the DTO as a map.
 * @param <D> the DTO type
 */
public class BeanSchema<D> implements Schema<Object> {

    /** Key used for errors that belong to the input as a whole. */
    public static final String SCHEMA_ERROR_KEY = "_schema";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Class<D> dtoClass;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final ModelMapper modelMapper;

    public BeanSchema(Class<D> dtoClass, ObjectMapper objectMapper, Validator validator, ModelMapper modelMapper) {
        this.dtoClass = dtoClass;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.modelMapper = modelMapper;
    }

    public Class<D> getDtoClass() {
        return dtoClass;
    }

    @Override
    public ValidationResult load(Map<String, Object> raw) {
        D dto;
        try {
            dto = objectMapper.convertValue(raw, dtoClass);
        } catch (IllegalArgumentException e) {
            return ValidationResult.invalid(conversionErrors(raw, e));
        }

        Set<ConstraintViolation<D>> violations = validator.validate(dto);
        if (!violations.isEmpty()) {
            return ValidationResult.invalid(violationErrors(violations));
        }
        return ValidationResult.valid(presentFields(dto, raw.keySet()));
    }

    @Override
    public Map<String, Object> dump(Object instance) {
        D dto = dtoClass.isInstance(instance) ? dtoClass.cast(instance) : modelMapper.map(instance, dtoClass);
        return objectMapper.convertValue(dto, MAP_TYPE);
    }

    private Map<String, Object> presentFields(D dto, Set<String> inputKeys) {
        BeanDescription description = objectMapper.getSerializationConfig()
                .introspect(objectMapper.constructType(dtoClass));
        Map<String, Object> data = new LinkedHashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor != null && inputKeys.contains(property.getName())) {
                data.put(property.getName(), accessor.getValue(dto));
            }
        }
        return data;
    }

    private Map<String, List<String>> violationErrors(Set<ConstraintViolation<D>> violations) {
        Map<String, List<String>> errors = new TreeMap<>();
        for (ConstraintViolation<D> violation : violations) {
            String path = violation.getPropertyPath().toString();
            errors.computeIfAbsent(path.isEmpty() ? SCHEMA_ERROR_KEY : path, k -> new ArrayList<>())
                    .add(violation.getMessage());
        }
        errors.values().forEach(Collections::sort);
        return errors;
    }

    // Jackson stops at the first mismatch, so each field is converted on its own to report them all
    private Map<String, List<String>> conversionErrors(Map<String, Object> raw, IllegalArgumentException first) {
        Map<String, List<String>> errors = new TreeMap<>();
        raw.forEach((key, value) -> {
            try {
                objectMapper.convertValue(Collections.singletonMap(key, value), dtoClass);
            } catch (IllegalArgumentException e) {
                conversionError(e).forEach((field, messages) ->
                        errors.computeIfAbsent(field, k -> new ArrayList<>()).addAll(messages));
            }
        });
        return errors.isEmpty() ? conversionError(first) : errors;
    }

    private Map<String, List<String>> conversionError(IllegalArgumentException e) {
        if (!(e.getCause() instanceof JsonMappingException mappingException)) {
            return Map.of(SCHEMA_ERROR_KEY, List.of("Invalid input."));
        }

        String field = mappingException.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                .collect(Collectors.joining("."));
        String message = "Invalid value.";
        if (mappingException instanceof MismatchedInputException mismatch && mismatch.getTargetType() != null) {
            message = "Not a valid " + describe(mismatch.getTargetType()) + ".";
        }
        return Map.of(field.isEmpty() ? SCHEMA_ERROR_KEY : field, List.of(message));
    }

    private static String describe(Class<?> type) {
        if (type == Integer.class || type == int.class || type == Long.class || type == long.class
                || type == Short.class || type == short.class || type == BigInteger.class) {
            return "integer";
        }
        if (type == Double.class || type == double.class || type == Float.class || type == float.class
                || type == BigDecimal.class) {
            return "number";
        }
        if (type == Boolean.class || type == boolean.class) {
            return "boolean";
        }
        if (Temporal.class.isAssignableFrom(type) || Date.class.isAssignableFrom(type)) {
            return "datetime";
        }
        if (type.isEnum()) {
            return "choice";
        }
        if (type.isArray() || Collection.class.isAssignableFrom(type)) {
            return "list";
        }
        return type.getSimpleName().toLowerCase();
    }
}
