package com.vuong.restkit.core.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Component;

/**
 * Builds schemas wired to the application's ObjectMapper, Validator and ModelMapper.
 */
@Component
public class SchemaFactory {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final ModelMapper modelMapper;

    public SchemaFactory(ObjectMapper objectMapper, Validator validator, ModelMapper modelMapper) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.modelMapper = modelMapper;
    }

    public <D> BeanSchema<D> forType(Class<D> dtoClass) {
        return new BeanSchema<>(dtoClass, objectMapper, validator, modelMapper);
    }

    public PassThroughSchema passThrough() {
        return new PassThroughSchema(objectMapper);
    }
}
