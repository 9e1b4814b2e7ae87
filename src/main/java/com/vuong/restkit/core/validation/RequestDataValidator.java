package com.vuong.restkit.core.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.vuong.restkit.core.pipeline.RequestMethods;
import com.vuong.restkit.core.pipeline.ResourceRequest;
import com.vuong.restkit.core.schema.Schema;
import com.vuong.restkit.core.schema.ValidationResult;
import com.vuong.restkit.exception.ProcessingException;
import com.vuong.restkit.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the raw input of a request into validated data.
 * <p>
 * Writing methods read the body as a JSON object (an absent or empty body counts as {@code {}});
 * every other method reads the query string. The input is then loaded through the schema.
 */
@Component
public class RequestDataValidator {

    public static final String PARSE_ERROR = "Data parsing error, expected json";

    private static final Logger logger = LoggerFactory.getLogger(RequestDataValidator.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectReader bodyReader;

    public RequestDataValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.bodyReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Validates the request's input against a schema.
     * @param schema the schema bound to the request's method
     * @param method the resolved method
     * @param request the request
     * @return the validated data
     * @throws ProcessingException if a body is present but is not a JSON object
     * @throws ValidationException if the schema rejects the input
     */
    public Map<String, Object> validate(Schema<?> schema, RequestMethod method, ResourceRequest request) {
        Map<String, Object> raw = RequestMethods.hasBody(method)
                ? readBody(request.getBody())
                : flatten(request.getQueryParams());

        ValidationResult result = schema.load(raw);
        if (!result.isValid()) {
            logger.debug("Rejected {} input: {}", method, result.getErrors());
            throw new ValidationException(result.getErrors());
        }
        return result.getData();
    }

    Map<String, Object> readBody(String body) {
        if (body == null || body.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode node = bodyReader.readTree(body);
            if (node == null || !node.isObject()) {
                throw new ProcessingException(PARSE_ERROR);
            }
            return objectMapper.convertValue(node, MAP_TYPE);
        } catch (JsonProcessingException e) {
            logger.debug("Unreadable request body: {}", e.getOriginalMessage());
            throw new ProcessingException(PARSE_ERROR);
        }
    }

    static Map<String, Object> flatten(MultiValueMap<String, String> queryParams) {
        Map<String, Object> raw = new LinkedHashMap<>();
        queryParams.forEach((key, values) -> {
            if (values.size() == 1) {
                raw.put(key, values.get(0));
            } else if (!values.isEmpty()) {
                raw.put(key, new ArrayList<>(values));
            }
        });
        return raw;
    }
}
