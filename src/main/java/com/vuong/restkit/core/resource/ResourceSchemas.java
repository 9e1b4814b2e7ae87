package com.vuong.restkit.core.resource;

import com.vuong.restkit.core.schema.Schema;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request and response schemas of a resource, chosen per HTTP method with a default for
 * methods that declare none.
 * @param <T> the entity type the response schemas serialize
 */
public final class ResourceSchemas<T> {

    private final Schema<? super T> defaultRequest;
    private final Schema<? super T> defaultResponse;
    private final Map<RequestMethod, Schema<? super T>> request;
    private final Map<RequestMethod, Schema<? super T>> response;

    private ResourceSchemas(Builder<T> builder) {
        this.defaultRequest = builder.defaultRequest;
        this.defaultResponse = builder.defaultResponse;
        this.request = Collections.unmodifiableMap(new EnumMap<>(builder.request));
        this.response = Collections.unmodifiableMap(new EnumMap<>(builder.response));
    }

    /**
     * Starts a builder whose defaults are the given schema in both directions.
     */
    public static <T> Builder<T> builder(Schema<? super T> defaultSchema) {
        return new Builder<>(defaultSchema);
    }

    /**
     * Uses the same schema for every method and direction.
     */
    public static <T> ResourceSchemas<T> of(Schema<? super T> schema) {
        return new Builder<T>(schema).build();
    }

    public Schema<? super T> requestSchema(RequestMethod method) {
        return request.getOrDefault(method, defaultRequest);
    }

    public Schema<? super T> responseSchema(RequestMethod method) {
        return response.getOrDefault(method, defaultResponse);
    }

    public static final class Builder<T> {
        private Schema<? super T> defaultRequest;
        private Schema<? super T> defaultResponse;
        private final Map<RequestMethod, Schema<? super T>> request = new EnumMap<>(RequestMethod.class);
        private final Map<RequestMethod, Schema<? super T>> response = new EnumMap<>(RequestMethod.class);

        private Builder(Schema<? super T> defaultSchema) {
            this.defaultRequest = Objects.requireNonNull(defaultSchema, "defaultSchema");
            this.defaultResponse = defaultSchema;
        }

        public Builder<T> defaultRequest(Schema<? super T> schema) {
            this.defaultRequest = Objects.requireNonNull(schema);
            return this;
        }

        public Builder<T> defaultResponse(Schema<? super T> schema) {
            this.defaultResponse = Objects.requireNonNull(schema);
            return this;
        }

        public Builder<T> request(RequestMethod method, Schema<? super T> schema) {
            request.put(method, Objects.requireNonNull(schema));
            return this;
        }

        public Builder<T> response(RequestMethod method, Schema<? super T> schema) {
            response.put(method, Objects.requireNonNull(schema));
            return this;
        }

        public ResourceSchemas<T> build() {
            return new ResourceSchemas<>(this);
        }
    }
}
