package com.vuong.restkit.core.resource;

import com.vuong.restkit.core.schema.PassThroughSchema;
import com.vuong.restkit.core.schema.Schema;
import com.vuong.restkit.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMethod;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResourceSchemas Tests")
class ResourceSchemasTest {

    @Test
    @DisplayName("Should fall back to the defaults for methods without their own schema")
    void shouldFallBackToDefaults() {
        // Given
        Schema<Object> base = new PassThroughSchema(TestFixtures.objectMapper());
        Schema<Object> response = new PassThroughSchema(TestFixtures.objectMapper());
        Schema<Object> patch = new PassThroughSchema(TestFixtures.objectMapper());

        // When
        ResourceSchemas<Object> schemas = ResourceSchemas.builder(base)
                .defaultResponse(response)
                .request(RequestMethod.PATCH, patch)
                .build();

        // Then
        assertThat(schemas.requestSchema(RequestMethod.PATCH)).isSameAs(patch);
        assertThat(schemas.requestSchema(RequestMethod.POST)).isSameAs(base);
        assertThat(schemas.responseSchema(RequestMethod.PATCH)).isSameAs(response);
    }
}
