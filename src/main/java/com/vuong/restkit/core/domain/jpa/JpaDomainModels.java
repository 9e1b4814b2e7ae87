package com.vuong.restkit.core.domain.jpa;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vuong.restkit.core.domain.repository.GenericRepository;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Component;

/**
 * Creates {@link JpaDomainModel}s for repositories, e.g.
 * {@code new ListCreateResource<>("books", jpaDomainModels.of(bookRepository), schemas, paginator)}.
 */
@Component
public class JpaDomainModels {

    private final RepositoryRegistry repositoryRegistry;
    private final ObjectMapper objectMapper;
    private final ModelMapper modelMapper;

    public JpaDomainModels(RepositoryRegistry repositoryRegistry, ObjectMapper objectMapper, ModelMapper modelMapper) {
        this.repositoryRegistry = repositoryRegistry;
        this.objectMapper = objectMapper;
        this.modelMapper = modelMapper;
    }

    public <T, ID> JpaDomainModel<T, ID> of(GenericRepository<T, ID> repository) {
        return new JpaDomainModel<>(repository, repositoryRegistry, objectMapper, modelMapper);
    }
}
