package com.vuong.restkit.core.domain.jpa;

import com.vuong.restkit.core.domain.repository.GenericRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds the {@link GenericRepository} of an entity class, used to resolve related objects.
 */
@Component
public class RepositoryRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RepositoryRegistry.class);

    private final ApplicationContext applicationContext;
    private final Map<Class<?>, GenericRepository<?, ?>> repositories = new ConcurrentHashMap<>();

    public RepositoryRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    @SuppressWarnings("rawtypes")
    void registerRepositories() {
        Map<String, GenericRepository> beans = applicationContext.getBeansOfType(GenericRepository.class);
        beans.values().forEach(this::register);
    }

    /**
     * Registers a repository under its entity class.
     */
    public void register(GenericRepository<?, ?> repository) {
        Class<?> entityClass = repository.getEntityClass();
        repositories.put(entityClass, repository);
        logger.info("Registered repository for entity: {}", entityClass.getName());
    }

    /**
     * @param entityClass the entity class
     * @param <T> the entity type
     * @return the repository managing that class, if any
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<GenericRepository<T, Object>> find(Class<T> entityClass) {
        return Optional.ofNullable((GenericRepository<T, Object>) repositories.get(entityClass));
    }
}
