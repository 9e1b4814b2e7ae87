package com.vuong.restkit.core.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.NoRepositoryBean;

/**
 * Base interface for repositories that back a JPA domain model.
 * Concrete repositories implement {@link #getEntityClass()} as a default method.
 * @param <T> the entity type
 * @param <ID> the ID type
 */
@NoRepositoryBean
public interface GenericRepository<T, ID> extends JpaRepository<T, ID>, JpaSpecificationExecutor<T> {

    /**
     * @return the entity class managed by this repository
     */
    Class<T> getEntityClass();
}
