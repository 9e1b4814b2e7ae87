package com.vuong.restkit.core.domain;

import com.vuong.restkit.core.pagination.PageQuery;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations the resource handlers need from the storage layer for one entity type.
 * Implementations own their store, connection handling and transactions.
 * @param <T> the entity type
 */
public interface DomainModel<T> {

    /**
     * Builds a new, unsaved instance from validated data.
     */
    T create(Map<String, Object> data);

    /**
     * Resolves the objects the new instance refers to, such as {@code ownerId} to an owner.
     * @param instance the instance built by {@link #create(Map)}
     * @param data the validated data it was built from
     */
    void fetchRelated(T instance, Map<String, Object> data);

    /**
     * Saves the instance and returns the stored state.
     */
    T persist(T instance);

    /**
     * @param id the identifier as it appears in the request path
     * @return the instance, or empty if there is none with that id
     */
    Optional<T> getById(String id);

    /**
     * @return the items of the requested page that match the filters
     */
    List<T> getList(Map<String, Object> filters, PageQuery page);

    /**
     * @return the number of items matching the filters across all pages
     */
    long getCount(Map<String, Object> filters);

    /**
     * Sets one field on the instance.
     */
    void setField(T instance, String field, Object value);
}
