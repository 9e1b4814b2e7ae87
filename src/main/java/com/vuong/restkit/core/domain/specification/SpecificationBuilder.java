package com.vuong.restkit.core.domain.specification;

import com.vuong.restkit.exception.ValidationException;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds JPA Specifications from the filters of a list request.
 * <p>
 * A filter naming an entity field matches by equality ({@code IN} when the value is a list,
 * {@code IS NULL} when it is null). A filter named {@code <relation>Id} or {@code <relation>Ids}
 * matches the id of the related entity. String values are converted to the field's type;
 * filters that match no field are ignored.
 */
public final class SpecificationBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SpecificationBuilder.class);
    private static final Map<Class<?>, Map<String, Optional<Field>>> FIELD_CACHE = new ConcurrentHashMap<>();
    private static final String RELATED_ID_ATTRIBUTE = "id";

    private SpecificationBuilder() {
    }

    /**
     * @param filters field name to wanted value
     * @param entityClass the entity the specification applies to
     * @param <T> the entity type
     * @return a specification matching all filters
     */
    public static <T> Specification<T> build(Map<String, Object> filters, Class<T> entityClass) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            filters.forEach((key, value) -> {
                try {
                    addPredicate(root, query, cb, predicates, entityClass, key, value);
                } catch (IllegalArgumentException e) {
                    throw ValidationException.forField(key, "Invalid value.");
                }
            });
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static <T> void addPredicate(Root<T> root, CriteriaQuery<?> query, CriteriaBuilder cb,
                                         List<Predicate> predicates, Class<T> entityClass, String key, Object value) {
        Optional<Field> field = findField(entityClass, key);
        if (field.isPresent()) {
            predicates.add(fieldPredicate(root.get(key), cb, field.get().getType(), value));
            return;
        }
        String relation = relationName(key);
        if (relation != null && findField(entityClass, relation).isPresent()) {
            Field relationField = findField(entityClass, relation).get();
            if (Collection.class.isAssignableFrom(relationField.getType())) {
                query.distinct(true);
            }
            predicates.add(relationPredicate(root, relation, value));
            return;
        }
        logger.debug("Ignoring filter {} unknown to {}", key, entityClass.getSimpleName());
    }

    private static Predicate fieldPredicate(Expression<Object> path, CriteriaBuilder cb, Class<?> type, Object value) {
        if (value == null) {
            return cb.isNull(path);
        }
        if (value instanceof Collection<?> values) {
            return path.in(values.stream().map(v -> convert(v, type)).toList());
        }
        return cb.equal(path, convert(value, type));
    }

    private static <T> Predicate relationPredicate(Root<T> root, String relation, Object value) {
        Join<T, Object> join = root.join(relation, JoinType.LEFT);
        List<Object> ids = new ArrayList<>();
        if (value instanceof Collection<?> values) {
            ids.addAll(values);
        } else if (value instanceof String text && text.contains(",")) {
            for (String part : text.split(",")) {
                ids.add(part.trim());
            }
        } else {
            ids.add(value);
        }
        Class<?> idType = join.get(RELATED_ID_ATTRIBUTE).getJavaType();
        return join.get(RELATED_ID_ATTRIBUTE).in(ids.stream().map(id -> convert(id, idType)).toList());
    }

    static String relationName(String key) {
        if (key.endsWith("Ids") && key.length() > 3) {
            return key.substring(0, key.length() - 3);
        }
        if (key.endsWith("Id") && key.length() > 2) {
            return key.substring(0, key.length() - 2);
        }
        return null;
    }

    /**
     * Converts a filter value to the field's type when it arrives as text.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static Object convert(Object value, Class<?> type) {
        if (!(value instanceof String text) || type == null || type == String.class || type == Object.class) {
            return value;
        }
        String trimmed = text.trim();
        if (type == Boolean.class || type == boolean.class) {
            return Boolean.valueOf(trimmed);
        }
        if (type.isEnum()) {
            return Enum.valueOf((Class<Enum>) type, trimmed);
        }
        if (type == Integer.class || type == int.class) {
            return Integer.valueOf(trimmed);
        }
        if (type == Long.class || type == long.class) {
            return Long.valueOf(trimmed);
        }
        if (type == Double.class || type == double.class) {
            return Double.valueOf(trimmed);
        }
        if (type == Float.class || type == float.class) {
            return Float.valueOf(trimmed);
        }
        if (type == Short.class || type == short.class) {
            return Short.valueOf(trimmed);
        }
        if (type == UUID.class) {
            return UUID.fromString(trimmed);
        }
        return value;
    }

    private static Optional<Field> findField(Class<?> clazz, String fieldName) {
        return FIELD_CACHE
                .computeIfAbsent(clazz, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(fieldName, k -> findFieldInHierarchy(clazz, fieldName));
    }

    private static Optional<Field> findFieldInHierarchy(Class<?> clazz, String fieldName) {
        for (Class<?> current = clazz; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(fieldName)) {
                    return Optional.of(field);
                }
            }
        }
        return Optional.empty();
    }
}
