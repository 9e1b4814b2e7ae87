package com.vuong.restkit.core.domain.jpa;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vuong.restkit.core.domain.DomainModel;
import com.vuong.restkit.core.domain.repository.GenericRepository;
import com.vuong.restkit.core.domain.specification.SpecificationBuilder;
import com.vuong.restkit.core.pagination.PageQuery;
import com.vuong.restkit.exception.ValidationException;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import org.modelmapper.ModelMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link DomainModel} over a Spring Data {@link GenericRepository}.
 * <p>
 * Relationship fields ({@code @ManyToOne}, {@code @OneToMany}, {@code @ManyToMany}, {@code @OneToOne})
 * are set from {@code <field>Id} or {@code <field>Ids} keys by loading the related entities
 * through their own repositories.
 * @param <T> the entity type
 * @param <ID> the entity's id type
 */
public class JpaDomainModel<T, ID> implements DomainModel<T> {

    private static final Logger logger = LoggerFactory.getLogger(JpaDomainModel.class);

    private final GenericRepository<T, ID> repository;
    private final RepositoryRegistry repositoryRegistry;
    private final ObjectMapper objectMapper;
    private final ModelMapper modelMapper;
    private final Class<T> entityClass;
    private final Field idField;
    private final List<Field> relationshipFields;

    public JpaDomainModel(GenericRepository<T, ID> repository, RepositoryRegistry repositoryRegistry,
                          ObjectMapper objectMapper, ModelMapper modelMapper) {
        this.repository = repository;
        this.repositoryRegistry = repositoryRegistry;
        this.objectMapper = objectMapper;
        this.modelMapper = modelMapper;
        this.entityClass = repository.getEntityClass();
        this.idField = findIdField(entityClass);
        this.relationshipFields = findRelationshipFields(entityClass);
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    @Override
    public T create(Map<String, Object> data) {
        T entity = modelMapper.map(data, entityClass);
        if (!idField.getType().isPrimitive()) {
            setFieldValue(entity, idField, null);
        }
        return entity;
    }

    @Override
    public void fetchRelated(T instance, Map<String, Object> data) {
        for (Field field : relationshipFields) {
            String key = relationKey(field, data);
            if (key != null) {
                setRelation(instance, field, key, data.get(key));
            }
        }
    }

    @Override
    public T persist(T instance) {
        T saved = repository.save(instance);
        logger.debug("Saved {} with ID: {}", entityClass.getSimpleName(), getFieldValue(saved, idField));
        return saved;
    }

    @Override
    public Optional<T> getById(String id) {
        ID converted;
        try {
            converted = convertId(id);
        } catch (IllegalArgumentException e) {
            logger.debug("Id {} is not a valid {} id", id, entityClass.getSimpleName());
            return Optional.empty();
        }
        return repository.findById(converted);
    }

    @Override
    public List<T> getList(Map<String, Object> filters, PageQuery page) {
        PageRequest pageable = PageRequest.of(page.getPage() - 1, page.getPageSize(), Sort.by(idField.getName()));
        return repository.findAll(specification(filters), pageable).getContent();
    }

    @Override
    public long getCount(Map<String, Object> filters) {
        return repository.count(specification(filters));
    }

    @Override
    public void setField(T instance, String field, Object value) {
        Optional<Field> relation = relationshipFields.stream()
                .filter(f -> field.equals(f.getName() + "Id") || field.equals(f.getName() + "Ids"))
                .findFirst();
        if (relation.isPresent()) {
            setRelation(instance, relation.get(), field, value);
            return;
        }
        try {
            objectMapper.updateValue(instance, Collections.singletonMap(field, value));
        } catch (JsonMappingException e) {
            throw ValidationException.forField(field, "Invalid value.");
        }
    }

    private Specification<T> specification(Map<String, Object> filters) {
        return SpecificationBuilder.build(filters, entityClass);
    }

    @SuppressWarnings("unchecked")
    private ID convertId(String id) {
        return (ID) objectMapper.convertValue(id, idField.getType());
    }

    private static String relationKey(Field field, Map<String, Object> data) {
        if (data.containsKey(field.getName() + "Ids")) {
            return field.getName() + "Ids";
        }
        if (data.containsKey(field.getName() + "Id")) {
            return field.getName() + "Id";
        }
        return null;
    }

    private void setRelation(T instance, Field field, String key, Object value) {
        Class<?> relatedClass = relationType(field);
        GenericRepository<?, Object> related = repositoryRegistry.find(relatedClass)
                .orElseThrow(() -> new IllegalStateException("No repository registered for " + relatedClass.getName()));
        Class<?> relatedIdType = findIdField(relatedClass).getType();

        if (Collection.class.isAssignableFrom(field.getType())) {
            List<Object> ids = new ArrayList<>();
            if (value instanceof Collection<?> values) {
                values.forEach(v -> ids.add(convertRelatedId(key, v, relatedIdType)));
            } else if (value != null) {
                ids.add(convertRelatedId(key, value, relatedIdType));
            }
            List<?> found = related.findAllById(ids);
            if (found.size() != new HashSet<>(ids).size()) {
                throw ValidationException.forField(key, "Related object not found.");
            }
            Collection<Object> target = Set.class.isAssignableFrom(field.getType()) ? new HashSet<>(found) : new ArrayList<>(found);
            setFieldValue(instance, field, target);
        } else if (value == null) {
            setFieldValue(instance, field, null);
        } else {
            Object relatedInstance = related.findById(convertRelatedId(key, value, relatedIdType))
                    .orElseThrow(() -> ValidationException.forField(key, "Related object not found."));
            setFieldValue(instance, field, relatedInstance);
        }
    }

    private Object convertRelatedId(String key, Object value, Class<?> idType) {
        try {
            return objectMapper.convertValue(value, idType);
        } catch (IllegalArgumentException e) {
            throw ValidationException.forField(key, "Invalid id.");
        }
    }

    private static Class<?> relationType(Field field) {
        if (Collection.class.isAssignableFrom(field.getType())) {
            ParameterizedType genericType = (ParameterizedType) field.getGenericType();
            return (Class<?>) genericType.getActualTypeArguments()[0];
        }
        return field.getType();
    }

    private static List<Field> findRelationshipFields(Class<?> entityClass) {
        List<Field> fields = new ArrayList<>();
        for (Class<?> current = entityClass; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.isAnnotationPresent(OneToMany.class) || field.isAnnotationPresent(ManyToOne.class)
                        || field.isAnnotationPresent(ManyToMany.class) || field.isAnnotationPresent(OneToOne.class)) {
                    field.setAccessible(true);
                    fields.add(field);
                }
            }
        }
        return List.copyOf(fields);
    }

    static Field findIdField(Class<?> entityClass) {
        for (Class<?> current = entityClass; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.isAnnotationPresent(Id.class) || field.isAnnotationPresent(EmbeddedId.class)) {
                    field.setAccessible(true);
                    return field;
                }
            }
        }
        throw new IllegalStateException("No @Id field on " + entityClass.getName());
    }

    private static Object getFieldValue(Object target, Field field) {
        try {
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + field, e);
        }
    }

    private static void setFieldValue(Object target, Field field, Object value) {
        try {
            field.set(target, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write " + field, e);
        }
    }
}
