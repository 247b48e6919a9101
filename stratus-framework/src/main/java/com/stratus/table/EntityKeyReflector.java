package com.stratus.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.stratus.api.PartitionKey;
import com.stratus.api.SortKey;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Injectable utility that finds and caches the key fields of table entities.
 */
@Singleton
public class EntityKeyReflector {

    // Cache of entity class to key information
    private final Map<Class<?>, EntityKeys> keysByClass = new ConcurrentHashMap<>();

    @Inject
    public EntityKeyReflector() {
        // Constructor for Guice
    }

    /**
     * Gets or builds the key information for an entity class.
     *
     * @throws IllegalStateException if the class has no single {@link PartitionKey} field
     *                               or more than one {@link SortKey} field
     */
    public EntityKeys getEntityKeys(Class<?> entityClass) {
        return keysByClass.computeIfAbsent(entityClass, this::buildEntityKeys);
    }

    private EntityKeys buildEntityKeys(Class<?> entityClass) {
        List<Field> partitionKeys = new ArrayList<>();
        List<Field> sortKeys = new ArrayList<>();

        // Process all fields in the class hierarchy
        Class<?> currentClass = entityClass;
        while (currentClass != null && !currentClass.equals(Object.class)) {
            for (Field field : currentClass.getDeclaredFields()) {
                if (field.isAnnotationPresent(PartitionKey.class)) {
                    partitionKeys.add(field);
                }
                if (field.isAnnotationPresent(SortKey.class)) {
                    sortKeys.add(field);
                }
            }
            currentClass = currentClass.getSuperclass();
        }

        if (partitionKeys.size() != 1) {
            throw new IllegalStateException(entityClass.getSimpleName() + " must have exactly one @PartitionKey field, found "
                    + partitionKeys.size());
        }
        if (sortKeys.size() > 1) {
            throw new IllegalStateException(entityClass.getSimpleName() + " must have at most one @SortKey field, found "
                    + sortKeys.size());
        }

        return new EntityKeys(entityClass,
                keyField(partitionKeys.get(0)),
                sortKeys.isEmpty() ? null : keyField(sortKeys.get(0)));
    }

    private static EntityKeys.KeyField keyField(Field field) {
        field.setAccessible(true);
        JsonProperty property = field.getAnnotation(JsonProperty.class);
        String attributeName = property != null && !property.value().isEmpty() ? property.value() : field.getName();
        return new EntityKeys.KeyField(field, attributeName);
    }
}
