package com.stratus.table;

import java.lang.reflect.Field;
import java.util.Optional;

/**
 * Key fields of one entity class, as found by {@link EntityKeyReflector}.
 */
public class EntityKeys {

    private final Class<?> entityClass;
    private final KeyField partitionKey;
    private final KeyField sortKey;

    public EntityKeys(Class<?> entityClass, KeyField partitionKey, KeyField sortKey) {
        this.entityClass = entityClass;
        this.partitionKey = partitionKey;
        this.sortKey = sortKey;
    }

    public KeyField getPartitionKey() {
        return partitionKey;
    }

    public Optional<KeyField> getSortKey() {
        return Optional.ofNullable(sortKey);
    }

    public boolean hasSortKey() {
        return sortKey != null;
    }

    /**
     * @throws IllegalStateException if the partition key is null
     */
    public String partitionKeyOf(Object entity) {
        String value = partitionKey.read(entity);
        if (value == null) {
            throw new IllegalStateException("Partition key '" + partitionKey.getAttributeName() + "' of "
                    + entityClass.getSimpleName() + " cannot be null");
        }
        return value;
    }

    /**
     * Null when the entity has no sort key field or the field is unset.
     */
    public String sortKeyOf(Object entity) {
        return sortKey == null ? null : sortKey.read(entity);
    }

    // A field annotated with @PartitionKey or @SortKey
    public static class KeyField {
        private final Field field;
        private final String attributeName;

        public KeyField(Field field, String attributeName) {
            this.field = field;
            this.attributeName = attributeName;
        }

        public String getFieldName() {
            return field.getName();
        }

        public String getAttributeName() {
            return attributeName;
        }

        String read(Object entity) {
            try {
                Object value = field.get(entity);
                return value == null ? null : value.toString();
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read key field " + field.getName(), e);
            }
        }
    }
}
