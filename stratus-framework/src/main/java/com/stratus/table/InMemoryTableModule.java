package com.stratus.table;

import com.google.inject.AbstractModule;
import com.google.inject.Key;
import com.google.inject.util.Types;
import com.stratus.api.EntityTable;
import com.stratus.api.TableEntity;
import com.stratus.hosting.TableRegistration;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Binds {@code EntityTable<T>} to one shared in-memory table per registered
 * entity.
 */
@Slf4j
public class InMemoryTableModule extends AbstractModule {
    private final List<TableRegistration> tables;
    private final EntityKeyReflector reflector = new EntityKeyReflector();

    public InMemoryTableModule(List<TableRegistration> tables) {
        this.tables = tables;
    }

    @Override
    protected void configure() {
        bind(EntityKeyReflector.class).toInstance(reflector);
        for (TableRegistration table : tables) {
            bindTable(table.getEntityType().asSubclass(TableEntity.class));
            log.debug("Bound in-memory table for {}", table.getEntityName());
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends TableEntity> void bindTable(Class<T> entityType) {
        Key<EntityTable<T>> key = (Key<EntityTable<T>>) Key.get(Types.newParameterizedType(EntityTable.class, entityType));
        bind(key).toInstance(new InMemoryTable<>(reflector.getEntityKeys(entityType)));
    }
}
