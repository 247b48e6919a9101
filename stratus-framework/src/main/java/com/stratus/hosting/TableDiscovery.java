package com.stratus.hosting;

import com.stratus.api.TableEntity;
import com.stratus.api.TableName;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Collects concrete {@link TableEntity} types, in order, first occurrence wins.
 */
@Slf4j
public class TableDiscovery {
    private final Set<Class<?>> candidates = new LinkedHashSet<>();

    public TableDiscovery from(Class<?>... types) {
        return from(Arrays.asList(types));
    }

    public TableDiscovery from(Collection<Class<?>> types) {
        candidates.addAll(types);
        return this;
    }

    public List<TableRegistration> discover() {
        List<TableRegistration> registrations = new ArrayList<>();
        for (Class<?> candidate : candidates) {
            inspect(candidate).ifPresent(registrations::add);
        }
        log.debug("Discovered {} table(s)", registrations.size());
        return registrations;
    }

    static Optional<TableRegistration> inspect(Class<?> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())
                || !TableEntity.class.isAssignableFrom(type)) {
            return Optional.empty();
        }
        TableName tableName = type.getAnnotation(TableName.class);
        String name = tableName != null ? tableName.value() : TableRegistration.conventionName(type);
        return Optional.of(new TableRegistration(type, name));
    }
}
