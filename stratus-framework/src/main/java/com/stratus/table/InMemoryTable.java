package com.stratus.table;

import com.stratus.api.EntityTable;
import com.stratus.api.TableEntity;
import io.vertx.core.Future;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Table kept in a concurrent map, used when running locally. Contents live
 * as long as the process.
 */
@Slf4j
public class InMemoryTable<T extends TableEntity> implements EntityTable<T> {
    private final Map<ItemKey, T> items = new ConcurrentHashMap<>();
    private final EntityKeys keys;

    public InMemoryTable(EntityKeys keys) {
        this.keys = keys;
    }

    public InMemoryTable(Class<T> entityType) {
        this(new EntityKeyReflector().getEntityKeys(entityType));
    }

    @Override
    public Future<Optional<T>> get(String partitionKey) {
        return Future.succeededFuture(Optional.ofNullable(items.get(new ItemKey(partitionKey, null))));
    }

    @Override
    public Future<Optional<T>> get(String partitionKey, String sortKey) {
        return Future.succeededFuture(Optional.ofNullable(items.get(new ItemKey(partitionKey, sortKey))));
    }

    @Override
    public Future<Void> put(T entity) {
        try {
            items.put(new ItemKey(keys.partitionKeyOf(entity), keys.sortKeyOf(entity)), entity);
            return Future.succeededFuture();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<Void> delete(String partitionKey) {
        items.keySet().removeIf(key -> key.getPartitionKey().equals(partitionKey));
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> delete(String partitionKey, String sortKey) {
        items.remove(new ItemKey(partitionKey, sortKey));
        return Future.succeededFuture();
    }

    @Override
    public Future<List<T>> query(String partitionKey) {
        List<T> matches = items.entrySet().stream()
                .filter(entry -> Objects.equals(entry.getKey().getPartitionKey(), partitionKey))
                .map(Map.Entry::getValue)
                .collect(Collectors.toList());
        return Future.succeededFuture(matches);
    }

    @Override
    public Future<List<T>> scan() {
        return Future.succeededFuture(new ArrayList<>(items.values()));
    }

    @Value
    private static class ItemKey {
        String partitionKey;
        String sortKey;
    }
}
