package com.stratus.api;

import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Key-value table of entities, addressed by partition key and optional sort key.
 * The backing store is chosen by the runtime: in-memory locally, DynamoDB when hosted.
 *
 * @param <T> the entity type
 */
public interface EntityTable<T extends TableEntity> {

    /**
     * Looks up the item stored without a sort key.
     *
     * @return the item, or empty when absent
     */
    Future<Optional<T>> get(String partitionKey);

    Future<Optional<T>> get(String partitionKey, String sortKey);

    /**
     * Inserts or replaces the item with the entity's key.
     */
    Future<Void> put(T entity);

    /**
     * Removes every item whose partition key equals the given one.
     */
    Future<Void> delete(String partitionKey);

    Future<Void> delete(String partitionKey, String sortKey);

    /**
     * All items of one partition.
     */
    Future<List<T>> query(String partitionKey);

    Future<List<T>> scan();
}
