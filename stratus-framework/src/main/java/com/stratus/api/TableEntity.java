package com.stratus.api;

/**
 * Marker for types stored in an {@link EntityTable}. Exactly one field must carry
 * {@link PartitionKey}; at most one may carry {@link SortKey}.
 */
public interface TableEntity {
}
