package com.stratus.table;

import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.document.Item;
import com.amazonaws.services.dynamodbv2.document.ItemUtils;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.DeleteItemRequest;
import com.amazonaws.services.dynamodbv2.model.GetItemRequest;
import com.amazonaws.services.dynamodbv2.model.GetItemResult;
import com.amazonaws.services.dynamodbv2.model.PutItemRequest;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.QueryResult;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.ScanResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stratus.api.EntityTable;
import com.stratus.api.TableEntity;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table backed by a DynamoDB table. Items are converted through their JSON
 * form; key attributes are stored as strings. Calls block the calling
 * thread and the returned futures are already complete.
 */
@Slf4j
public class DynamoDbTable<T extends TableEntity> implements EntityTable<T> {
    private final AmazonDynamoDB dynamoDB;
    private final String tableName;
    private final Class<T> entityType;
    private final EntityKeys keys;
    private final ObjectMapper objectMapper;

    public DynamoDbTable(AmazonDynamoDB dynamoDB, String tableName, Class<T> entityType,
                         EntityKeys keys, ObjectMapper objectMapper) {
        this.dynamoDB = dynamoDB;
        this.tableName = tableName;
        this.entityType = entityType;
        this.keys = keys;
        this.objectMapper = objectMapper;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public Future<Optional<T>> get(String partitionKey) {
        if (keys.hasSortKey()) {
            // every stored item has a sort key, so a partition key alone never names one
            return Future.succeededFuture(Optional.empty());
        }
        return getItem(keyOf(partitionKey, null));
    }

    @Override
    public Future<Optional<T>> get(String partitionKey, String sortKey) {
        return getItem(keyOf(partitionKey, sortKey));
    }

    private Future<Optional<T>> getItem(Map<String, AttributeValue> key) {
        return Future.future(promise -> {
            try {
                GetItemResult result = dynamoDB.getItem(new GetItemRequest()
                        .withTableName(tableName)
                        .withKey(key)
                        .withConsistentRead(true));
                Map<String, AttributeValue> item = result.getItem();
                promise.complete(item == null || item.isEmpty() ? Optional.empty() : Optional.of(fromItem(item)));
            } catch (Exception e) {
                log.error("Failed to get item from {}", tableName, e);
                promise.fail(e);
            }
        });
    }

    @Override
    public Future<Void> put(T entity) {
        return Future.future(promise -> {
            try {
                keys.partitionKeyOf(entity);
                dynamoDB.putItem(new PutItemRequest()
                        .withTableName(tableName)
                        .withItem(toItem(entity)));
                promise.complete();
            } catch (Exception e) {
                log.error("Failed to put item into {}", tableName, e);
                promise.fail(e);
            }
        });
    }

    @Override
    public Future<Void> delete(String partitionKey) {
        return Future.future(promise -> {
            try {
                if (keys.hasSortKey()) {
                    for (Map<String, AttributeValue> item : queryItems(partitionKey)) {
                        dynamoDB.deleteItem(new DeleteItemRequest()
                                .withTableName(tableName)
                                .withKey(keyOf(item)));
                    }
                } else {
                    dynamoDB.deleteItem(new DeleteItemRequest()
                            .withTableName(tableName)
                            .withKey(keyOf(partitionKey, null)));
                }
                promise.complete();
            } catch (Exception e) {
                log.error("Failed to delete partition {} from {}", partitionKey, tableName, e);
                promise.fail(e);
            }
        });
    }

    @Override
    public Future<Void> delete(String partitionKey, String sortKey) {
        return Future.future(promise -> {
            try {
                dynamoDB.deleteItem(new DeleteItemRequest()
                        .withTableName(tableName)
                        .withKey(keyOf(partitionKey, sortKey)));
                promise.complete();
            } catch (Exception e) {
                log.error("Failed to delete item from {}", tableName, e);
                promise.fail(e);
            }
        });
    }

    @Override
    public Future<List<T>> query(String partitionKey) {
        return Future.future(promise -> {
            try {
                List<T> results = new ArrayList<>();
                for (Map<String, AttributeValue> item : queryItems(partitionKey)) {
                    results.add(fromItem(item));
                }
                promise.complete(results);
            } catch (Exception e) {
                log.error("Failed to query {} for partition {}", tableName, partitionKey, e);
                promise.fail(e);
            }
        });
    }

    @Override
    public Future<List<T>> scan() {
        return Future.future(promise -> {
            try {
                List<T> results = new ArrayList<>();
                Map<String, AttributeValue> startKey = null;
                do {
                    ScanResult page = dynamoDB.scan(new ScanRequest()
                            .withTableName(tableName)
                            .withExclusiveStartKey(startKey));
                    for (Map<String, AttributeValue> item : page.getItems()) {
                        results.add(fromItem(item));
                    }
                    startKey = page.getLastEvaluatedKey();
                } while (startKey != null && !startKey.isEmpty());
                promise.complete(results);
            } catch (Exception e) {
                log.error("Failed to scan {}", tableName, e);
                promise.fail(e);
            }
        });
    }

    private List<Map<String, AttributeValue>> queryItems(String partitionKey) {
        List<Map<String, AttributeValue>> items = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        do {
            QueryResult page = dynamoDB.query(new QueryRequest()
                    .withTableName(tableName)
                    .withKeyConditionExpression("#pk = :pk")
                    .withExpressionAttributeNames(Map.of("#pk", keys.getPartitionKey().getAttributeName()))
                    .withExpressionAttributeValues(Map.of(":pk", new AttributeValue(partitionKey)))
                    .withExclusiveStartKey(startKey));
            items.addAll(page.getItems());
            startKey = page.getLastEvaluatedKey();
        } while (startKey != null && !startKey.isEmpty());
        return items;
    }

    private Map<String, AttributeValue> keyOf(String partitionKey, String sortKey) {
        Map<String, AttributeValue> key = new HashMap<>();
        key.put(keys.getPartitionKey().getAttributeName(), new AttributeValue(partitionKey));
        keys.getSortKey().ifPresent(field -> key.put(field.getAttributeName(), new AttributeValue(sortKey)));
        return key;
    }

    private Map<String, AttributeValue> keyOf(Map<String, AttributeValue> item) {
        Map<String, AttributeValue> key = new HashMap<>();
        String partitionAttribute = keys.getPartitionKey().getAttributeName();
        key.put(partitionAttribute, item.get(partitionAttribute));
        keys.getSortKey().ifPresent(field -> key.put(field.getAttributeName(), item.get(field.getAttributeName())));
        return key;
    }

    Map<String, AttributeValue> toItem(T entity) throws JsonProcessingException {
        Map<String, AttributeValue> item = new HashMap<>(
                ItemUtils.toAttributeValues(Item.fromJSON(objectMapper.writeValueAsString(entity))));
        // keys are declared as string attributes whatever the field type
        item.put(keys.getPartitionKey().getAttributeName(), new AttributeValue(keys.partitionKeyOf(entity)));
        String sortKey = keys.sortKeyOf(entity);
        if (sortKey != null) {
            item.put(keys.getSortKey().get().getAttributeName(), new AttributeValue(sortKey));
        }
        return item;
    }

    T fromItem(Map<String, AttributeValue> item) throws JsonProcessingException {
        return objectMapper.readValue(ItemUtils.toItem(item).toJSON(), entityType);
    }
}
