package com.stratus.table;

import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.model.AttributeValue;
import com.amazonaws.services.dynamodbv2.model.DeleteItemRequest;
import com.amazonaws.services.dynamodbv2.model.GetItemRequest;
import com.amazonaws.services.dynamodbv2.model.GetItemResult;
import com.amazonaws.services.dynamodbv2.model.PutItemRequest;
import com.amazonaws.services.dynamodbv2.model.PutItemResult;
import com.amazonaws.services.dynamodbv2.model.QueryRequest;
import com.amazonaws.services.dynamodbv2.model.QueryResult;
import com.amazonaws.services.dynamodbv2.model.ResourceNotFoundException;
import com.amazonaws.services.dynamodbv2.model.ScanRequest;
import com.amazonaws.services.dynamodbv2.model.ScanResult;
import com.stratus.binding.JsonMappers;
import com.stratus.hosting.TableRegistration;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class DynamoDbTableTest {
    @Mock
    private AmazonDynamoDB dynamoDB;

    private final EntityKeyReflector reflector = new EntityKeyReflector();
    private DynamoDbTable<SimpleItem> table;
    private DynamoDbTable<CompositeItem> composite;

    @BeforeEach
    void setup() {
        table = new DynamoDbTable<>(dynamoDB, "SimpleItems", SimpleItem.class,
                reflector.getEntityKeys(SimpleItem.class), JsonMappers.create());
        composite = new DynamoDbTable<>(dynamoDB, "CompositeItems", CompositeItem.class,
                reflector.getEntityKeys(CompositeItem.class), JsonMappers.create());
    }

    private static <T> T await(Future<T> future) {
        return future.toCompletionStage().toCompletableFuture().join();
    }

    private static Map<String, AttributeValue> item(String id, String name) {
        return Map.of("id", new AttributeValue(id), "name", new AttributeValue(name));
    }

    @Test
    void testPut_writesItemWithStringKey() {
        when(dynamoDB.putItem(any(PutItemRequest.class))).thenReturn(new PutItemResult());

        await(table.put(new SimpleItem("1", "Test")));

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDB).putItem(captor.capture());
        assertThat(captor.getValue().getTableName()).isEqualTo("SimpleItems");
        assertThat(captor.getValue().getItem().get("id").getS()).isEqualTo("1");
        assertThat(captor.getValue().getItem().get("name").getS()).isEqualTo("Test");
    }

    @Test
    void testGet_convertsItem() {
        when(dynamoDB.getItem(any(GetItemRequest.class))).thenReturn(new GetItemResult().withItem(item("1", "Test")));

        Optional<SimpleItem> result = await(table.get("1"));

        assertThat(result).isPresent();
        assertThat(result.get().name).isEqualTo("Test");
        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDB).getItem(captor.capture());
        assertThat(captor.getValue().getKey()).containsOnlyKeys("id");
    }

    @Test
    void testGet_missingItemIsEmpty() {
        when(dynamoDB.getItem(any(GetItemRequest.class))).thenReturn(new GetItemResult());

        assertThat(await(table.get("nope"))).isEmpty();
    }

    @Test
    void testGet_clientFailureFailsFuture() {
        when(dynamoDB.getItem(any(GetItemRequest.class))).thenThrow(new ResourceNotFoundException("no table"));

        Future<Optional<SimpleItem>> result = table.get("1");

        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void testQuery_followsPagination() {
        Map<String, AttributeValue> lastKey = Map.of("id", new AttributeValue("a"));
        when(dynamoDB.query(any(QueryRequest.class))).thenReturn(
                new QueryResult().withItems(List.of(item("a", "first"))).withLastEvaluatedKey(lastKey),
                new QueryResult().withItems(List.of(item("a", "second"))));

        List<SimpleItem> results = await(table.query("a"));

        assertThat(results).extracting(item -> item.name).containsExactly("first", "second");
        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDB, times(2)).query(captor.capture());
        assertThat(captor.getAllValues().get(0).getExclusiveStartKey()).isNull();
        assertThat(captor.getAllValues().get(1).getExclusiveStartKey()).isEqualTo(lastKey);
        assertThat(captor.getAllValues().get(0).getExpressionAttributeValues().get(":pk").getS()).isEqualTo("a");
    }

    @Test
    void testScan_followsPagination() {
        when(dynamoDB.scan(any(ScanRequest.class))).thenReturn(
                new ScanResult().withItems(List.of(item("1", "A"))).withLastEvaluatedKey(Map.of("id", new AttributeValue("1"))),
                new ScanResult().withItems(List.of(item("2", "B"))));

        assertThat(await(table.scan())).hasSize(2);
    }

    @Test
    void testDelete_compositeTableDeletesEveryItemOfPartition() {
        Map<String, AttributeValue> first = Map.of("pk", new AttributeValue("user1"), "sk", new AttributeValue("a"),
                "data", new AttributeValue("1"));
        Map<String, AttributeValue> second = Map.of("pk", new AttributeValue("user1"), "sk", new AttributeValue("b"),
                "data", new AttributeValue("2"));
        when(dynamoDB.query(any(QueryRequest.class))).thenReturn(new QueryResult().withItems(List.of(first, second)));

        await(composite.delete("user1"));

        ArgumentCaptor<DeleteItemRequest> captor = ArgumentCaptor.forClass(DeleteItemRequest.class);
        verify(dynamoDB, times(2)).deleteItem(captor.capture());
        assertThat(captor.getAllValues()).extracting(request -> request.getKey().get("sk").getS())
                .containsExactly("a", "b");
        assertThat(captor.getAllValues().get(0).getKey()).containsOnlyKeys("pk", "sk");
    }

    @Test
    void testGet_partitionOnlyOnCompositeTableIsEmpty() {
        assertThat(await(composite.get("user1"))).isEmpty();
    }

    @Test
    void testResolveTableName_environmentWins() {
        TableRegistration registration = new TableRegistration(SimpleItem.class, "SimpleItems");

        assertThat(DynamoDbTableModule.resolveTableName(registration, Map.of())).isEqualTo("SimpleItems");
        assertThat(DynamoDbTableModule.resolveTableName(registration, Map.of("TABLE_SIMPLEITEM", "prod-items")))
                .isEqualTo("prod-items");
    }
}
