package com.stratus.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stratus.api.PartitionKey;
import com.stratus.api.SortKey;
import com.stratus.api.TableEntity;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InMemoryTableTest {
    private InMemoryTable<SimpleItem> table;

    @BeforeEach
    void setup() {
        table = new InMemoryTable<>(SimpleItem.class);
    }

    private static <T> T await(Future<T> future) {
        return future.toCompletionStage().toCompletableFuture().join();
    }

    @Test
    void testPutAndGet_success() {
        await(table.put(new SimpleItem("1", "Test")));

        Optional<SimpleItem> result = await(table.get("1"));

        assertThat(result).isPresent();
        assertThat(result.get().id).isEqualTo("1");
        assertThat(result.get().name).isEqualTo("Test");
    }

    @Test
    void testGet_absentKeyIsEmpty() {
        Future<Optional<SimpleItem>> result = table.get("nonexistent");

        assertThat(result.succeeded()).isTrue();
        assertThat(result.result()).isEmpty();
    }

    @Test
    void testPut_overwritesExisting() {
        await(table.put(new SimpleItem("1", "Original")));
        await(table.put(new SimpleItem("1", "Updated")));

        assertThat(await(table.get("1")).map(item -> item.name)).contains("Updated");
        assertThat(await(table.scan())).hasSize(1);
    }

    @Test
    void testPut_nullPartitionKeyFails() {
        Future<Void> result = table.put(new SimpleItem(null, "Orphan"));

        assertThat(result.failed()).isTrue();
        assertThat(result.cause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testDelete_removesItem() {
        await(table.put(new SimpleItem("1", "Test")));
        await(table.delete("1"));

        assertThat(await(table.get("1"))).isEmpty();
    }

    @Test
    void testDelete_missingKeySucceeds() {
        assertThat(table.delete("nonexistent").succeeded()).isTrue();
    }

    @Test
    void testDelete_doesNotAffectKeysWithSamePrefix() {
        await(table.put(new SimpleItem("user1", "A")));
        await(table.put(new SimpleItem("user10", "B")));

        await(table.delete("user1"));

        assertThat(await(table.get("user1"))).isEmpty();
        assertThat(await(table.get("user10"))).isPresent();
    }

    @Test
    void testQuery_returnsMatchingItems() {
        await(table.put(new SimpleItem("pk1", "A")));
        await(table.put(new SimpleItem("pk2", "B")));

        List<SimpleItem> results = await(table.query("pk1"));

        assertThat(results).hasSize(1);
        assertThat(results.get(0).name).isEqualTo("A");
        assertThat(await(table.query("nonexistent"))).isEmpty();
    }

    @Test
    void testScan_returnsSnapshot() {
        await(table.put(new SimpleItem("1", "A")));
        List<SimpleItem> snapshot = await(table.scan());

        await(table.put(new SimpleItem("2", "B")));

        assertThat(snapshot).hasSize(1);
        assertThat(await(table.scan())).hasSize(2);
    }

    @Test
    void testConstructor_missingPartitionKeyThrows() {
        assertThatThrownBy(() -> new InMemoryTable<>(KeylessItem.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("@PartitionKey");
    }

    @Test
    void testConcurrentPuts_allLand() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(200);
        for (int i = 0; i < 200; i++) {
            String id = "item-" + i;
            executor.submit(() -> {
                table.put(new SimpleItem(id, id));
                done.countDown();
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(await(table.scan())).hasSize(200);
    }

    @Nested
    class WithSortKey {
        private InMemoryTable<CompositeItem> composite;

        @BeforeEach
        void setup() {
            composite = new InMemoryTable<>(CompositeItem.class);
        }

        @Test
        void testPutAndGet_bySortKey() {
            await(composite.put(new CompositeItem("user1", "order1", "first")));

            assertThat(await(composite.get("user1", "order1")).map(item -> item.data)).contains("first");
            assertThat(await(composite.get("user1", "order2"))).isEmpty();
        }

        @Test
        void testQuery_returnsWholePartition() {
            await(composite.put(new CompositeItem("user1", "order1", "A")));
            await(composite.put(new CompositeItem("user1", "order2", "B")));
            await(composite.put(new CompositeItem("user2", "order3", "C")));

            List<String> data = await(composite.query("user1")).stream()
                    .map(item -> item.data)
                    .sorted()
                    .collect(Collectors.toList());

            assertThat(data).containsExactly("A", "B");
        }

        @Test
        void testDelete_withSortKeyRemovesSingleItem() {
            await(composite.put(new CompositeItem("user1", "a", "First")));
            await(composite.put(new CompositeItem("user1", "b", "Second")));

            await(composite.delete("user1", "a"));

            assertThat(await(composite.get("user1", "a"))).isEmpty();
            assertThat(await(composite.get("user1", "b"))).isPresent();
        }

        @Test
        void testDelete_byPartitionRemovesEveryItemButNotPrefixPartitions() {
            await(composite.put(new CompositeItem("user1", "a", "1")));
            await(composite.put(new CompositeItem("user1", "b", "2")));
            await(composite.put(new CompositeItem("user10", "a", "3")));

            await(composite.delete("user1"));

            assertThat(await(composite.query("user1"))).isEmpty();
            assertThat(await(composite.query("user10"))).hasSize(1);
        }
    }
}

class SimpleItem implements TableEntity {
    @PartitionKey
    @JsonProperty("id")
    public String id;

    @JsonProperty("name")
    public String name;

    SimpleItem() {
    }

    SimpleItem(String id, String name) {
        this.id = id;
        this.name = name;
    }
}

class CompositeItem implements TableEntity {
    @PartitionKey
    @JsonProperty("pk")
    public String pk;

    @SortKey
    @JsonProperty("sk")
    public String sk;

    @JsonProperty("data")
    public String data;

    CompositeItem() {
    }

    CompositeItem(String pk, String sk, String data) {
        this.pk = pk;
        this.sk = sk;
        this.data = data;
    }
}

class KeylessItem implements TableEntity {
    public String name;
}
