package com.stratus.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stratus.api.PartitionKey;
import com.stratus.api.TableEntity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EntityKeyReflectorTest {
    private final EntityKeyReflector reflector = new EntityKeyReflector();

    @Test
    void testGetEntityKeys_cachesPerClass() {
        assertThat(reflector.getEntityKeys(SimpleItem.class)).isSameAs(reflector.getEntityKeys(SimpleItem.class));
    }

    @Test
    void testGetEntityKeys_compositeKeys() {
        EntityKeys keys = reflector.getEntityKeys(CompositeItem.class);

        assertThat(keys.getPartitionKey().getAttributeName()).isEqualTo("pk");
        assertThat(keys.getSortKey()).hasValueSatisfying(field -> assertThat(field.getAttributeName()).isEqualTo("sk"));
        assertThat(keys.sortKeyOf(new CompositeItem("u", "s", "d"))).isEqualTo("s");
    }

    @Test
    void testGetEntityKeys_inheritedKeyAndRenamedAttribute() {
        EntityKeys keys = reflector.getEntityKeys(DerivedItem.class);

        assertThat(keys.getPartitionKey().getFieldName()).isEqualTo("key");
        assertThat(keys.getPartitionKey().getAttributeName()).isEqualTo("itemKey");
        assertThat(keys.hasSortKey()).isFalse();
    }

    @Test
    void testPartitionKeyOf_nonStringValue() {
        DerivedItem item = new DerivedItem();
        item.key = 42L;

        assertThat(reflector.getEntityKeys(DerivedItem.class).partitionKeyOf(item)).isEqualTo("42");
    }

    @Test
    void testGetEntityKeys_duplicatePartitionKeyThrows() {
        assertThatThrownBy(() -> reflector.getEntityKeys(TwoKeyItem.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("exactly one @PartitionKey");
    }

    static class BaseItem implements TableEntity {
        @PartitionKey
        @JsonProperty("itemKey")
        Long key;
    }

    static class DerivedItem extends BaseItem {
        String label;
    }

    static class TwoKeyItem implements TableEntity {
        @PartitionKey
        String first;
        @PartitionKey
        String second;
    }
}
