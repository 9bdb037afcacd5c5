package io.itemapi.server.core;

import io.itemapi.core.Item;
import io.itemapi.server.spi.ItemStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryItemStoreTest extends AbstractItemStoreTest {

    private final InMemoryItemStore store = new InMemoryItemStore();

    @Override
    protected ItemStore store() {
        return store;
    }

    @Test
    void listsInIdOrder() {
        store.create("cherry");
        store.create("apple");
        store.create("banana");

        assertThat(store.list()).containsExactly(
                new Item(1, "cherry"),
                new Item(2, "apple"),
                new Item(3, "banana"));
    }
}
