package io.itemapi.server.core;

import io.itemapi.core.Item;
import io.itemapi.server.spi.ItemStore;
import io.itemapi.server.spi.StorageException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behavior every {@link ItemStore} shares.
 */
public abstract class AbstractItemStoreTest {

    protected abstract ItemStore store();

    @Test
    public void emptyStoreListsNothing() {
        assertThat(store().list()).isEmpty();
        assertThat(store().find(1)).isEmpty();
    }

    @Test
    public void createAssignsIncreasingIds() {
        Item apple = store().create("apple");
        Item banana = store().create("banana");

        assertThat(apple).isEqualTo(new Item(1, "apple"));
        assertThat(banana).isEqualTo(new Item(2, "banana"));
        assertThat(store().find(2)).contains(banana);
        assertThat(store().list()).containsExactlyInAnyOrder(apple, banana);
    }

    @Test
    public void duplicateNameFails() {
        store().create("apple");
        assertThatThrownBy(() -> store().create("apple")).isInstanceOf(StorageException.class);
        assertThat(store().list()).hasSize(1);
    }

    @Test
    public void nullNameFails() {
        assertThatThrownBy(() -> store().create(null)).isInstanceOf(StorageException.class);
        assertThat(store().list()).isEmpty();
    }

    @Test
    public void updateReplacesNameOnly() {
        Item apple = store().create("apple");

        assertThat(store().update(apple.id(), "avocado")).isTrue();
        assertThat(store().find(apple.id())).contains(new Item(apple.id(), "avocado"));
        assertThat(store().update(apple.id(), "avocado")).isTrue();
    }

    @Test
    public void updateMissingIdReportsFalse() {
        assertThat(store().update(42, "ghost")).isFalse();
        assertThat(store().list()).isEmpty();
    }

    @Test
    public void updateToTakenNameFails() {
        store().create("apple");
        Item banana = store().create("banana");

        assertThatThrownBy(() -> store().update(banana.id(), "apple")).isInstanceOf(StorageException.class);
        assertThat(store().find(banana.id())).contains(banana);
    }

    @Test
    public void deleteRemovesAndReleasesName() {
        Item apple = store().create("apple");

        assertThat(store().delete(apple.id())).isTrue();
        assertThat(store().delete(apple.id())).isFalse();
        assertThat(store().find(apple.id())).isEmpty();

        Item again = store().create("apple");
        assertThat(again.id()).isGreaterThan(apple.id());
    }
}
