package io.itemapi.server.spi;

import io.itemapi.core.Item;

import java.util.List;
import java.util.Optional;

/**
 * Persistence abstraction for items.
 *
 * <p>This SPI is intentionally minimal and blocking. Each operation maps to a single statement
 * against the backing store. Failures of the store surface as {@link StorageException}; there is
 * no distinct conflict outcome for a duplicate name.
 */
public interface ItemStore {

    /**
     * All items in store order. Empty list when there are none.
     */
    List<Item> list();

    /**
     * Item with the given id, if any.
     */
    Optional<Item> find(long id);

    /**
     * Insert a new item.
     *
     * @param name item name; must be unique
     * @return the stored item carrying the store-assigned id
     */
    Item create(String name);

    /**
     * Replace the name of an existing item.
     *
     * @return true if a row was updated; false if no item has this id
     */
    boolean update(long id, String name);

    /**
     * Delete an item.
     *
     * @return true if deleted; false if not found
     */
    boolean delete(long id);
}
