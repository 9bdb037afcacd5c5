package io.itemapi.core;

/**
 * The single resource exposed by the service: an {@code (id, name)} pair.
 *
 * <p>On the wire an item is {@code {"id": <integer>, "name": <string>}}. The id is assigned by the
 * store; an id supplied by a client is ignored on create and replaced by the path id on update.
 *
 * @param id store-assigned identifier (0 when not yet assigned)
 * @param name unique item name (may be null when decoded from an incomplete request body)
 */
public record Item(long id, String name) {

    /**
     * Returns a copy of this item carrying the given id.
     */
    public Item withId(long newId) {
        return new Item(newId, name);
    }
}
