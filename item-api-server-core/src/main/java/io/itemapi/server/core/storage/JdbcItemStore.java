package io.itemapi.server.core.storage;

import io.itemapi.core.Item;
import io.itemapi.server.spi.ItemStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ItemStore} issuing one SQL statement per operation through a {@link StorageHandle}.
 *
 * <p>{@link #list()} has no {@code ORDER BY}; row order is whatever SQLite returns.
 */
public final class JdbcItemStore implements ItemStore {
    private static final RowMapper<Item> ITEM = row -> new Item(row.getLong("id"), row.getString("name"));

    private final StorageHandle storage;

    public JdbcItemStore(StorageHandle storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    @Override
    public List<Item> list() {
        return storage.query("SELECT id, name FROM items", ITEM);
    }

    @Override
    public Optional<Item> find(long id) {
        List<Item> rows = storage.query("SELECT id, name FROM items WHERE id = ?", ITEM, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public Item create(String name) {
        ExecResult res = storage.execute("INSERT INTO items (name) VALUES (?)", name);
        return new Item(res.lastInsertId(), name);
    }

    @Override
    public boolean update(long id, String name) {
        return storage.execute("UPDATE items SET name = ? WHERE id = ?", name, id).rowsAffected() > 0;
    }

    @Override
    public boolean delete(long id) {
        return storage.execute("DELETE FROM items WHERE id = ?", id).rowsAffected() > 0;
    }
}
