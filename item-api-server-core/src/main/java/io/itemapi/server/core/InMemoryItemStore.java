package io.itemapi.server.core;

import io.itemapi.core.Item;
import io.itemapi.server.spi.ItemStore;
import io.itemapi.server.spi.StorageException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference in-memory {@link ItemStore}.
 *
 * <p>Good for unit tests and examples. Not intended for production. Mirrors the SQLite table:
 * ids increase monotonically and are never reused, names must be non-null and unique, and a
 * violation surfaces as {@link StorageException}. {@link #list()} returns items in id order.
 */
public final class InMemoryItemStore implements ItemStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Item> items = new TreeMap<>();
    private final Set<String> names = new HashSet<>();
    private long lastId;

    @Override
    public List<Item> list() {
        lock.lock();
        try {
            return new ArrayList<>(items.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Item> find(long id) {
        lock.lock();
        try {
            return Optional.ofNullable(items.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Item create(String name) {
        lock.lock();
        try {
            claim(name);
            Item item = new Item(++lastId, name);
            items.put(item.id(), item);
            return item;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean update(long id, String name) {
        lock.lock();
        try {
            Item existing = items.get(id);
            if (existing == null) return false;
            if (!existing.name().equals(name)) {
                claim(name);
                names.remove(existing.name());
            }
            items.put(id, new Item(id, name));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(long id) {
        lock.lock();
        try {
            Item removed = items.remove(id);
            if (removed == null) return false;
            names.remove(removed.name());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void claim(String name) {
        if (name == null) throw new StorageException("NOT NULL constraint failed: items.name");
        if (!names.add(name)) throw new StorageException("UNIQUE constraint failed: items.name");
    }
}
