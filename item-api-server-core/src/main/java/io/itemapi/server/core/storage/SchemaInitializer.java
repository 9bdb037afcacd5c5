package io.itemapi.server.core.storage;

import io.itemapi.server.spi.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Ensures the {@code items} table exists. Safe to run against an already initialized store.
 */
public final class SchemaInitializer {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaInitializer.class);

    static final String CREATE_ITEMS_TABLE = "CREATE TABLE IF NOT EXISTS items ("
            + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
            + "name TEXT NOT NULL UNIQUE)";

    private final StorageHandle storage;

    public SchemaInitializer(StorageHandle storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    /**
     * @throws StorageException if the table cannot be created
     */
    public void initialize() {
        try {
            storage.execute(CREATE_ITEMS_TABLE);
        } catch (StorageException e) {
            throw new StorageException("Failed to create table 'items'", e.getCause());
        }
        LOG.info("Table 'items' ensured to exist.");
    }
}
