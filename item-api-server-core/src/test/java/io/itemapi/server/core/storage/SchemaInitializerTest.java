package io.itemapi.server.core.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SchemaInitializerTest {

    @TempDir
    Path tempDir;

    @Test
    void createsItemsTable() {
        try (StorageHandle storage = StorageHandle.open(tempDir.resolve("schema.db"))) {
            new SchemaInitializer(storage).initialize();

            assertThat(storage.query(
                    "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?",
                    row -> row.getString(1),
                    "items"))
                    .containsExactly("items");
        }
    }

    @Test
    void isIdempotentAndKeepsExistingRows() {
        Path db = tempDir.resolve("schema.db");
        try (StorageHandle storage = StorageHandle.open(db)) {
            new SchemaInitializer(storage).initialize();
            storage.execute("INSERT INTO items (name) VALUES (?)", "apple");
        }

        try (StorageHandle storage = StorageHandle.open(db)) {
            SchemaInitializer initializer = new SchemaInitializer(storage);
            assertThatCode(initializer::initialize).doesNotThrowAnyException();
            assertThatCode(initializer::initialize).doesNotThrowAnyException();

            assertThat(storage.query("SELECT name FROM items", row -> row.getString(1))).containsExactly("apple");
        }
    }

    @Test
    void idsAreNotReusedAfterDelete() {
        try (StorageHandle storage = StorageHandle.open(tempDir.resolve("schema.db"))) {
            new SchemaInitializer(storage).initialize();
            storage.execute("INSERT INTO items (name) VALUES (?)", "apple");
            storage.execute("INSERT INTO items (name) VALUES (?)", "banana");
            storage.execute("DELETE FROM items WHERE id = ?", 2L);

            assertThat(storage.execute("INSERT INTO items (name) VALUES (?)", "cherry").lastInsertId()).isEqualTo(3);
        }
    }
}
