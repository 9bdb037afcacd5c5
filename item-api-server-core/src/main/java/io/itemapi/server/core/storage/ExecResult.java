package io.itemapi.server.core.storage;

/**
 * Outcome of {@link StorageHandle#execute(String, Object...)}.
 *
 * @param rowsAffected rows changed by the statement
 * @param lastInsertId rowid of the most recent successful insert on the connection; only
 *                     meaningful right after an {@code INSERT}
 */
public record ExecResult(long rowsAffected, long lastInsertId) {}
