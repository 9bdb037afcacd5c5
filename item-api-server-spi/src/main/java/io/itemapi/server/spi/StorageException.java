package io.itemapi.server.spi;

/**
 * Failure of the backing store: connectivity loss, constraint violation or I/O error.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
