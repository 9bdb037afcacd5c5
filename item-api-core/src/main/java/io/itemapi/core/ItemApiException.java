package io.itemapi.core;

/**
 * Base class for errors that end a request with a non-2xx status.
 *
 * <p>The message is what the client sees, so it must stay short and generic. Server-side detail
 * belongs in the cause.
 */
public abstract class ItemApiException extends RuntimeException {

    protected ItemApiException(String message) {
        super(message);
    }

    protected ItemApiException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * HTTP status this error is reported with.
     */
    public abstract int status();

    /**
     * Raised when the path id or the request body cannot be decoded. Nothing was mutated.
     */
    public static class BadRequest extends ItemApiException {
        public BadRequest(String message) {
            super(message);
        }

        public BadRequest(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public int status() {
            return 400;
        }
    }

    /**
     * Raised when no item matches the requested id.
     */
    public static class NotFound extends ItemApiException {
        public NotFound(String message) {
            super(message);
        }

        @Override
        public int status() {
            return 404;
        }
    }

    /**
     * Raised when the store fails: connectivity loss, constraint violation, I/O failure.
     */
    public static class Internal extends ItemApiException {
        public Internal(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public int status() {
            return 500;
        }
    }
}
