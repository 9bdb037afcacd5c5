package io.itemapi.server.core;

import java.io.InputStream;
import java.util.Objects;

/**
 * Framework-neutral request abstraction.
 *
 * <p>Carries only what routing and the item handlers read. The query string is not part of it.
 *
 * @param method request method
 * @param path percent-decoded request path, e.g. {@code /items/1}
 * @param body request body, may be null when the binding has none
 */
public record ServerRequest(HttpMethod method, String path, InputStream body) {

    public ServerRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
    }
}
