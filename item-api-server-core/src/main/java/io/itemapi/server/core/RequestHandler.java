package io.itemapi.server.core;

/**
 * Handles one routed request.
 *
 * <p>Implementations report client-visible failures by throwing
 * {@link io.itemapi.core.ItemApiException}; {@link ItemsHandler} maps every exception to a status.
 */
@FunctionalInterface
public interface RequestHandler {

    ServerResponse handle(ServerRequest request, PathParams params) throws Exception;
}
