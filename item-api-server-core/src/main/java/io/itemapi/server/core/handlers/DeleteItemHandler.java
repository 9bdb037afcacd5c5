package io.itemapi.server.core.handlers;

import io.itemapi.core.ItemApiException;
import io.itemapi.server.core.PathParams;
import io.itemapi.server.core.RequestHandler;
import io.itemapi.server.core.ServerRequest;
import io.itemapi.server.core.ServerResponse;
import io.itemapi.server.spi.ItemStore;
import io.itemapi.server.spi.StorageException;

import java.util.Objects;

/**
 * {@code DELETE /items/{id}}: 204 with an empty body on success.
 */
public final class DeleteItemHandler implements RequestHandler {
    private final ItemStore store;

    public DeleteItemHandler(ItemStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public ServerResponse handle(ServerRequest request, PathParams params) {
        long id = ItemRequests.parseId(params);

        boolean deleted;
        try {
            deleted = store.delete(id);
        } catch (StorageException e) {
            throw new ItemApiException.Internal("Failed to delete item", e);
        }
        if (!deleted) throw new ItemApiException.NotFound("Item not found");
        return ServerResponse.noContent();
    }
}
