package io.itemapi.server.core.handlers;

import io.itemapi.core.Item;
import io.itemapi.core.ItemApiException;
import io.itemapi.json.spi.JsonCodec;
import io.itemapi.json.spi.JsonException;
import io.itemapi.server.core.PathParams;
import io.itemapi.server.core.RequestHandler;
import io.itemapi.server.core.ServerRequest;
import io.itemapi.server.core.ServerResponse;
import io.itemapi.server.spi.ItemStore;
import io.itemapi.server.spi.StorageException;

import java.util.Objects;

/**
 * {@code PUT /items/{id}}: replaces the name of an existing item.
 *
 * <p>The response id is always the path id, whatever the body carries.
 */
public final class UpdateItemHandler implements RequestHandler {
    private final ItemStore store;
    private final JsonCodec codec;

    public UpdateItemHandler(ItemStore store, JsonCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public ServerResponse handle(ServerRequest request, PathParams params) throws JsonException {
        long id = ItemRequests.parseId(params);
        Item body = ItemRequests.readItem(codec, request);

        boolean updated;
        try {
            updated = store.update(id, body.name());
        } catch (StorageException e) {
            throw new ItemApiException.Internal("Failed to update item", e);
        }
        if (!updated) throw new ItemApiException.NotFound("Item not found");
        return ServerResponse.json(200, codec, body.withId(id));
    }
}
