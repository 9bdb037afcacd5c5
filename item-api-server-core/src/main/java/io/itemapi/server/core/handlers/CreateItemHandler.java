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
 * {@code POST /items}: inserts the item named in the body and echoes it with the store-assigned id.
 *
 * <p>Any id in the body is ignored. A duplicate name is a store failure like any other (500).
 */
public final class CreateItemHandler implements RequestHandler {
    private final ItemStore store;
    private final JsonCodec codec;

    public CreateItemHandler(ItemStore store, JsonCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public ServerResponse handle(ServerRequest request, PathParams params) throws JsonException {
        Item body = ItemRequests.readItem(codec, request);

        Item created;
        try {
            created = store.create(body.name());
        } catch (StorageException e) {
            throw new ItemApiException.Internal("Failed to create item", e);
        }
        return ServerResponse.json(201, codec, created);
    }
}
