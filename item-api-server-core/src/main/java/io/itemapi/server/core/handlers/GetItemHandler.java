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
import java.util.Optional;

/**
 * {@code GET /items/{id}}.
 */
public final class GetItemHandler implements RequestHandler {
    private final ItemStore store;
    private final JsonCodec codec;

    public GetItemHandler(ItemStore store, JsonCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public ServerResponse handle(ServerRequest request, PathParams params) throws JsonException {
        long id = ItemRequests.parseId(params);

        Optional<Item> item;
        try {
            item = store.find(id);
        } catch (StorageException e) {
            throw new ItemApiException.Internal("Failed to retrieve item", e);
        }
        if (item.isEmpty()) throw new ItemApiException.NotFound("Item not found");
        return ServerResponse.json(200, codec, item.get());
    }
}
