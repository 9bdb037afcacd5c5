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

import java.util.List;
import java.util.Objects;

/**
 * {@code GET /items}: every item, as a JSON array. An empty table renders {@code []}.
 */
public final class ListItemsHandler implements RequestHandler {
    private final ItemStore store;
    private final JsonCodec codec;

    public ListItemsHandler(ItemStore store, JsonCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public ServerResponse handle(ServerRequest request, PathParams params) throws JsonException {
        List<Item> items;
        try {
            items = store.list();
        } catch (StorageException e) {
            throw new ItemApiException.Internal("Failed to retrieve items", e);
        }
        return ServerResponse.json(200, codec, items);
    }
}
