package io.itemapi.server.core.handlers;

import io.itemapi.core.Item;
import io.itemapi.core.ItemApiException;
import io.itemapi.core.Protocol;
import io.itemapi.json.spi.JsonCodec;
import io.itemapi.json.spi.JsonException;
import io.itemapi.server.core.PathParams;
import io.itemapi.server.core.ServerRequest;

/**
 * Request decoding shared by the item handlers.
 */
final class ItemRequests {
    private ItemRequests() {}

    static long parseId(PathParams params) {
        String raw = params.require(Protocol.P_ID);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ItemApiException.BadRequest("Invalid item ID", e);
        }
    }

    static Item readItem(JsonCodec codec, ServerRequest request) {
        if (request.body() == null) throw new ItemApiException.BadRequest("Invalid request body");
        try {
            return codec.readValue(request.body(), Item.class);
        } catch (JsonException e) {
            throw new ItemApiException.BadRequest("Invalid request body", e);
        }
    }
}
