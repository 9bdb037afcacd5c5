package io.itemapi.server.core;

import io.itemapi.core.ItemApiException;
import io.itemapi.core.Protocol;
import io.itemapi.json.spi.JsonCodec;
import io.itemapi.server.core.handlers.CreateItemHandler;
import io.itemapi.server.core.handlers.DeleteItemHandler;
import io.itemapi.server.core.handlers.GetItemHandler;
import io.itemapi.server.core.handlers.ListItemsHandler;
import io.itemapi.server.core.handlers.UpdateItemHandler;
import io.itemapi.server.spi.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Framework-neutral HTTP handler for the item resource.
 *
 * <p>Routes each request to one of the five resource handlers and is the single error boundary:
 * every failure is turned into exactly one status with a short plaintext body, and nothing is
 * rethrown to the hosting framework.
 *
 * <pre>{@code
 * ItemsHandler handler = ItemsHandler.builder(store)
 *     .codec(new JacksonJsonCodec())
 *     .build();
 * ServerResponse response = handler.handle(request);
 * }</pre>
 */
public final class ItemsHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ItemsHandler.class);

    private final Router router;

    /**
     * Creates a new builder for configuring a handler.
     *
     * @param store the item store (required)
     * @return a new builder instance
     */
    public static Builder builder(ItemStore store) {
        return new Builder(store);
    }

    public ItemsHandler(ItemStore store) {
        this(builder(store));
    }

    private ItemsHandler(Builder builder) {
        ItemStore store = Objects.requireNonNull(builder.store, "store");
        JsonCodec codec = builder.codec != null ? builder.codec : JsonCodecs.discover();
        this.router = new Router()
                .route(HttpMethod.GET, Protocol.ITEMS_PATH, new ListItemsHandler(store, codec))
                .route(HttpMethod.POST, Protocol.ITEMS_PATH, new CreateItemHandler(store, codec))
                .route(HttpMethod.GET, Protocol.ITEM_PATH, new GetItemHandler(store, codec))
                .route(HttpMethod.PUT, Protocol.ITEM_PATH, new UpdateItemHandler(store, codec))
                .route(HttpMethod.DELETE, Protocol.ITEM_PATH, new DeleteItemHandler(store));
    }

    /**
     * Builder for {@link ItemsHandler}.
     */
    public static final class Builder {
        private final ItemStore store;
        private JsonCodec codec;

        private Builder(ItemStore store) {
            this.store = Objects.requireNonNull(store, "store");
        }

        /** Sets the JSON codec. Default: the first one found by {@link JsonCodecs#discover()}. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Builds the handler with the configured settings. */
        public ItemsHandler build() {
            return new ItemsHandler(this);
        }
    }

    public ServerResponse handle(ServerRequest req) {
        String path = req.path();
        try {
            Router.Resolution resolution = router.resolve(req.method(), path);
            if (resolution instanceof Router.Resolution.NotFound) {
                return ServerResponse.text(404, "404 page not found");
            }
            if (resolution instanceof Router.Resolution.MethodNotAllowed notAllowed) {
                String allow = notAllowed.allowed().stream()
                        .map(Enum::name)
                        .collect(Collectors.joining(", "));
                return ServerResponse.text(405, "Method Not Allowed").header(Protocol.H_ALLOW, allow);
            }

            Router.Resolution.Found found = (Router.Resolution.Found) resolution;
            ServerResponse resp = found.handler().handle(req, found.params());
            if (req.method() == HttpMethod.HEAD) {
                return resp.withBody(new ResponseBody.Empty());
            }
            return resp;
        } catch (ItemApiException e) {
            if (e.status() >= 500) {
                LOG.error("{} {}: {}", req.method(), path, e.getMessage(), e.getCause());
            } else {
                LOG.debug("{} {} rejected with {}: {}", req.method(), path, e.status(), e.getMessage());
            }
            return ServerResponse.text(e.status(), e.getMessage());
        } catch (Exception e) {
            LOG.error("{} {}: unexpected failure", req.method(), path, e);
            return ServerResponse.text(500, "Internal server error");
        }
    }
}
