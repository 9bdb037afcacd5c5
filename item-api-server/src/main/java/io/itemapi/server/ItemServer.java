package io.itemapi.server;

import io.itemapi.server.core.HttpMethod;
import io.itemapi.server.core.ItemsHandler;
import io.itemapi.server.core.JsonCodecs;
import io.itemapi.server.core.ResponseBody;
import io.itemapi.server.core.ServerRequest;
import io.itemapi.server.core.ServerResponse;
import io.itemapi.server.core.storage.JdbcItemStore;
import io.itemapi.server.core.storage.SchemaInitializer;
import io.itemapi.server.core.storage.StorageHandle;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the item API on Javalin over a file-backed SQLite store.
 *
 * <p>Startup fails closed: if the store cannot be opened, the schema cannot be created or the
 * port cannot be bound, {@link #start(ItemApiConfiguration)} releases what it acquired and
 * throws. Only {@link #main(String[])} decides to terminate the process.
 */
public final class ItemServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ItemServer.class);

    private final Javalin app;
    private final StorageHandle storage;

    private ItemServer(Javalin app, StorageHandle storage) {
        this.app = app;
        this.storage = storage;
    }

    public static void main(String[] args) {
        ItemServer server;
        try {
            server = start(ItemApiConfiguration.load());
        } catch (RuntimeException e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "item-api-shutdown"));
    }

    /**
     * Opens the store, ensures the schema and starts listening.
     *
     * @throws io.itemapi.server.spi.StorageException if the store cannot be opened or initialized
     * @throws RuntimeException if the HTTP server cannot start
     */
    public static ItemServer start(ItemApiConfiguration config) {
        Objects.requireNonNull(config, "config");
        StorageHandle storage = StorageHandle.open(Path.of(config.databasePath()));
        try {
            new SchemaInitializer(storage).initialize();

            ItemsHandler handler = ItemsHandler.builder(new JdbcItemStore(storage))
                    .codec(JsonCodecs.discover())
                    .build();

            Javalin app = Javalin.create(cfg -> cfg.showJavalinBanner = false);
            app.get("/*", ctx -> handle(ctx, handler));
            app.head("/*", ctx -> handle(ctx, handler));
            app.post("/*", ctx -> handle(ctx, handler));
            app.put("/*", ctx -> handle(ctx, handler));
            app.patch("/*", ctx -> handle(ctx, handler));
            app.delete("/*", ctx -> handle(ctx, handler));
            app.start(config.host(), config.port());

            LOG.info("Server listening on {}:{}", config.host(), app.port());
            return new ItemServer(app, storage);
        } catch (RuntimeException e) {
            storage.close();
            throw e;
        }
    }

    /**
     * Port actually bound, useful when configured with port {@code 0}.
     */
    public int port() {
        return app.port();
    }

    /**
     * Stops accepting requests, then closes the store.
     */
    @Override
    public void close() {
        app.stop();
        storage.close();
    }

    private static void handle(Context ctx, ItemsHandler handler) {
        ServerRequest request = new ServerRequest(
                HttpMethod.valueOf(ctx.method().name()),
                decodedPath(ctx),
                ctx.bodyInputStream());

        ServerResponse response = handler.handle(request);
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.header(e.getKey(), v);
            }
        }

        if (response.body() instanceof ResponseBody.Bytes bytes) {
            ctx.result(bytes.bytes());
        }
    }

    // servlet is mapped at /*, so the decoded path is all path info; the query string never takes part
    private static String decodedPath(Context ctx) {
        String path = ctx.req().getPathInfo();
        return path == null || path.isEmpty() ? "/" : path;
    }
}
