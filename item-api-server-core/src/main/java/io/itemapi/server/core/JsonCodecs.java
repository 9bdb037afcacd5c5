package io.itemapi.server.core;

import io.itemapi.json.spi.JsonCodec;
import io.itemapi.json.spi.JsonCodecProvider;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 *
 * <p>The first registered {@link JsonCodecProvider} wins. Add {@code item-api-json-jackson} to the
 * classpath for the default Jackson codec.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    public static JsonCodec discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        for (JsonCodecProvider p : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            JsonCodec codec = p.codec();
            if (codec != null) return codec;
        }
        throw new IllegalStateException("No " + JsonCodecProvider.class.getName()
                + " found on the classpath; add item-api-json-jackson or register a provider");
    }
}
