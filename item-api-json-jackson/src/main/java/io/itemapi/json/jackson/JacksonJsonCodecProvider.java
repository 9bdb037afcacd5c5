package io.itemapi.json.jackson;

import io.itemapi.json.spi.JsonCodec;
import io.itemapi.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public String name() {
        return "jackson";
    }

    @Override
    public JsonCodec codec() {
        return new JacksonJsonCodec();
    }
}
