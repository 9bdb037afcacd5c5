package io.itemapi.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for {@link JsonCodec} implementations.
 *
 * <p>Register implementations in {@code META-INF/services/io.itemapi.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Short identifier used in diagnostics, e.g. {@code "jackson"}.
     */
    String name();

    JsonCodec codec();
}
