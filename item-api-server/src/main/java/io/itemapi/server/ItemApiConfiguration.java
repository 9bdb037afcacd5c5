package io.itemapi.server;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.WithDefault;

import java.util.Map;

/**
 * Configuration properties for the item API server.
 *
 * <p>Read from system properties, environment variables and
 * {@code META-INF/microprofile-config.properties}:
 * <pre>
 * item-api.host=0.0.0.0
 * item-api.port=8080
 * item-api.database-path=api.db
 * </pre>
 */
@ConfigMapping(prefix = "item-api")
public interface ItemApiConfiguration {

    /**
     * Address the HTTP server binds to.
     */
    @WithDefault("0.0.0.0")
    String host();

    /**
     * Port the HTTP server binds to. {@code 0} picks a free port.
     */
    @WithDefault("8080")
    int port();

    /**
     * SQLite database file.
     */
    @WithDefault("api.db")
    String databasePath();

    static ItemApiConfiguration load() {
        return load(Map.of());
    }

    /**
     * Loads the configuration with {@code overrides} taking precedence over every other source.
     */
    static ItemApiConfiguration load(Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "overrides", 500))
                .withMapping(ItemApiConfiguration.class)
                .build();
        return config.getConfigMapping(ItemApiConfiguration.class);
    }
}
