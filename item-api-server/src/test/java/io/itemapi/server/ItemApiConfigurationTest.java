package io.itemapi.server;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ItemApiConfigurationTest {

    @Test
    void overridesTakePrecedence() {
        ItemApiConfiguration config = ItemApiConfiguration.load(Map.of(
                "item-api.host", "127.0.0.1",
                "item-api.port", "0",
                "item-api.database-path", "/tmp/other.db"));

        assertThat(config.host()).isEqualTo("127.0.0.1");
        assertThat(config.port()).isZero();
        assertThat(config.databasePath()).isEqualTo("/tmp/other.db");
    }

    @Test
    void partialOverridesKeepRemainingValues() {
        ItemApiConfiguration config = ItemApiConfiguration.load(Map.of("item-api.port", "9090"));

        assertThat(config.port()).isEqualTo(9090);
        assertThat(config.databasePath()).isNotBlank();
        assertThat(config.host()).isNotBlank();
    }
}
