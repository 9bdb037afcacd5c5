/**
 * JSON abstraction used by the item API.
 *
 * <p>The server core only talks to {@link io.itemapi.json.spi.JsonCodec}; concrete libraries plug in
 * through {@link io.itemapi.json.spi.JsonCodecProvider}.
 */
package io.itemapi.json.spi;
